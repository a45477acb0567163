package org.lsst.pipe.photocal;

/**
 * Thrown when the calibration is misconfigured, for example when the
 * photometric catalog name matches no (or several) color term library
 * entries, or when the reserve fraction is out of range. Always raised before
 * any catalog flags are modified.
 *
 * @author tonyj
 */
public class ConfigurationException extends PhotoCalException {

    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
