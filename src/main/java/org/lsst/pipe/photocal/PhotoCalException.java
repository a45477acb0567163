package org.lsst.pipe.photocal;

/**
 * Base class for failures of the photometric calibration. These are
 * structural (bad configuration or bad data) and never transient, so they are
 * unchecked.
 *
 * @author tonyj
 */
public class PhotoCalException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public PhotoCalException(String message) {
        super(message);
    }

    public PhotoCalException(String message, Throwable cause) {
        super(message, cause);
    }
}
