package org.lsst.pipe.photocal;

/**
 * Thrown when too few sources survive selection or outlier rejection to
 * compute a zero point.
 *
 * @author tonyj
 */
public class InsufficientDataException extends PhotoCalException {

    private static final long serialVersionUID = 1L;

    private final int available;
    private final int required;

    public InsufficientDataException(String message, int available, int required) {
        super(message + " (have " + available + ", need " + required + ")");
        this.available = available;
        this.required = required;
    }

    public int getAvailable() {
        return available;
    }

    public int getRequired() {
        return required;
    }
}
