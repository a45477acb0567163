package org.lsst.pipe.photocal.catalog;

/**
 * The per-source flags written by the photometric calibration.
 *
 * @author tonyj
 */
public enum PhotometryFlag {

    CANDIDATE("calib_photometryCandidate"),
    USED("calib_photometryUsed"),
    RESERVED("calib_photometryReserved");

    private final String fieldName;

    PhotometryFlag(String fieldName) {
        this.fieldName = fieldName;
    }

    /**
     * The catalog column name of this flag.
     *
     * @return The field name, e.g. <code>calib_photometryUsed</code>
     */
    public String getFieldName() {
        return fieldName;
    }

    public static PhotometryFlag forFieldName(String fieldName) {
        for (PhotometryFlag flag : values()) {
            if (flag.fieldName.equals(fieldName)) {
                return flag;
            }
        }
        throw new IllegalArgumentException("Not a photometry flag: " + fieldName);
    }
}
