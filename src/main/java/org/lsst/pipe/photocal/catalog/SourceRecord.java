package org.lsst.pipe.photocal.catalog;

import java.util.Collections;
import java.util.Map;

/**
 * A detected source. Its measurements are fixed, its photometry flags are
 * written by the calibration.
 *
 * @author tonyj
 */
public class SourceRecord extends Record {

    private PhotometryFlags photometryFlags = PhotometryFlags.NONE;

    public SourceRecord(long id, Map<String, Double> fields) {
        this(id, fields, Collections.emptyMap());
    }

    public SourceRecord(long id, Map<String, Double> fields, Map<String, Boolean> flags) {
        super(id, fields, flags);
    }

    public SourceRecord(long id, Map<String, Double> fields, Map<String, Long> longFields, Map<String, Boolean> flags) {
        super(id, fields, longFields, flags);
    }

    @Override
    public boolean getFlag(String name) {
        for (PhotometryFlag flag : PhotometryFlag.values()) {
            if (flag.getFieldName().equals(name)) {
                return photometryFlags.get(flag);
            }
        }
        return super.getFlag(name);
    }

    public boolean get(PhotometryFlag flag) {
        return photometryFlags.get(flag);
    }

    public PhotometryFlags getPhotometryFlags() {
        return photometryFlags;
    }

    void setPhotometryFlags(PhotometryFlags photometryFlags) {
        this.photometryFlags = photometryFlags;
    }
}
