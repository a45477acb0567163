package org.lsst.pipe.photocal.catalog;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable set of photometry flags for one source. Only the four legal
 * combinations can be constructed: none, candidate, candidate+used and
 * candidate+reserved.
 *
 * @author tonyj
 */
public final class PhotometryFlags {

    public static final PhotometryFlags NONE = new PhotometryFlags(false, false, false);
    public static final PhotometryFlags CANDIDATE = new PhotometryFlags(true, false, false);
    public static final PhotometryFlags USED = new PhotometryFlags(true, true, false);
    public static final PhotometryFlags RESERVED = new PhotometryFlags(true, false, true);

    private final boolean candidate;
    private final boolean used;
    private final boolean reserved;

    private PhotometryFlags(boolean candidate, boolean used, boolean reserved) {
        this.candidate = candidate;
        this.used = used;
        this.reserved = reserved;
    }

    public static PhotometryFlags of(boolean candidate, boolean used, boolean reserved) {
        if ((used || reserved) && !candidate) {
            throw new IllegalArgumentException("used or reserved source must be a candidate");
        }
        if (used && reserved) {
            throw new IllegalArgumentException("source cannot be both used and reserved");
        }
        if (!candidate) {
            return NONE;
        } else if (used) {
            return USED;
        } else if (reserved) {
            return RESERVED;
        } else {
            return CANDIDATE;
        }
    }

    public boolean isCandidate() {
        return candidate;
    }

    public boolean isUsed() {
        return used;
    }

    public boolean isReserved() {
        return reserved;
    }

    public boolean get(PhotometryFlag flag) {
        switch (flag) {
            case CANDIDATE:
                return candidate;
            case USED:
                return used;
            case RESERVED:
                return reserved;
            default:
                throw new IllegalArgumentException("Unknown flag " + flag);
        }
    }

    public Set<PhotometryFlag> asSet() {
        EnumSet<PhotometryFlag> result = EnumSet.noneOf(PhotometryFlag.class);
        for (PhotometryFlag flag : PhotometryFlag.values()) {
            if (get(flag)) {
                result.add(flag);
            }
        }
        return Collections.unmodifiableSet(result);
    }

    @Override
    public int hashCode() {
        return Objects.hash(candidate, used, reserved);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final PhotometryFlags other = (PhotometryFlags) obj;
        return candidate == other.candidate && used == other.used && reserved == other.reserved;
    }

    @Override
    public String toString() {
        return "PhotometryFlags" + asSet();
    }
}
