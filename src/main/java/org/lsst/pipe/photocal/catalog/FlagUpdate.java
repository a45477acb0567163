package org.lsst.pipe.photocal.catalog;

import java.util.Objects;

/**
 * The photometry flags to be written to one row of a source catalog.
 *
 * @author tonyj
 */
public final class FlagUpdate {

    private final long sourceId;
    private final PhotometryFlags flags;

    public FlagUpdate(long sourceId, PhotometryFlags flags) {
        this.sourceId = sourceId;
        this.flags = Objects.requireNonNull(flags);
    }

    public long getSourceId() {
        return sourceId;
    }

    public PhotometryFlags getFlags() {
        return flags;
    }

    @Override
    public int hashCode() {
        return 31 * Long.hashCode(sourceId) + flags.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final FlagUpdate other = (FlagUpdate) obj;
        return sourceId == other.sourceId && flags.equals(other.flags);
    }

    @Override
    public String toString() {
        return "FlagUpdate{" + "sourceId=" + sourceId + ", flags=" + flags + '}';
    }
}
