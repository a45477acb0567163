package org.lsst.pipe.photocal.catalog;

import java.util.Objects;

/**
 * A reference star matched to a detected source, as produced by an external
 * matcher.
 *
 * @author tonyj
 */
public final class MatchedPair {

    private final ReferenceRecord reference;
    private final SourceRecord source;
    private final double distance;

    public MatchedPair(ReferenceRecord reference, SourceRecord source, double distance) {
        this.reference = Objects.requireNonNull(reference);
        this.source = Objects.requireNonNull(source);
        this.distance = distance;
    }

    public ReferenceRecord getReference() {
        return reference;
    }

    public SourceRecord getSource() {
        return source;
    }

    public double getDistance() {
        return distance;
    }

    @Override
    public String toString() {
        return "MatchedPair{" + "reference=" + reference.getId() + ", source=" + source.getId() + ", distance=" + distance + '}';
    }
}
