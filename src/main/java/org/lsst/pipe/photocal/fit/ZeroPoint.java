package org.lsst.pipe.photocal.fit;

import java.util.Collections;
import java.util.List;

/**
 * The result of a zero point fit.
 *
 * @author tonyj
 */
public final class ZeroPoint {

    private final double zeroPoint;
    private final double sigma;
    private final List<Candidate> used;
    private final boolean weighted;
    private final int iterations;

    ZeroPoint(double zeroPoint, double sigma, List<Candidate> used, boolean weighted, int iterations) {
        this.zeroPoint = zeroPoint;
        this.sigma = sigma;
        this.used = Collections.unmodifiableList(used);
        this.weighted = weighted;
        this.iterations = iterations;
    }

    /**
     * The magnitude of a source with unit instrumental flux.
     */
    public double getZeroPoint() {
        return zeroPoint;
    }

    public double getSigma() {
        return sigma;
    }

    /**
     * The candidates that survived outlier rejection, in fit set order.
     */
    public List<Candidate> getUsed() {
        return used;
    }

    /**
     * True if the zero point is an inverse variance weighted mean, false if
     * some magnitude errors were unavailable and a plain mean was used.
     */
    public boolean isWeighted() {
        return weighted;
    }

    public int getIterations() {
        return iterations;
    }

    @Override
    public String toString() {
        return "ZeroPoint{" + "zeroPoint=" + zeroPoint + ", sigma=" + sigma + ", nUsed=" + used.size() + ", weighted=" + weighted + '}';
    }
}
