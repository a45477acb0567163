package org.lsst.pipe.photocal.fit;

import org.lsst.pipe.photocal.catalog.MatchedPair;

/**
 * A matched pair accepted for calibration, with its magnitudes.
 *
 * @author tonyj
 */
public final class Candidate {

    private final MatchedPair pair;
    private final double srcMag;
    private final double srcMagErr;
    private final double refMag;
    private final double refMagErr;

    public Candidate(MatchedPair pair, double srcMag, double srcMagErr, double refMag, double refMagErr) {
        this.pair = pair;
        this.srcMag = srcMag;
        this.srcMagErr = srcMagErr;
        this.refMag = refMag;
        this.refMagErr = refMagErr;
    }

    public MatchedPair getPair() {
        return pair;
    }

    public long getSourceId() {
        return pair.getSource().getId();
    }

    /** Instrumental magnitude of the source. */
    public double getSrcMag() {
        return srcMag;
    }

    public double getSrcMagErr() {
        return srcMagErr;
    }

    public double getRefMag() {
        return refMag;
    }

    public double getRefMagErr() {
        return refMagErr;
    }

    /** The zero point this source alone implies, <code>refMag - srcMag</code>. */
    public double getResidual() {
        return refMag - srcMag;
    }

    @Override
    public String toString() {
        return "Candidate{" + "pair=" + pair + ", srcMag=" + srcMag + ", refMag=" + refMag + '}';
    }
}
