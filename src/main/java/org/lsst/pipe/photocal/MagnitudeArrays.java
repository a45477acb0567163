package org.lsst.pipe.photocal;

import java.util.Collections;
import java.util.List;

/**
 * Magnitudes of the sources used in the fit, index aligned with
 * {@link PhotoCalResult#getMatches()}.
 *
 * @author tonyj
 */
public final class MagnitudeArrays {

    private final double[] srcMag;
    private final double[] srcMagErr;
    private final double[] refMag;
    private final double[] refMagErr;
    private final List<String> refFluxFieldList;

    MagnitudeArrays(double[] srcMag, double[] srcMagErr, double[] refMag, double[] refMagErr, List<String> refFluxFieldList) {
        this.srcMag = srcMag;
        this.srcMagErr = srcMagErr;
        this.refMag = refMag;
        this.refMagErr = refMagErr;
        this.refFluxFieldList = Collections.unmodifiableList(refFluxFieldList);
    }

    /** Instrumental magnitudes, <code>-2.5 log10(flux)</code>. */
    public double[] getSrcMag() {
        return srcMag.clone();
    }

    public double[] getSrcMagErr() {
        return srcMagErr.clone();
    }

    /** Reference magnitudes, color term corrected if enabled. */
    public double[] getRefMag() {
        return refMag.clone();
    }

    public double[] getRefMagErr() {
        return refMagErr.clone();
    }

    /** The reference flux fields used, primary first. */
    public List<String> getRefFluxFieldList() {
        return refFluxFieldList;
    }

    public int size() {
        return srcMag.length;
    }
}
