package org.lsst.pipe.photocal;

import java.util.Collections;
import java.util.List;
import org.lsst.pipe.photocal.catalog.FlagUpdate;
import org.lsst.pipe.photocal.catalog.MatchedPair;
import org.lsst.pipe.photocal.catalog.SourceCatalog;
import org.lsst.pipe.photocal.fit.Magnitudes;

/**
 * The outcome of a photometric calibration: the zero point, the matches used
 * to derive it, and the photometry flags to be written to the source catalog.
 *
 * @author tonyj
 */
public final class PhotoCalResult {

    private final double zeroPoint;
    private final double zeroPointError;
    private final List<MatchedPair> matches;
    private final List<MatchedPair> reserved;
    private final MagnitudeArrays arrays;
    private final List<FlagUpdate> flagUpdates;
    private final int candidateCount;

    PhotoCalResult(double zeroPoint, double zeroPointError, List<MatchedPair> matches, List<MatchedPair> reserved,
            MagnitudeArrays arrays, List<FlagUpdate> flagUpdates, int candidateCount) {
        this.zeroPoint = zeroPoint;
        this.zeroPointError = zeroPointError;
        this.matches = Collections.unmodifiableList(matches);
        this.reserved = Collections.unmodifiableList(reserved);
        this.arrays = arrays;
        this.flagUpdates = Collections.unmodifiableList(flagUpdates);
        this.candidateCount = candidateCount;
    }

    /**
     * The zero point: the calibrated magnitude of a source with unit
     * instrumental flux.
     */
    public double getZeroPoint() {
        return zeroPoint;
    }

    public double getZeroPointError() {
        return zeroPointError;
    }

    /**
     * Calibrated magnitude of an instrumental flux.
     */
    public double getMagnitude(double instFlux) {
        return Magnitudes.instMagFromFlux(instFlux) + zeroPoint;
    }

    /**
     * The instrumental flux of a zero magnitude source.
     */
    public double getFluxMag0() {
        return Math.pow(10, 0.4 * zeroPoint);
    }

    public double getFluxMag0Err() {
        return getFluxMag0() * 0.4 * Math.log(10) * zeroPointError;
    }

    /** The matches used in the fit, in input order. */
    public List<MatchedPair> getMatches() {
        return matches;
    }

    /** The matches held out of the fit, in input order. */
    public List<MatchedPair> getReserved() {
        return reserved;
    }

    public MagnitudeArrays getArrays() {
        return arrays;
    }

    /** One update per candidate; sources not listed carry no photometry flags. */
    public List<FlagUpdate> getFlagUpdates() {
        return flagUpdates;
    }

    public int getCandidateCount() {
        return candidateCount;
    }

    public int getUsedCount() {
        return matches.size();
    }

    public int getReservedCount() {
        return reserved.size();
    }

    /**
     * Write the photometry flags of this result to a catalog, first clearing
     * any flags left by an earlier calibration.
     *
     * @param catalog The catalog the calibrated sources came from
     */
    public void applyTo(SourceCatalog catalog) {
        catalog.applyFlagUpdates(flagUpdates);
    }

    @Override
    public String toString() {
        return "PhotoCalResult{" + "zeroPoint=" + zeroPoint + ", zeroPointError=" + zeroPointError
                + ", candidates=" + candidateCount + ", used=" + matches.size() + ", reserved=" + reserved.size() + '}';
    }
}
