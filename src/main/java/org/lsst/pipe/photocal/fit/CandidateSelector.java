package org.lsst.pipe.photocal.fit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.lsst.pipe.photocal.catalog.MatchedPair;
import org.lsst.pipe.photocal.catalog.ReferenceRecord;
import org.lsst.pipe.photocal.catalog.SourceRecord;

/**
 * Selects the matched pairs usable for calibration. A pair is a candidate if
 * both its instrumental and reference fluxes are finite and positive, the
 * source has none of the bad flags set, the reference magnitude is brighter
 * than the magnitude limit, and the extra predicate accepts it. With the
 * short constructor only the flux test applies.
 * <p>
 * Rejected pairs are not an error, they are simply left out. The selection
 * keeps the input order, and a source matched more than once is only taken
 * from its first pair.
 *
 * @author tonyj
 */
public class CandidateSelector {

    /**
     * Accepts pairs whose reference star is neither resolved nor variable.
     */
    public static final Predicate<MatchedPair> POINT_SOURCES = (pair) -> !pair.getReference().isResolved() && !pair.getReference().isVariable();

    private static final Logger LOG = Logger.getLogger(CandidateSelector.class.getName());

    private final String fluxField;
    private final String fluxErrField;
    private final ReferenceMagnitudes referenceMagnitudes;
    private final List<String> badFlags;
    private final double magLimit;
    private final Predicate<MatchedPair> predicate;

    public CandidateSelector(String fluxField, ReferenceMagnitudes referenceMagnitudes) {
        this(fluxField, referenceMagnitudes, Collections.emptyList(), Double.NaN, (pair) -> true);
    }

    public CandidateSelector(String fluxField, ReferenceMagnitudes referenceMagnitudes, List<String> badFlags, double magLimit, Predicate<MatchedPair> predicate) {
        this.fluxField = fluxField;
        this.fluxErrField = fluxField + "Sigma";
        this.referenceMagnitudes = referenceMagnitudes;
        this.badFlags = badFlags;
        this.magLimit = magLimit;
        this.predicate = predicate;
    }

    public List<Candidate> select(List<MatchedPair> pairs) {
        List<Candidate> result = new ArrayList<>();
        Set<Long> seen = new HashSet<>();
        int rejectedFlux = 0;
        int rejectedFlags = 0;
        int rejectedMag = 0;
        int rejectedPredicate = 0;
        for (MatchedPair pair : pairs) {
            SourceRecord source = pair.getSource();
            ReferenceRecord reference = pair.getReference();
            double flux = source.get(fluxField, Double.NaN);
            double refMag = referenceMagnitudes.magnitude(reference);
            if (!Magnitudes.isPositive(flux) || Double.isNaN(refMag)) {
                rejectedFlux++;
                continue;
            }
            if (hasBadFlag(source)) {
                rejectedFlags++;
                continue;
            }
            if (refMag >= magLimit) {
                rejectedMag++;
                continue;
            }
            if (!predicate.test(pair)) {
                rejectedPredicate++;
                continue;
            }
            if (!seen.add(source.getId())) {
                LOG.log(Level.FINE, "Source {0} matched more than once, keeping first match", source.getId());
                continue;
            }
            double srcMagErr = Magnitudes.magErrFromFluxErr(flux, source.get(fluxErrField, Double.NaN));
            result.add(new Candidate(pair, Magnitudes.instMagFromFlux(flux), srcMagErr, refMag, referenceMagnitudes.magnitudeError(reference)));
        }
        LOG.log(Level.FINE, "Selected {0} of {1} matches (rejected {2} for flux, {3} for flags, {4} for magnitude limit, {5} by predicate)",
                new Object[]{result.size(), pairs.size(), rejectedFlux, rejectedFlags, rejectedMag, rejectedPredicate});
        return result;
    }

    private boolean hasBadFlag(SourceRecord source) {
        for (String flag : badFlags) {
            if (source.getFlag(flag)) {
                return true;
            }
        }
        return false;
    }
}
