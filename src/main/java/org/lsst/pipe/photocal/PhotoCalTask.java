package org.lsst.pipe.photocal;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.lsst.pipe.photocal.catalog.FlagUpdate;
import org.lsst.pipe.photocal.catalog.MatchedPair;
import org.lsst.pipe.photocal.catalog.PhotometryFlags;
import org.lsst.pipe.photocal.catalog.ReferenceCatalog;
import org.lsst.pipe.photocal.catalog.SourceCatalog;
import org.lsst.pipe.photocal.colorterm.Colorterm;
import org.lsst.pipe.photocal.fit.Candidate;
import org.lsst.pipe.photocal.fit.CandidateSelector;
import org.lsst.pipe.photocal.fit.ColorCorrectedReferenceMagnitudes;
import org.lsst.pipe.photocal.fit.DirectReferenceMagnitudes;
import org.lsst.pipe.photocal.fit.ReferenceMagnitudes;
import org.lsst.pipe.photocal.fit.ReservationSampler;
import org.lsst.pipe.photocal.fit.ZeroPoint;
import org.lsst.pipe.photocal.fit.ZeroPointFitter;
import org.lsst.pipe.photocal.match.ReferenceObjectLoader;
import org.lsst.pipe.photocal.match.SourceMatcher;
import org.lsst.pipe.photocal.util.Timed;

/**
 * Computes the photometric zero point of an exposure.
 * <p>
 * The sources of the exposure are matched to a reference catalog, the usable
 * matches are selected as candidates, a fraction of the candidates may be
 * reserved for validation, and the zero point is fitted to the rest with
 * outlier rejection. Every candidate is flagged
 * <code>calib_photometryCandidate</code>, and additionally either
 * <code>calib_photometryUsed</code> if it survived the fit or
 * <code>calib_photometryReserved</code> if it was held out.
 * <p>
 * A task may be run many times, but not concurrently on the same catalog.
 *
 * @author tonyj
 */
public class PhotoCalTask {

    /**
     * The stages of a calibration, in order.
     */
    public enum Stage {
        INIT, SELECT_CANDIDATES, RESERVE, FIT, ASSEMBLE_RESULT, DONE
    }

    private static final Logger LOG = Logger.getLogger(PhotoCalTask.class.getName());

    private final ReferenceObjectLoader refObjLoader;
    private final SourceMatcher matcher;
    private final PhotoCalConfig config;
    private Stage stage = Stage.INIT;

    /**
     * Create a task which can only calibrate pre-matched sources with
     * {@link #runMatches(Exposure, List)}.
     */
    public PhotoCalTask(PhotoCalConfig config) {
        this(null, null, config);
    }

    public PhotoCalTask(ReferenceObjectLoader refObjLoader, SourceMatcher matcher, PhotoCalConfig config) {
        this.refObjLoader = refObjLoader;
        this.matcher = matcher;
        this.config = Objects.requireNonNull(config, "config");
    }

    public PhotoCalConfig getConfig() {
        return config;
    }

    /**
     * The last stage reached by the most recent calibration.
     */
    public Stage getStage() {
        return stage;
    }

    /**
     * Calibrate an exposure and flag its sources.
     *
     * @param exposure The exposure
     * @param sourceCat The sources detected on the exposure. On success its
     * photometry flags are replaced by those of the result.
     * @return The calibration
     * @throws IOException If the reference catalog cannot be loaded
     * @throws ConfigurationException If the configuration does not fit the
     * exposure or reference catalog, in which case no flags are modified
     * @throws InsufficientDataException If too few stars are available, in
     * which case no flags are modified
     */
    public PhotoCalResult run(Exposure exposure, SourceCatalog sourceCat) throws IOException {
        if (refObjLoader == null || matcher == null) {
            throw new IllegalStateException("Task was created without a reference loader and matcher");
        }
        ReferenceCatalog refCat = refObjLoader.load(exposure);
        LOG.log(Level.FINE, "Loaded {0} reference objects for {1}", new Object[]{refCat.size(), exposure});
        List<MatchedPair> matches = matcher.match(sourceCat, refCat, exposure);
        PhotoCalResult result = calibrate(exposure, matches, refCat.getFieldNames());
        result.applyTo(sourceCat);
        return result;
    }

    /**
     * Calibrate an exposure from matches made elsewhere. No catalog is
     * modified, the caller applies {@link PhotoCalResult#getFlagUpdates()}.
     *
     * @param exposure The exposure
     * @param matches The matched reference and source pairs
     * @return The calibration
     */
    public PhotoCalResult runMatches(Exposure exposure, List<MatchedPair> matches) {
        Set<String> fieldNames = new LinkedHashSet<>();
        for (MatchedPair match : matches) {
            fieldNames.addAll(match.getReference().getFields().keySet());
        }
        return calibrate(exposure, matches, fieldNames);
    }

    private PhotoCalResult calibrate(Exposure exposure, List<MatchedPair> matches, Collection<String> refFieldNames) {
        stage = Stage.INIT;
        String filterName = exposure.getFilterName();
        Colorterm colorterm = null;
        if (config.isApplyColorTerms()) {
            colorterm = config.getColorterms().getColorterm(filterName, config.getPhotoCatName());
        }
        if (matches.isEmpty()) {
            throw new InsufficientDataException("No matches to reference catalog for " + exposure, 0, config.getMinUsed());
        }
        ReferenceMagnitudes refMags;
        if (colorterm != null) {
            refMags = new ColorCorrectedReferenceMagnitudes(colorterm,
                    getRefFluxField(refFieldNames, colorterm.getPrimary()),
                    getRefFluxField(refFieldNames, colorterm.getSecondary()));
        } else {
            refMags = new DirectReferenceMagnitudes(getRefFluxField(refFieldNames, filterName));
        }
        LOG.log(Level.FINE, "Calibrating {0} with reference fields {1}", new Object[]{exposure, refMags.getFluxFields()});

        transition(Stage.SELECT_CANDIDATES);
        CandidateSelector selector = new CandidateSelector(config.getFluxField(), refMags,
                config.getBadFlags(), config.getMagLimit(), config.getCandidatePredicate());
        List<Candidate> candidates = Timed.execute("Candidate selection", () -> selector.select(matches));

        transition(Stage.RESERVE);
        ReservationSampler sampler = new ReservationSampler(config.getReserveFraction(),
                ReservationSampler.seedFor(config.getReserveSeed(), exposure.getId()));
        ReservationSampler.Partition<Candidate> partition = sampler.partition(candidates);

        transition(Stage.FIT);
        ZeroPointFitter fitter = new ZeroPointFitter(config.getNIter(), config.getNSigma(), config.getSigmaMax(),
                config.isUseMedian(), config.getMagErrFloor(), config.getMinUsed());
        ZeroPoint zp = Timed.execute("Zero point fit", () -> fitter.fit(partition.getFitSet()));

        transition(Stage.ASSEMBLE_RESULT);
        PhotoCalResult result = assemble(zp, candidates, partition.getReservedSet(), refMags.getFluxFields());
        transition(Stage.DONE);
        LOG.log(Level.INFO, "Photometric zero point {0,number,0.0000} +/- {1,number,0.0000} from {2} stars ({3} candidates, {4} reserved)",
                new Object[]{result.getZeroPoint(), result.getZeroPointError(), result.getUsedCount(), result.getCandidateCount(), result.getReservedCount()});
        return result;
    }

    private PhotoCalResult assemble(ZeroPoint zp, List<Candidate> candidates, List<Candidate> reservedSet, List<String> refFluxFields) {
        List<Candidate> used = zp.getUsed();
        Set<Long> usedIds = new HashSet<>();
        for (Candidate candidate : used) {
            usedIds.add(candidate.getSourceId());
        }
        Set<Long> reservedIds = new HashSet<>();
        List<MatchedPair> reservedMatches = new ArrayList<>(reservedSet.size());
        for (Candidate candidate : reservedSet) {
            reservedIds.add(candidate.getSourceId());
            reservedMatches.add(candidate.getPair());
        }
        List<FlagUpdate> updates = new ArrayList<>(candidates.size());
        for (Candidate candidate : candidates) {
            long id = candidate.getSourceId();
            updates.add(new FlagUpdate(id, PhotometryFlags.of(true, usedIds.contains(id), reservedIds.contains(id))));
        }

        int n = used.size();
        double[] srcMag = new double[n];
        double[] srcMagErr = new double[n];
        double[] refMag = new double[n];
        double[] refMagErr = new double[n];
        List<MatchedPair> usedMatches = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            Candidate candidate = used.get(i);
            srcMag[i] = candidate.getSrcMag();
            srcMagErr[i] = candidate.getSrcMagErr();
            refMag[i] = candidate.getRefMag();
            refMagErr[i] = candidate.getRefMagErr();
            usedMatches.add(candidate.getPair());
        }
        MagnitudeArrays arrays = new MagnitudeArrays(srcMag, srcMagErr, refMag, refMagErr, refFluxFields);
        return new PhotoCalResult(zp.getZeroPoint(), zp.getSigma(), usedMatches, reservedMatches, arrays, updates, candidates.size());
    }

    private void transition(Stage next) {
        LOG.log(Level.FINE, "{0} -> {1}", new Object[]{stage, next});
        stage = next;
    }

    /**
     * Find the reference flux field for a filter, preferring a flux already
     * transformed to the camera system (<code>&lt;filter&gt;_camFlux</code>)
     * over the catalog flux (<code>&lt;filter&gt;_flux</code>).
     *
     * @param fieldNames The fields of the reference catalog
     * @param filterName The filter
     * @return The flux field name
     * @throws ConfigurationException If neither field exists
     */
    public static String getRefFluxField(Collection<String> fieldNames, String filterName) {
        String camFlux = filterName + "_camFlux";
        if (fieldNames.contains(camFlux)) {
            return camFlux;
        }
        String flux = filterName + "_flux";
        if (fieldNames.contains(flux)) {
            return flux;
        }
        throw new ConfigurationException("Could not find flux field for filter " + filterName + ": neither " + camFlux + " nor " + flux + " in reference catalog");
    }
}
