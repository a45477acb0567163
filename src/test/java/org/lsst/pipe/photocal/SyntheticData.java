package org.lsst.pipe.photocal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import org.lsst.pipe.photocal.catalog.MatchedPair;
import org.lsst.pipe.photocal.catalog.ReferenceCatalog;
import org.lsst.pipe.photocal.catalog.ReferenceRecord;
import org.lsst.pipe.photocal.catalog.SourceCatalog;
import org.lsst.pipe.photocal.catalog.SourceRecord;
import org.lsst.pipe.photocal.fit.Magnitudes;

/**
 * Builds matched source and reference catalogs with a known zero point,
 * Gaussian scatter and a fixed fraction of gross outliers. Reference stars
 * have fluxes in g, r, i and z; sources are measured in i.
 *
 * @author tonyj
 */
public class SyntheticData {

    public static final String FLUX_FIELD = "base_PsfFlux_flux";
    public static final String FILTER = "i";

    private final SourceCatalog sourceCatalog;
    private final ReferenceCatalog referenceCatalog;
    private final List<MatchedPair> pairs;
    private final Set<Long> outlierIds;

    private SyntheticData(SourceCatalog sourceCatalog, ReferenceCatalog referenceCatalog, List<MatchedPair> pairs, Set<Long> outlierIds) {
        this.sourceCatalog = sourceCatalog;
        this.referenceCatalog = referenceCatalog;
        this.pairs = pairs;
        this.outlierIds = outlierIds;
    }

    /**
     * @param n Number of matched stars
     * @param zeroPoint The true zero point
     * @param scatter Gaussian scatter of the residuals, in magnitudes
     * @param outlierFraction Every 1/outlierFraction-th star is offset by 1 to
     * 3 magnitudes
     * @param seed Random seed
     */
    public static SyntheticData generate(int n, double zeroPoint, double scatter, double outlierFraction, long seed) {
        Random random = new Random(seed);
        int outlierStep = outlierFraction > 0 ? (int) Math.round(1 / outlierFraction) : 0;
        List<SourceRecord> sources = new ArrayList<>();
        List<ReferenceRecord> references = new ArrayList<>();
        List<MatchedPair> pairs = new ArrayList<>();
        Set<Long> outliers = new HashSet<>();
        for (int i = 0; i < n; i++) {
            long refId = 1000 + i;
            long srcId = i + 1;
            double iMag = 15 + 5 * random.nextDouble();
            double color = 0.2 + 0.6 * random.nextDouble();
            Map<String, Double> refFields = new LinkedHashMap<>();
            refFields.put("g_flux", Magnitudes.fluxFromABMag(iMag + 2 * color));
            refFields.put("r_flux", Magnitudes.fluxFromABMag(iMag + color));
            refFields.put("i_flux", Magnitudes.fluxFromABMag(iMag));
            refFields.put("z_flux", Magnitudes.fluxFromABMag(iMag - color));
            ReferenceRecord reference = new ReferenceRecord(refId, refFields);

            double residual = zeroPoint + scatter * random.nextGaussian();
            if (outlierStep > 0 && i % outlierStep == 0) {
                double offset = 1 + 2 * random.nextDouble();
                residual += random.nextBoolean() ? offset : -offset;
                outliers.add(srcId);
            }
            double instMag = iMag - residual;
            Map<String, Double> srcFields = new LinkedHashMap<>();
            srcFields.put(FLUX_FIELD, Math.pow(10, -0.4 * instMag));
            srcFields.put("refId", (double) refId);
            SourceRecord source = new SourceRecord(srcId, srcFields);

            references.add(reference);
            sources.add(source);
            pairs.add(new MatchedPair(reference, source, 0.0));
        }
        return new SyntheticData(new SourceCatalog(sources), new ReferenceCatalog(references),
                Collections.unmodifiableList(pairs), Collections.unmodifiableSet(outliers));
    }

    public SourceCatalog getSourceCatalog() {
        return sourceCatalog;
    }

    public ReferenceCatalog getReferenceCatalog() {
        return referenceCatalog;
    }

    public List<MatchedPair> getPairs() {
        return pairs;
    }

    public Set<Long> getOutlierIds() {
        return outlierIds;
    }
}
