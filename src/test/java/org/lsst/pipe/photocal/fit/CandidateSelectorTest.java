package org.lsst.pipe.photocal.fit;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import org.junit.Test;
import org.lsst.pipe.photocal.catalog.MatchedPair;
import org.lsst.pipe.photocal.catalog.ReferenceRecord;
import org.lsst.pipe.photocal.catalog.SourceRecord;
import org.lsst.pipe.photocal.colorterm.Colorterm;

/**
 *
 * @author tonyj
 */
public class CandidateSelectorTest {

    private static final String FLUX = "base_PsfFlux_flux";

    private static MatchedPair pair(long id, double srcFlux, double refFlux) {
        return pair(id, srcFlux, refFlux, Collections.emptyMap(), Collections.emptyMap());
    }

    private static MatchedPair pair(long id, double srcFlux, double refFlux, Map<String, Boolean> srcFlags, Map<String, Boolean> refFlags) {
        Map<String, Double> srcFields = new LinkedHashMap<>();
        srcFields.put(FLUX, srcFlux);
        srcFields.put(FLUX + "Sigma", srcFlux / 100);
        Map<String, Double> refFields = new LinkedHashMap<>();
        refFields.put("r_flux", refFlux);
        refFields.put("i_flux", refFlux / 2);
        return new MatchedPair(new ReferenceRecord(id + 1000, refFields, refFlags), new SourceRecord(id, srcFields, srcFlags), 0.1);
    }

    private static List<Long> ids(List<Candidate> candidates) {
        List<Long> result = new ArrayList<>();
        for (Candidate candidate : candidates) {
            result.add(candidate.getSourceId());
        }
        return result;
    }

    @Test
    public void testFiniteAndPositive() {
        List<MatchedPair> pairs = Arrays.asList(
                pair(1, 1e4, 1e-3),
                pair(2, -1e4, 1e-3),
                pair(3, 1e4, 0),
                pair(4, Double.NaN, 1e-3),
                pair(5, 1e4, Double.POSITIVE_INFINITY),
                pair(6, 2e4, 2e-3));
        CandidateSelector selector = new CandidateSelector(FLUX, new DirectReferenceMagnitudes("r_flux"));
        List<Candidate> candidates = selector.select(pairs);
        assertEquals(Arrays.asList(1L, 6L), ids(candidates));

        Candidate first = candidates.get(0);
        assertEquals(-10.0, first.getSrcMag(), 1e-12);
        assertEquals(Magnitudes.abMagFromFlux(1e-3), first.getRefMag(), 1e-12);
        assertEquals(2.5 / Math.log(10) * 0.01, first.getSrcMagErr(), 1e-12);
        assertTrue(Double.isNaN(first.getRefMagErr()));
        assertEquals(first.getRefMag() - first.getSrcMag(), first.getResidual(), 0);
    }

    @Test
    public void testFlags() {
        Map<String, Boolean> saturated = Collections.singletonMap("base_PixelFlags_flag_saturated", true);
        Map<String, Boolean> resolved = Collections.singletonMap(ReferenceRecord.RESOLVED_FLAG, true);
        Map<String, Boolean> variable = Collections.singletonMap(ReferenceRecord.VARIABLE_FLAG, true);
        Map<String, Boolean> none = Collections.emptyMap();
        List<MatchedPair> pairs = Arrays.asList(
                pair(1, 1e4, 1e-3, saturated, none),
                pair(2, 1e4, 1e-3, none, resolved),
                pair(3, 1e4, 1e-3, none, variable),
                pair(4, 1e4, 1e-3, none, none));
        CandidateSelector selector = new CandidateSelector(FLUX, new DirectReferenceMagnitudes("r_flux"),
                Arrays.asList("base_PixelFlags_flag_saturated"), Double.NaN, CandidateSelector.POINT_SOURCES);
        assertEquals(Arrays.asList(4L), ids(selector.select(pairs)));

        // only the flux test applies by default
        CandidateSelector plain = new CandidateSelector(FLUX, new DirectReferenceMagnitudes("r_flux"));
        assertEquals(Arrays.asList(1L, 2L, 3L, 4L), ids(plain.select(pairs)));
    }

    @Test
    public void testMagLimitAndPredicate() {
        // 1e-3 Jy is AB 16.4, 1e-6 Jy is AB 23.9
        List<MatchedPair> pairs = Arrays.asList(pair(1, 1e4, 1e-3), pair(2, 1e4, 1e-6), pair(3, 1e4, 1e-3));
        CandidateSelector limited = new CandidateSelector(FLUX, new DirectReferenceMagnitudes("r_flux"),
                Collections.emptyList(), 22.0, (pair) -> true);
        assertEquals(Arrays.asList(1L, 3L), ids(limited.select(pairs)));

        CandidateSelector filtered = new CandidateSelector(FLUX, new DirectReferenceMagnitudes("r_flux"),
                Collections.emptyList(), Double.NaN, (pair) -> pair.getSource().getId() != 3);
        assertEquals(Arrays.asList(1L, 2L), ids(filtered.select(pairs)));
    }

    @Test
    public void testDuplicateSource() {
        MatchedPair a = pair(1, 1e4, 1e-3);
        MatchedPair b = new MatchedPair(pair(9, 1e4, 2e-3).getReference(), a.getSource(), 0.5);
        CandidateSelector selector = new CandidateSelector(FLUX, new DirectReferenceMagnitudes("r_flux"));
        List<Candidate> candidates = selector.select(Arrays.asList(a, b));
        assertEquals(1, candidates.size());
        assertTrue(candidates.get(0).getPair() == a);
    }

    @Test
    public void testColorCorrected() {
        Colorterm colorterm = new Colorterm("r", "i", 0.5, 0.1, 0.01);
        ColorCorrectedReferenceMagnitudes refMags = new ColorCorrectedReferenceMagnitudes(colorterm, "r_flux", "i_flux");
        CandidateSelector selector = new CandidateSelector(FLUX, refMags);
        List<Candidate> candidates = selector.select(Arrays.asList(pair(1, 1e4, 1e-3), pair(2, 1e4, -1e-3)));
        assertEquals(Arrays.asList(1L), ids(candidates));
        double r = Magnitudes.abMagFromFlux(1e-3);
        double i = Magnitudes.abMagFromFlux(0.5e-3);
        assertEquals(colorterm.transformMags(r, i), candidates.get(0).getRefMag(), 1e-12);
        assertEquals(Arrays.asList("r_flux", "i_flux"), refMags.getFluxFields());
    }
}
