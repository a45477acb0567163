package org.lsst.pipe.photocal.catalog;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import org.junit.Test;

/**
 *
 * @author tonyj
 */
public class SourceCatalogTest {

    private static SourceCatalog catalog(int n) {
        List<SourceRecord> records = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            records.add(new SourceRecord(i, Collections.singletonMap("flux", 100.0 * i),
                    Collections.singletonMap("base_PixelFlags_flag_edge", i == 2)));
        }
        return new SourceCatalog(records);
    }

    @Test
    public void testApplyFlagUpdates() {
        SourceCatalog cat = catalog(5);
        cat.applyFlagUpdates(Arrays.asList(
                new FlagUpdate(0, PhotometryFlags.USED),
                new FlagUpdate(1, PhotometryFlags.RESERVED),
                new FlagUpdate(3, PhotometryFlags.CANDIDATE)));
        assertEquals(3, cat.count(PhotometryFlag.CANDIDATE));
        assertEquals(1, cat.count(PhotometryFlag.USED));
        assertEquals(1, cat.count(PhotometryFlag.RESERVED));
        assertTrue(cat.find(0).getFlag("calib_photometryUsed"));
        assertTrue(cat.find(2).getFlag("base_PixelFlags_flag_edge"));
        assertFalse(cat.find(4).getFlag("calib_photometryCandidate"));

        // A second application replaces rather than accumulates
        cat.applyFlagUpdates(Collections.singletonList(new FlagUpdate(4, PhotometryFlags.USED)));
        assertEquals(1, cat.count(PhotometryFlag.CANDIDATE));
        assertEquals(0, cat.count(PhotometryFlag.RESERVED));
        assertTrue(cat.find(4).get(PhotometryFlag.USED));
    }

    @Test
    public void testUnknownSourceLeavesFlags() {
        SourceCatalog cat = catalog(3);
        cat.applyFlagUpdates(Collections.singletonList(new FlagUpdate(1, PhotometryFlags.USED)));
        try {
            cat.applyFlagUpdates(Arrays.asList(new FlagUpdate(0, PhotometryFlags.USED), new FlagUpdate(99, PhotometryFlags.USED)));
            fail("should not reach here");
        } catch (IllegalArgumentException x) {
            assertTrue(x.getMessage().contains("99"));
        }
        assertEquals(PhotometryFlags.USED, cat.find(1).getPhotometryFlags());
        assertEquals(PhotometryFlags.NONE, cat.find(0).getPhotometryFlags());
    }

    @Test
    public void testRecords() {
        SourceCatalog cat = catalog(3);
        assertEquals(3, cat.size());
        assertEquals(200.0, cat.get(2).get("flux"), 0);
        assertTrue(Double.isNaN(cat.get(2).get("missing", Double.NaN)));
        try {
            double value = cat.get(2).get("missing");
            fail("should not reach here: " + value);
        } catch (IllegalArgumentException x) {
            assertTrue(x.getMessage().contains("missing"));
        }
        try {
            SourceCatalog duplicate = new SourceCatalog(Arrays.asList(cat.get(0), cat.get(0)));
            fail("should not reach here: " + duplicate);
        } catch (IllegalArgumentException x) {
            assertTrue(x.getMessage().contains("Duplicate"));
        }
    }

    @Test
    public void testReferenceCatalogFluxFields() {
        ReferenceRecord record = new ReferenceRecord(1, new java.util.LinkedHashMap<String, Double>() {
            {
                put("coord_ra", 1.0);
                put("g_flux", 1e-3);
                put("g_fluxSigma", 1e-5);
                put("r_camFlux", 1e-3);
            }
        });
        ReferenceCatalog refCat = new ReferenceCatalog(Collections.singletonList(record));
        assertEquals(Arrays.asList("g_flux", "r_camFlux"), refCat.getFluxFieldNames());
        assertTrue(refCat.hasField("coord_ra"));
        assertFalse(record.isResolved());
    }
}
