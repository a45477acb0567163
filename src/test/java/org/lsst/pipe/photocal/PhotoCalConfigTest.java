package org.lsst.pipe.photocal;

import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;
import java.util.Properties;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import org.junit.Test;

/**
 *
 * @author tonyj
 */
public class PhotoCalConfigTest {

    @Test
    public void testDefaults() {
        PhotoCalConfig config = PhotoCalConfig.builder().build();
        assertEquals(PhotoCalConfig.DEFAULT_FLUX_FIELD, config.getFluxField());
        assertFalse(config.isApplyColorTerms());
        assertEquals(0.0, config.getReserveFraction(), 0);
        assertEquals(20, config.getNIter());
        assertEquals(3.0, config.getNSigma(), 0);
        assertEquals(0.25, config.getSigmaMax(), 0);
        assertTrue(config.isUseMedian());
        assertEquals(3, config.getMinUsed());
        assertEquals(Collections.emptyList(), config.getBadFlags());
        assertTrue(Double.isNaN(config.getMagLimit()));
        assertTrue(config.getCandidatePredicate().test(null));
    }

    @Test
    public void testFromProperties() throws IOException {
        Properties props = new Properties();
        props.setProperty("fluxField", "base_PsfFlux_flux");
        props.setProperty("reserveFraction", "0.25");
        props.setProperty("reserveSeed", "7");
        props.setProperty("nSigma", "2.5");
        props.setProperty("sigmaMax", "NaN");
        props.setProperty("useMedian", "false");
        props.setProperty("magLimit", "21.5");
        props.setProperty("badFlags", "flag_a, flag_b");
        PhotoCalConfig config = PhotoCalConfig.fromProperties(props);
        assertEquals("base_PsfFlux_flux", config.getFluxField());
        assertEquals(0.25, config.getReserveFraction(), 0);
        assertEquals(7, config.getReserveSeed());
        assertEquals(2.5, config.getNSigma(), 0);
        assertTrue(Double.isNaN(config.getSigmaMax()));
        assertFalse(config.isUseMedian());
        assertEquals(21.5, config.getMagLimit(), 0);
        assertEquals(Arrays.asList("flag_a", "flag_b"), config.getBadFlags());

        props.setProperty("badFlags", "");
        assertEquals(Collections.emptyList(), PhotoCalConfig.fromProperties(props).getBadFlags());
    }

    @Test
    public void testInvalid() throws IOException {
        assertInvalid(PhotoCalConfig.builder().reserveFraction(1.0), "reserveFraction");
        assertInvalid(PhotoCalConfig.builder().reserveFraction(-0.1), "reserveFraction");
        assertInvalid(PhotoCalConfig.builder().reserveFraction(Double.NaN), "reserveFraction");
        assertInvalid(PhotoCalConfig.builder().applyColorTerms(true), "photoCatName");
        assertInvalid(PhotoCalConfig.builder().nIter(0), "nIter");
        assertInvalid(PhotoCalConfig.builder().minUsed(0), "minUsed");
        assertInvalid(PhotoCalConfig.builder().fluxField(""), "fluxField");

        Properties props = new Properties();
        props.setProperty("reserveFraction", "lots");
        try {
            PhotoCalConfig.fromProperties(props);
            fail("should not reach here");
        } catch (ConfigurationException x) {
            assertTrue(x.getCause() instanceof NumberFormatException);
        }
    }

    private static void assertInvalid(PhotoCalConfig.Builder builder, String expected) {
        try {
            PhotoCalConfig config = builder.build();
            fail("should not reach here: " + config);
        } catch (ConfigurationException x) {
            assertTrue(x.getMessage(), x.getMessage().contains(expected));
        }
    }
}
