package org.lsst.pipe.photocal.colorterm;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import org.junit.Test;

/**
 *
 * @author tonyj
 */
public class ColortermTest {

    @Test
    public void testTransformMags() {
        Colorterm quadratic = new Colorterm("g", "r", 0.1, -0.2, 0.05);
        double g = 18.0;
        double r = 17.5;
        assertEquals(18.0 + 0.1 - 0.2 * 0.5 + 0.05 * 0.25, quadratic.transformMags(g, r), 1e-12);

        Colorterm linear = new Colorterm("g", "r", 0.1, -0.2);
        assertEquals(0.0, linear.getC2(), 0);
        assertEquals(18.0 + 0.1 - 0.2 * 0.5, linear.transformMags(g, r), 1e-12);
    }

    @Test
    public void testConstantOffset() {
        Colorterm offset = new Colorterm("i", "z", 1.0, 0.0, 0.0);
        for (double color : new double[]{-1, 0, 0.3, 2}) {
            assertEquals(20.0 + 1.0, offset.transformMags(20.0, 20.0 - color), 1e-12);
        }
    }

    @Test
    public void testPropagateMagErrors() {
        Colorterm colorterm = new Colorterm("g", "r", 0.0, 0.5, 0.0);
        assertEquals(Math.hypot(1.5 * 0.02, 0.5 * 0.04), colorterm.propagateMagErrors(18, 17, 0.02, 0.04), 1e-12);
        Colorterm none = new Colorterm("g", "r", 1.0, 0.0, 0.0);
        assertEquals(0.02, none.propagateMagErrors(18, 17, 0.02, 0.04), 1e-12);
    }

    @Test
    public void testEquals() {
        assertEquals(new Colorterm("g", "r", 0.1, 0.2), new Colorterm("g", "r", 0.1, 0.2, 0.0));
        assertEquals(new Colorterm("g", "r", 0.1, 0.2).hashCode(), new Colorterm("g", "r", 0.1, 0.2, 0.0).hashCode());
        assertNotEquals(new Colorterm("g", "r", 0.1, 0.2), new Colorterm("g", "i", 0.1, 0.2));
    }
}
