package org.lsst.pipe.photocal.fit;

import java.util.ArrayList;
import java.util.List;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import org.junit.Test;

/**
 *
 * @author tonyj
 */
public class ReservationSamplerTest {

    private static List<Integer> items(int n) {
        List<Integer> result = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            result.add(i);
        }
        return result;
    }

    @Test
    public void testReservedCount() {
        double[] fractions = {0.0, 0.1, 0.25, 0.3, 0.5, 0.7, 0.99};
        int[] sizes = {0, 1, 3, 10, 99, 100, 1234};
        for (double fraction : fractions) {
            for (int n : sizes) {
                ReservationSampler sampler = new ReservationSampler(fraction, 1);
                ReservationSampler.Partition<Integer> partition = sampler.partition(items(n));
                int expected = (int) (fraction * n);
                assertEquals("fraction=" + fraction + " n=" + n, expected, partition.getReservedSet().size());
                assertEquals(n - expected, partition.getFitSet().size());
            }
        }
    }

    @Test
    public void testThirtyPercentOfHundred() {
        ReservationSampler.Partition<Integer> partition = new ReservationSampler(0.3, 42).partition(items(100));
        assertEquals(30, partition.getReservedSet().size());
        assertEquals(70, partition.getFitSet().size());
    }

    @Test
    public void testZeroFraction() {
        List<Integer> items = items(50);
        ReservationSampler.Partition<Integer> partition = new ReservationSampler(0, 42).partition(items);
        assertTrue(partition.getReservedSet().isEmpty());
        assertEquals(items, partition.getFitSet());
    }

    @Test
    public void testOrderPreservedAndDisjoint() {
        List<Integer> items = items(200);
        ReservationSampler.Partition<Integer> partition = new ReservationSampler(0.4, 7).partition(items);
        assertIncreasing(partition.getFitSet());
        assertIncreasing(partition.getReservedSet());
        List<Integer> all = new ArrayList<>(partition.getFitSet());
        all.addAll(partition.getReservedSet());
        all.sort(null);
        assertEquals(items, all);
    }

    @Test
    public void testReproducible() {
        List<Integer> items = items(500);
        List<Integer> first = new ReservationSampler(0.2, 12345).partition(items).getReservedSet();
        List<Integer> second = new ReservationSampler(0.2, 12345).partition(items).getReservedSet();
        assertEquals(first, second);
        List<Integer> other = new ReservationSampler(0.2, 54321).partition(items).getReservedSet();
        assertNotEquals(first, other);
    }

    @Test
    public void testSeed() {
        assertEquals(3, ReservationSampler.seedFor(3, 0));
        assertEquals(3 * 695833L, ReservationSampler.seedFor(3, 695833));
    }

    @Test
    public void testInvalidFraction() {
        for (double fraction : new double[]{1.0, -0.5, Double.NaN}) {
            try {
                ReservationSampler sampler = new ReservationSampler(fraction, 1);
                fail("should not reach here: " + sampler);
            } catch (IllegalArgumentException x) {
                assertTrue(x.getMessage().contains("reserveFraction"));
            }
        }
    }

    private static void assertIncreasing(List<Integer> values) {
        for (int i = 1; i < values.size(); i++) {
            assertTrue(values.get(i) > values.get(i - 1));
        }
    }
}
