package org.lsst.pipe.photocal.fit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Holds a random fraction of the candidates back from the fit, so that they
 * can be used to validate the calibration independently. The draw is seeded
 * explicitly, so a given seed always reserves the same candidates.
 *
 * @author tonyj
 */
public class ReservationSampler {

    private static final Logger LOG = Logger.getLogger(ReservationSampler.class.getName());

    private final double reserveFraction;
    private final long seed;

    /**
     * @param reserveFraction Fraction of candidates to reserve, in [0,1)
     * @param seed The random seed
     */
    public ReservationSampler(double reserveFraction, long seed) {
        if (!(reserveFraction >= 0 && reserveFraction < 1)) {
            throw new IllegalArgumentException("reserveFraction must be in [0,1), got " + reserveFraction);
        }
        this.reserveFraction = reserveFraction;
        this.seed = seed;
    }

    /**
     * The seed used by the calibration: the configured seed scaled by the
     * exposure id, with an id of zero treated as one.
     */
    public static long seedFor(int reserveSeed, long exposureId) {
        return reserveSeed * (exposureId == 0 ? 1 : exposureId);
    }

    /**
     * The number of items reserved from a list of the given size,
     * <code>floor(reserveFraction * size)</code>.
     */
    public int reservedCount(int size) {
        return (int) (reserveFraction * size);
    }

    public <T> Partition<T> partition(List<T> candidates) {
        int n = candidates.size();
        int nReserve = reservedCount(n);
        boolean[] reserved = new boolean[n];
        if (nReserve > 0) {
            Random random = new Random(seed);
            List<Integer> remaining = new ArrayList<>(n);
            for (int i = 0; i < n; i++) {
                remaining.add(i);
            }
            for (int i = 0; i < nReserve; i++) {
                int index = (int) (random.nextDouble() * remaining.size());
                reserved[remaining.remove(index)] = true;
            }
        }
        List<T> fitSet = new ArrayList<>(n - nReserve);
        List<T> reservedSet = new ArrayList<>(nReserve);
        for (int i = 0; i < n; i++) {
            (reserved[i] ? reservedSet : fitSet).add(candidates.get(i));
        }
        LOG.log(Level.FINE, "Reserved {0} of {1} candidates", new Object[]{nReserve, n});
        return new Partition<>(fitSet, reservedSet);
    }

    public static class Partition<T> {

        private final List<T> fitSet;
        private final List<T> reservedSet;

        Partition(List<T> fitSet, List<T> reservedSet) {
            this.fitSet = Collections.unmodifiableList(fitSet);
            this.reservedSet = Collections.unmodifiableList(reservedSet);
        }

        public List<T> getFitSet() {
            return fitSet;
        }

        public List<T> getReservedSet() {
            return reservedSet;
        }
    }
}
