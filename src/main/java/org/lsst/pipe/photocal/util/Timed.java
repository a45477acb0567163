package org.lsst.pipe.photocal.util;

import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Utility for logging how long a stage of the calibration took.
 *
 * @author tonyj
 */
public class Timed {

    private static final Logger LOG = Logger.getLogger(Timed.class.getName());
    private static final Level DEFAULT_LOG_LEVEL = Level.FINE;

    private Timed() {
    }

    /**
     * Run a stage, logging its elapsed time whether it succeeds or throws.
     *
     * @param stage The stage name, used in the log message
     * @param work The work to do
     * @return The result of the work
     */
    public static <T> T execute(String stage, Supplier<T> work) {
        return execute(DEFAULT_LOG_LEVEL, stage, work);
    }

    public static <T> T execute(Level logLevel, String stage, Supplier<T> work) {
        long start = System.nanoTime();
        boolean ok = false;
        try {
            T result = work.get();
            ok = true;
            return result;
        } finally {
            long micros = (System.nanoTime() - start) / 1000;
            final boolean succeeded = ok;
            LOG.log(logLevel, () -> String.format("%s %s after %dus", stage, succeeded ? "completed" : "failed", micros));
        }
    }
}
