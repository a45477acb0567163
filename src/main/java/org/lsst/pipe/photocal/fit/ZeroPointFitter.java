package org.lsst.pipe.photocal.fit;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.lsst.pipe.photocal.InsufficientDataException;

/**
 * Fits the photometric zero point with iterative outlier rejection.
 * <p>
 * The residuals <code>dmag = refMag - srcMag</code> are sorted. On the first
 * iteration the mode of a coarse histogram is located, and its half-peak
 * width provides the first estimate of the scatter (if the histogram has
 * several disjoint modes the median and interquartile range are used
 * instead). If no upper bound on the clipping width is configured it is
 * derived from that first estimate. Later iterations centre on the median (or
 * the mean) of the survivors and estimate the scatter from their
 * interquartile range. Residuals within <code>nSigma * min(sigma,
 * sigmaMax)</code> of the centre survive. Iteration stops when no more
 * residuals are rejected.
 * <p>
 * The zero point is the inverse variance weighted mean of the surviving
 * residuals, or their plain mean if any candidate lacks a usable error. Its
 * error is the standard error of the surviving residuals,
 * <code>stddev / sqrt(n)</code>.
 *
 * @author tonyj
 */
public class ZeroPointFitter {

    private static final Logger LOG = Logger.getLogger(ZeroPointFitter.class.getName());
    // 1 sigma in units of the interquartile range, for a Gaussian
    private static final double IQ_TO_STDEV = 0.741301109252802;
    // Converts the half-peak width of the histogram mode to sigma
    private static final double FWHM_TO_STDEV = 2.3;
    private static final int NHIST = 20;

    private final int nIter;
    private final double nSigma;
    private final double sigmaMax;
    private final boolean useMedian;
    private final double magErrFloor;
    private final int minUsed;

    public ZeroPointFitter(int nIter, double nSigma, double sigmaMax, boolean useMedian, double magErrFloor, int minUsed) {
        this.nIter = nIter;
        this.nSigma = nSigma;
        this.sigmaMax = sigmaMax;
        this.useMedian = useMedian;
        this.magErrFloor = magErrFloor;
        this.minUsed = minUsed;
    }

    /**
     * Fit the zero point.
     *
     * @param fitSet The candidates to fit
     * @return The zero point, its error and the candidates used
     * @throws InsufficientDataException If fewer than the minimum number of
     * candidates are available, or survive outlier rejection
     */
    public ZeroPoint fit(List<Candidate> fitSet) {
        int n = fitSet.size();
        if (n < minUsed) {
            throw new InsufficientDataException("Too few candidates for photometric calibration", n, minUsed);
        }
        Integer[] order = new Integer[n];
        for (int i = 0; i < n; i++) {
            order[i] = i;
        }
        Arrays.sort(order, Comparator.comparingDouble((Integer i) -> fitSet.get(i).getResidual()));

        int[] index = new int[n];
        double[] dmag = new double[n];
        double[] dmagErr = new double[n];
        boolean weighted = true;
        for (int k = 0; k < n; k++) {
            Candidate candidate = fitSet.get(order[k]);
            index[k] = order[k];
            dmag[k] = candidate.getResidual();
            dmagErr[k] = Math.hypot(Math.hypot(candidate.getSrcMagErr(), candidate.getRefMagErr()), magErrFloor);
            weighted &= dmagErr[k] > 0 && !Double.isInfinite(dmagErr[k]);
        }

        int npt = n;
        int ngood = npt;
        double maxSigma = sigmaMax;
        int iter = 0;
        while (iter < nIter) {
            if (dmag[0] == dmag[npt - 1]) {
                // Identical residuals, nothing to reject
                break;
            }
            double center;
            double sig;
            if (iter == 0) {
                int[] hist = new int[NHIST];
                double[] edges = histogram(dmag, npt, hist);
                int peakCount = 0;
                for (int count : hist) {
                    peakCount = Math.max(peakCount, count);
                }
                int first = -1;
                int last = -1;
                int nModes = 0;
                for (int j = 0; j < NHIST; j++) {
                    if (hist[j] == peakCount) {
                        if (first < 0) {
                            first = j;
                        }
                        last = j;
                        nModes++;
                    }
                }
                if (last - first + 1 == nModes) {
                    center = 0.5 * (edges[first] + edges[last + 1]);
                    double halfPeak = 0.5 * peakCount;
                    int j = first;
                    while (j >= 0 && hist[j] > halfPeak) {
                        j--;
                    }
                    j = Math.max(j, 0);
                    double q1 = dmag[cumulative(hist, j)];
                    j = last;
                    while (j < NHIST && hist[j] > halfPeak) {
                        j++;
                    }
                    j = Math.min(j, NHIST - 1);
                    double q3 = dmag[Math.min(cumulative(hist, j), npt - 1)];
                    if (q1 == q3) {
                        q1 = dmag[(int) (0.25 * npt)];
                        q3 = dmag[(int) (0.75 * npt)];
                    }
                    sig = (q3 - q1) / FWHM_TO_STDEV;
                    if (Double.isNaN(maxSigma)) {
                        maxSigma = 2 * sig;
                    }
                } else {
                    if (Double.isNaN(maxSigma)) {
                        maxSigma = dmag[npt - 1] - dmag[0];
                    }
                    center = median(dmag, npt);
                    double q1 = dmag[(int) (0.25 * npt)];
                    double q3 = dmag[(int) (0.75 * npt)];
                    sig = (q3 - q1) / FWHM_TO_STDEV;
                }
                LOG.log(Level.FINE, "Photometric calibration histogram: center = {0}, sig = {1}", new Object[]{center, sig});
            } else {
                center = useMedian ? median(dmag, npt) : mean(dmag, dmagErr, npt, weighted);
                double q3 = dmag[Math.min((int) (0.75 * npt + 0.5), npt - 1)];
                double q1 = dmag[Math.min((int) (0.25 * npt + 0.5), npt - 1)];
                sig = IQ_TO_STDEV * (q3 - q1);
            }
            if (sig == 0) {
                // Zero interquartile range, keep the current survivors
                break;
            }
            double limit = nSigma * Math.min(sig, maxSigma);
            int oldNgood = ngood;
            ngood = 0;
            for (int k = 0; k < npt; k++) {
                if (Math.abs(dmag[k] - center) <= limit) {
                    dmag[ngood] = dmag[k];
                    dmagErr[ngood] = dmagErr[k];
                    index[ngood] = index[k];
                    ngood++;
                }
            }
            iter++;
            LOG.log(Level.FINE, "Iteration {0}: center = {1}, clip = {2}, {3} of {4} survive", new Object[]{iter, center, limit, ngood, npt});
            if (ngood == 0) {
                throw new InsufficientDataException("No good stars remain after " + iter + " iterations of photometric calibration", 0, minUsed);
            }
            npt = ngood;
            if (ngood == oldNgood) {
                break;
            }
        }
        if (npt < minUsed) {
            throw new InsufficientDataException("Too few stars survive outlier rejection", npt, minUsed);
        }

        double zp = mean(dmag, dmagErr, npt, weighted);
        double sumSq = 0;
        for (int k = 0; k < npt; k++) {
            sumSq += (dmag[k] - zp) * (dmag[k] - zp);
        }
        double sigma = npt > 1 ? Math.sqrt(sumSq / (npt - 1)) / Math.sqrt(npt) : Double.NaN;

        int[] usedIndex = Arrays.copyOf(index, npt);
        Arrays.sort(usedIndex);
        List<Candidate> used = new ArrayList<>(npt);
        for (int i : usedIndex) {
            used.add(fitSet.get(i));
        }
        LOG.log(Level.FINE, "Zero point {0} +/- {1} from {2} of {3} stars", new Object[]{zp, sigma, npt, n});
        return new ZeroPoint(zp, sigma, used, weighted, iter);
    }

    /**
     * Fill a histogram of the first npt (sorted) values and return the bin
     * edges. A degenerate range is widened by half a magnitude each side.
     */
    private static double[] histogram(double[] sorted, int npt, int[] hist) {
        double lo = sorted[0];
        double hi = sorted[npt - 1];
        if (lo == hi) {
            lo -= 0.5;
            hi += 0.5;
        }
        double[] edges = new double[NHIST + 1];
        for (int j = 0; j <= NHIST; j++) {
            edges[j] = lo + (hi - lo) * j / NHIST;
        }
        for (int k = 0; k < npt; k++) {
            int bin = (int) ((sorted[k] - lo) / (hi - lo) * NHIST);
            hist[Math.min(Math.max(bin, 0), NHIST - 1)]++;
        }
        return edges;
    }

    // Number of values in the bins below bin
    private static int cumulative(int[] hist, int bin) {
        int sum = 0;
        for (int j = 0; j < bin; j++) {
            sum += hist[j];
        }
        return sum;
    }

    private static double median(double[] sorted, int npt) {
        int mid = npt / 2;
        return npt % 2 == 1 ? sorted[mid] : 0.5 * (sorted[mid - 1] + sorted[mid]);
    }

    private static double mean(double[] values, double[] errors, int npt, boolean weighted) {
        double sum = 0;
        double sumW = 0;
        for (int k = 0; k < npt; k++) {
            double w = weighted ? 1.0 / (errors[k] * errors[k]) : 1.0;
            sum += w * values[k];
            sumW += w;
        }
        return sum / sumW;
    }
}
