package org.lsst.pipe.photocal.fit;

/**
 * Conversions between fluxes and magnitudes.
 *
 * @author tonyj
 */
public final class Magnitudes {

    /** Flux of a zero magnitude source on the AB system, in Jansky. */
    public static final double AB_FLUX_SCALE = 3631.0;

    private static final double MAG_ERR_SCALE = 2.5 / Math.log(10);

    private Magnitudes() {
    }

    /**
     * Instrumental magnitude, <code>-2.5 log10(flux)</code>, so that a unit
     * flux has magnitude zero.
     */
    public static double instMagFromFlux(double flux) {
        return -2.5 * Math.log10(flux);
    }

    public static double abMagFromFlux(double fluxJansky) {
        return -2.5 * Math.log10(fluxJansky / AB_FLUX_SCALE);
    }

    public static double fluxFromABMag(double mag) {
        return AB_FLUX_SCALE * Math.pow(10, -0.4 * mag);
    }

    public static double magErrFromFluxErr(double flux, double fluxErr) {
        return MAG_ERR_SCALE * Math.abs(fluxErr / flux);
    }

    static boolean isPositive(double value) {
        return value > 0 && !Double.isInfinite(value);
    }
}
