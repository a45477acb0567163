package org.lsst.pipe.photocal.colorterm;

import java.util.Objects;

/**
 * A color term: a polynomial correction taking reference magnitudes in a
 * primary and secondary filter to the instrumental system.
 * <pre>
 * corrected = primary + c0 + c1*(primary - secondary) + c2*(primary - secondary)^2
 * </pre>
 *
 * @author tonyj
 */
public final class Colorterm {

    private final String primary;
    private final String secondary;
    private final double c0;
    private final double c1;
    private final double c2;

    public Colorterm(String primary, String secondary, double c0, double c1) {
        this(primary, secondary, c0, c1, 0.0);
    }

    public Colorterm(String primary, String secondary, double c0, double c1, double c2) {
        this.primary = Objects.requireNonNull(primary);
        this.secondary = Objects.requireNonNull(secondary);
        this.c0 = c0;
        this.c1 = c1;
        this.c2 = c2;
    }

    public String getPrimary() {
        return primary;
    }

    public String getSecondary() {
        return secondary;
    }

    public double getC0() {
        return c0;
    }

    public double getC1() {
        return c1;
    }

    public double getC2() {
        return c2;
    }

    public double transformMags(double primaryMag, double secondaryMag) {
        double color = primaryMag - secondaryMag;
        return primaryMag + c0 + color * (c1 + color * c2);
    }

    /**
     * First order propagation of the primary and secondary magnitude errors
     * through {@link #transformMags(double, double)}.
     */
    public double propagateMagErrors(double primaryMag, double secondaryMag, double primaryMagErr, double secondaryMagErr) {
        double color = primaryMag - secondaryMag;
        double dColor = c1 + 2 * c2 * color;
        return Math.hypot((1 + dColor) * primaryMagErr, dColor * secondaryMagErr);
    }

    @Override
    public int hashCode() {
        return Objects.hash(primary, secondary, c0, c1, c2);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final Colorterm other = (Colorterm) obj;
        return primary.equals(other.primary) && secondary.equals(other.secondary)
                && Double.compare(c0, other.c0) == 0 && Double.compare(c1, other.c1) == 0
                && Double.compare(c2, other.c2) == 0;
    }

    @Override
    public String toString() {
        return "Colorterm{" + "primary=" + primary + ", secondary=" + secondary + ", c0=" + c0 + ", c1=" + c1 + ", c2=" + c2 + '}';
    }
}
