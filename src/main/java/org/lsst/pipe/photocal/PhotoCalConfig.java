package org.lsst.pipe.photocal;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Properties;
import java.util.function.Predicate;
import org.lsst.pipe.photocal.catalog.MatchedPair;
import org.lsst.pipe.photocal.colorterm.ColortermLibrary;
import org.lsst.pipe.photocal.colorterm.ColortermLibraryReader;

/**
 * Configuration of the photometric calibration. Instances are immutable and
 * validated when built.
 *
 * @author tonyj
 */
public final class PhotoCalConfig {

    public static final String DEFAULT_FLUX_FIELD = "slot_CalibFlux_flux";
    /**
     * Pixel flags commonly excluded from calibration. Not applied unless
     * passed to {@link Builder#badFlags(List)}.
     */
    public static final List<String> PIXEL_BAD_FLAGS = Collections.unmodifiableList(Arrays.asList(
            "base_PixelFlags_flag_edge",
            "base_PixelFlags_flag_interpolated",
            "base_PixelFlags_flag_saturated"));

    private final String fluxField;
    private final boolean applyColorTerms;
    private final ColortermLibrary colorterms;
    private final String photoCatName;
    private final double reserveFraction;
    private final int reserveSeed;
    private final int nIter;
    private final double nSigma;
    private final double sigmaMax;
    private final boolean useMedian;
    private final double magErrFloor;
    private final double magLimit;
    private final int minUsed;
    private final List<String> badFlags;
    private final Predicate<MatchedPair> candidatePredicate;

    private PhotoCalConfig(Builder builder) {
        this.fluxField = builder.fluxField;
        this.applyColorTerms = builder.applyColorTerms;
        this.colorterms = builder.colorterms;
        this.photoCatName = builder.photoCatName;
        this.reserveFraction = builder.reserveFraction;
        this.reserveSeed = builder.reserveSeed;
        this.nIter = builder.nIter;
        this.nSigma = builder.nSigma;
        this.sigmaMax = builder.sigmaMax;
        this.useMedian = builder.useMedian;
        this.magErrFloor = builder.magErrFloor;
        this.magLimit = builder.magLimit;
        this.minUsed = builder.minUsed;
        this.badFlags = Collections.unmodifiableList(new ArrayList<>(builder.badFlags));
        this.candidatePredicate = builder.candidatePredicate;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    /**
     * Build a configuration from properties. Recognized keys are the names of
     * the builder methods; <code>colorterms</code> names a file read with
     * {@link ColortermLibraryReader}, <code>badFlags</code> is a comma
     * separated list.
     *
     * @param props The properties
     * @return The configuration
     * @throws IOException If the colorterm library cannot be read
     * @throws ConfigurationException If a value is invalid
     */
    public static PhotoCalConfig fromProperties(Properties props) throws IOException {
        Builder builder = builder();
        try {
            String value = props.getProperty("fluxField");
            if (value != null) {
                builder.fluxField(value.trim());
            }
            value = props.getProperty("applyColorTerms");
            if (value != null) {
                builder.applyColorTerms(Boolean.parseBoolean(value.trim()));
            }
            value = props.getProperty("colorterms");
            if (value != null) {
                builder.colorterms(new ColortermLibraryReader().read(new File(value.trim())));
            }
            value = props.getProperty("photoCatName");
            if (value != null) {
                builder.photoCatName(value.trim());
            }
            value = props.getProperty("reserveFraction");
            if (value != null) {
                builder.reserveFraction(Double.parseDouble(value));
            }
            value = props.getProperty("reserveSeed");
            if (value != null) {
                builder.reserveSeed(Integer.parseInt(value.trim()));
            }
            value = props.getProperty("nIter");
            if (value != null) {
                builder.nIter(Integer.parseInt(value.trim()));
            }
            value = props.getProperty("nSigma");
            if (value != null) {
                builder.nSigma(Double.parseDouble(value));
            }
            value = props.getProperty("sigmaMax");
            if (value != null) {
                builder.sigmaMax(Double.parseDouble(value));
            }
            value = props.getProperty("useMedian");
            if (value != null) {
                builder.useMedian(Boolean.parseBoolean(value.trim()));
            }
            value = props.getProperty("magErrFloor");
            if (value != null) {
                builder.magErrFloor(Double.parseDouble(value));
            }
            value = props.getProperty("magLimit");
            if (value != null) {
                builder.magLimit(Double.parseDouble(value));
            }
            value = props.getProperty("minUsed");
            if (value != null) {
                builder.minUsed(Integer.parseInt(value.trim()));
            }
            value = props.getProperty("badFlags");
            if (value != null) {
                builder.badFlags(value.trim().isEmpty() ? Collections.emptyList() : Arrays.asList(value.trim().split("\\s*,\\s*")));
            }
        } catch (NumberFormatException x) {
            throw new ConfigurationException("Invalid number in photocal configuration", x);
        }
        return builder.build();
    }

    /** Name of the instrumental flux field of the source catalog. */
    public String getFluxField() {
        return fluxField;
    }

    public boolean isApplyColorTerms() {
        return applyColorTerms;
    }

    public ColortermLibrary getColorterms() {
        return colorterms;
    }

    /** Name of the reference catalog, matched against the colorterm library keys. */
    public String getPhotoCatName() {
        return photoCatName;
    }

    /** Fraction of candidates held out of the fit, in [0,1). */
    public double getReserveFraction() {
        return reserveFraction;
    }

    public int getReserveSeed() {
        return reserveSeed;
    }

    public int getNIter() {
        return nIter;
    }

    public double getNSigma() {
        return nSigma;
    }

    /**
     * Upper bound on the clipping width in magnitudes. NaN means it is
     * derived from the data on the first iteration.
     */
    public double getSigmaMax() {
        return sigmaMax;
    }

    public boolean isUseMedian() {
        return useMedian;
    }

    public double getMagErrFloor() {
        return magErrFloor;
    }

    /** Faintest reference magnitude accepted as a candidate, NaN for no limit. */
    public double getMagLimit() {
        return magLimit;
    }

    public int getMinUsed() {
        return minUsed;
    }

    public List<String> getBadFlags() {
        return badFlags;
    }

    public Predicate<MatchedPair> getCandidatePredicate() {
        return candidatePredicate;
    }

    @Override
    public String toString() {
        return "PhotoCalConfig{" + "fluxField=" + fluxField + ", applyColorTerms=" + applyColorTerms
                + ", photoCatName=" + photoCatName + ", reserveFraction=" + reserveFraction + ", reserveSeed=" + reserveSeed
                + ", nIter=" + nIter + ", nSigma=" + nSigma + ", sigmaMax=" + sigmaMax + ", useMedian=" + useMedian
                + ", magErrFloor=" + magErrFloor + ", magLimit=" + magLimit + ", minUsed=" + minUsed + ", badFlags=" + badFlags + '}';
    }

    public static class Builder {

        private String fluxField = DEFAULT_FLUX_FIELD;
        private boolean applyColorTerms = false;
        private ColortermLibrary colorterms = ColortermLibrary.builder().build();
        private String photoCatName;
        private double reserveFraction = 0.0;
        private int reserveSeed = 1;
        private int nIter = 20;
        private double nSigma = 3.0;
        private double sigmaMax = 0.25;
        private boolean useMedian = true;
        private double magErrFloor = 0.0;
        private double magLimit = Double.NaN;
        private int minUsed = 3;
        private List<String> badFlags = Collections.emptyList();
        private Predicate<MatchedPair> candidatePredicate = (pair) -> true;

        private Builder() {
        }

        private Builder(PhotoCalConfig config) {
            this.fluxField = config.fluxField;
            this.applyColorTerms = config.applyColorTerms;
            this.colorterms = config.colorterms;
            this.photoCatName = config.photoCatName;
            this.reserveFraction = config.reserveFraction;
            this.reserveSeed = config.reserveSeed;
            this.nIter = config.nIter;
            this.nSigma = config.nSigma;
            this.sigmaMax = config.sigmaMax;
            this.useMedian = config.useMedian;
            this.magErrFloor = config.magErrFloor;
            this.magLimit = config.magLimit;
            this.minUsed = config.minUsed;
            this.badFlags = config.badFlags;
            this.candidatePredicate = config.candidatePredicate;
        }

        public Builder fluxField(String fluxField) {
            this.fluxField = fluxField;
            return this;
        }

        public Builder applyColorTerms(boolean applyColorTerms) {
            this.applyColorTerms = applyColorTerms;
            return this;
        }

        public Builder colorterms(ColortermLibrary colorterms) {
            this.colorterms = colorterms;
            return this;
        }

        public Builder photoCatName(String photoCatName) {
            this.photoCatName = photoCatName;
            return this;
        }

        public Builder reserveFraction(double reserveFraction) {
            this.reserveFraction = reserveFraction;
            return this;
        }

        public Builder reserveSeed(int reserveSeed) {
            this.reserveSeed = reserveSeed;
            return this;
        }

        public Builder nIter(int nIter) {
            this.nIter = nIter;
            return this;
        }

        public Builder nSigma(double nSigma) {
            this.nSigma = nSigma;
            return this;
        }

        public Builder sigmaMax(double sigmaMax) {
            this.sigmaMax = sigmaMax;
            return this;
        }

        public Builder useMedian(boolean useMedian) {
            this.useMedian = useMedian;
            return this;
        }

        public Builder magErrFloor(double magErrFloor) {
            this.magErrFloor = magErrFloor;
            return this;
        }

        public Builder magLimit(double magLimit) {
            this.magLimit = magLimit;
            return this;
        }

        public Builder minUsed(int minUsed) {
            this.minUsed = minUsed;
            return this;
        }

        public Builder badFlags(List<String> badFlags) {
            this.badFlags = badFlags;
            return this;
        }

        public Builder candidatePredicate(Predicate<MatchedPair> candidatePredicate) {
            this.candidatePredicate = candidatePredicate;
            return this;
        }

        /**
         * Validate and build the configuration.
         *
         * @return The configuration
         * @throws ConfigurationException If any value is out of range
         */
        public PhotoCalConfig build() {
            if (fluxField == null || fluxField.isEmpty()) {
                throw new ConfigurationException("fluxField must be set");
            }
            if (!(reserveFraction >= 0 && reserveFraction < 1)) {
                throw new ConfigurationException("reserveFraction must be in [0,1), got " + reserveFraction);
            }
            if (applyColorTerms && (photoCatName == null || photoCatName.isEmpty())) {
                throw new ConfigurationException("photoCatName must be set when applyColorTerms is true");
            }
            if (applyColorTerms && colorterms == null) {
                throw new ConfigurationException("colorterms must be set when applyColorTerms is true");
            }
            if (nIter < 1) {
                throw new ConfigurationException("nIter must be at least 1, got " + nIter);
            }
            if (!(nSigma > 0)) {
                throw new ConfigurationException("nSigma must be positive, got " + nSigma);
            }
            if (sigmaMax <= 0) {
                throw new ConfigurationException("sigmaMax must be positive or NaN, got " + sigmaMax);
            }
            if (!(magErrFloor >= 0)) {
                throw new ConfigurationException("magErrFloor must be non-negative, got " + magErrFloor);
            }
            if (minUsed < 1) {
                throw new ConfigurationException("minUsed must be at least 1, got " + minUsed);
            }
            if (badFlags == null || candidatePredicate == null) {
                throw new ConfigurationException("badFlags and candidatePredicate must not be null");
            }
            return new PhotoCalConfig(this);
        }
    }
}
