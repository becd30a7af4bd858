package com.catalog.crossmatch.api;

import com.catalog.crossmatch.correction.FluxModelFallback;
import com.catalog.crossmatch.error.ConfigurationException;
import com.catalog.crossmatch.likelihood.SkyGeometry;
import com.catalog.crossmatch.surface.PolynomialSurfaceFitter;

import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Immutable run parameters, passed explicitly to every stage of a run.
 */
public class CrossMatchOptions {

    private static final double DEFAULT_SNR_CUTOFF = 10.0;
    private static final double DEFAULT_SINGLE_MATCH_THRESHOLD = 0.95;
    private static final double DEFAULT_MULTIPLE_MATCH_THRESHOLD = 0.60;
    private static final double DEFAULT_NEGLIGIBLE_LIKELIHOOD = 0.005;
    private static final double DEFAULT_OFFSET_SMOOTHING = 0.032777778;
    private static final double DEFAULT_SEARCH_RADIUS_ARCSEC = 600.0;
    private static final int DEFAULT_MAX_ROUNDS = 50;

    private final boolean snrRestriction;
    private final double snrCutoff;
    private final boolean fluxMatching;
    private final boolean fluxModel;
    private final int fluxModelDegree;
    private final FluxModelFallback fluxModelFallback;
    private final double singleMatchThreshold;
    private final double multipleMatchThreshold;
    private final double negligibleLikelihood;
    private final Double targetFrequencyMHz;
    private final boolean allowFrequencyExtrapolation;
    private final double searchRadiusArcsec;
    private final double fluxCalibrationRadiusArcsec;
    private final double offsetSmoothing;
    private final int maxRounds;
    private final int parallelism;
    private final boolean forceFinalRound;
    private final boolean referencePreFilter;

    private CrossMatchOptions(Builder builder) {
        this.snrRestriction = builder.snrRestriction;
        this.snrCutoff = builder.snrCutoff;
        this.fluxMatching = builder.fluxMatching;
        this.fluxModel = builder.fluxModel;
        this.fluxModelDegree = builder.fluxModelDegree;
        this.fluxModelFallback = builder.fluxModelFallback;
        this.singleMatchThreshold = builder.singleMatchThreshold;
        this.multipleMatchThreshold = builder.multipleMatchThreshold;
        this.negligibleLikelihood = builder.negligibleLikelihood;
        this.targetFrequencyMHz = builder.targetFrequencyMHz;
        this.allowFrequencyExtrapolation = builder.allowFrequencyExtrapolation;
        this.searchRadiusArcsec = builder.searchRadiusArcsec;
        this.fluxCalibrationRadiusArcsec = builder.fluxCalibrationRadiusArcsec;
        this.offsetSmoothing = builder.offsetSmoothing;
        this.maxRounds = builder.maxRounds;
        this.parallelism = builder.parallelism;
        this.forceFinalRound = builder.forceFinalRound;
        this.referencePreFilter = builder.referencePreFilter;
    }

    public boolean isSnrRestriction() { return snrRestriction; }
    public double getSnrCutoff() { return snrCutoff; }
    public boolean isFluxMatching() { return fluxMatching; }
    public boolean isFluxModel() { return fluxModel; }
    public int getFluxModelDegree() { return fluxModelDegree; }
    public FluxModelFallback getFluxModelFallback() { return fluxModelFallback; }
    public double getSingleMatchThreshold() { return singleMatchThreshold; }
    public double getMultipleMatchThreshold() { return multipleMatchThreshold; }
    public double getNegligibleLikelihood() { return negligibleLikelihood; }
    public boolean isAllowFrequencyExtrapolation() { return allowFrequencyExtrapolation; }
    public double getSearchRadiusArcsec() { return searchRadiusArcsec; }
    public double getFluxCalibrationRadiusArcsec() { return fluxCalibrationRadiusArcsec; }
    public double getOffsetSmoothing() { return offsetSmoothing; }
    public int getMaxRounds() { return maxRounds; }
    public int getParallelism() { return parallelism; }
    public boolean isForceFinalRound() { return forceFinalRound; }
    public boolean isReferencePreFilter() { return referencePreFilter; }

    public OptionalDouble getTargetFrequencyMHz() {
        return targetFrequencyMHz != null ? OptionalDouble.of(targetFrequencyMHz) : OptionalDouble.empty();
    }

    public double searchRadiusDeg() {
        return SkyGeometry.arcsecToDegrees(searchRadiusArcsec);
    }

    public double fluxCalibrationRadiusDeg() {
        return SkyGeometry.arcsecToDegrees(fluxCalibrationRadiusArcsec);
    }

    public static CrossMatchOptions defaults() {
        return builder().build();
    }

    /**
     * Options for catalogues whose fluxes are not comparable: positions only.
     */
    public static CrossMatchOptions positionalOnly() {
        return builder().fluxMatching(false).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder pre-filled with the values of {@code options}.
     */
    public static Builder builder(CrossMatchOptions options) {
        Builder b = new Builder();
        b.snrRestriction = options.snrRestriction;
        b.snrCutoff = options.snrCutoff;
        b.fluxMatching = options.fluxMatching;
        b.fluxModel = options.fluxModel;
        b.fluxModelDegree = options.fluxModelDegree;
        b.fluxModelFallback = options.fluxModelFallback;
        b.singleMatchThreshold = options.singleMatchThreshold;
        b.multipleMatchThreshold = options.multipleMatchThreshold;
        b.negligibleLikelihood = options.negligibleLikelihood;
        b.targetFrequencyMHz = options.targetFrequencyMHz;
        b.allowFrequencyExtrapolation = options.allowFrequencyExtrapolation;
        b.searchRadiusArcsec = options.searchRadiusArcsec;
        b.fluxCalibrationRadiusArcsec = options.fluxCalibrationRadiusArcsec;
        b.offsetSmoothing = options.offsetSmoothing;
        b.maxRounds = options.maxRounds;
        b.parallelism = options.parallelism;
        b.forceFinalRound = options.forceFinalRound;
        b.referencePreFilter = options.referencePreFilter;
        return b;
    }

    public static class Builder {
        private boolean snrRestriction = true;
        private double snrCutoff = DEFAULT_SNR_CUTOFF;
        private boolean fluxMatching = true;
        private boolean fluxModel = false;
        private int fluxModelDegree = PolynomialSurfaceFitter.MIN_DEGREE;
        private FluxModelFallback fluxModelFallback = FluxModelFallback.FAIL;
        private double singleMatchThreshold = DEFAULT_SINGLE_MATCH_THRESHOLD;
        private double multipleMatchThreshold = DEFAULT_MULTIPLE_MATCH_THRESHOLD;
        private double negligibleLikelihood = DEFAULT_NEGLIGIBLE_LIKELIHOOD;
        private Double targetFrequencyMHz;
        private boolean allowFrequencyExtrapolation = true;
        private double searchRadiusArcsec = DEFAULT_SEARCH_RADIUS_ARCSEC;
        private double fluxCalibrationRadiusArcsec = DEFAULT_SEARCH_RADIUS_ARCSEC;
        private double offsetSmoothing = DEFAULT_OFFSET_SMOOTHING;
        private int maxRounds = DEFAULT_MAX_ROUNDS;
        private int parallelism = 1;
        private boolean forceFinalRound = false;
        private boolean referencePreFilter = true;

        public Builder snrRestriction(boolean snrRestriction) {
            this.snrRestriction = snrRestriction;
            return this;
        }

        public Builder snrCutoff(double snrCutoff) {
            if (!(snrCutoff >= 0.0) || Double.isInfinite(snrCutoff)) {
                throw new ConfigurationException("snrCutoff", "must be a finite value >= 0, got " + snrCutoff);
            }
            this.snrCutoff = snrCutoff;
            return this;
        }

        public Builder fluxMatching(boolean fluxMatching) {
            this.fluxMatching = fluxMatching;
            return this;
        }

        public Builder fluxModel(boolean fluxModel) {
            this.fluxModel = fluxModel;
            return this;
        }

        public Builder fluxModelDegree(int degree) {
            if (degree < PolynomialSurfaceFitter.MIN_DEGREE || degree > PolynomialSurfaceFitter.MAX_DEGREE) {
                throw new ConfigurationException("fluxModelDegree", "must be between "
                        + PolynomialSurfaceFitter.MIN_DEGREE + " and " + PolynomialSurfaceFitter.MAX_DEGREE
                        + ", got " + degree);
            }
            this.fluxModelDegree = degree;
            return this;
        }

        public Builder fluxModelFallback(FluxModelFallback fallback) {
            this.fluxModelFallback = Objects.requireNonNull(fallback, "fluxModelFallback is required");
            return this;
        }

        public Builder singleMatchThreshold(double threshold) {
            validateThreshold(threshold, "singleMatchThreshold");
            this.singleMatchThreshold = threshold;
            return this;
        }

        public Builder multipleMatchThreshold(double threshold) {
            validateThreshold(threshold, "multipleMatchThreshold");
            this.multipleMatchThreshold = threshold;
            return this;
        }

        public Builder negligibleLikelihood(double negligible) {
            validateThreshold(negligible, "negligibleLikelihood");
            this.negligibleLikelihood = negligible;
            return this;
        }

        /**
         * Frequency of the target catalogue in MHz, or null when unknown.
         */
        public Builder targetFrequencyMHz(Double frequency) {
            if (frequency != null && !(frequency > 0.0 && Double.isFinite(frequency))) {
                throw new ConfigurationException("targetFrequencyMHz", "must be positive, got " + frequency);
            }
            this.targetFrequencyMHz = frequency;
            return this;
        }

        public Builder allowFrequencyExtrapolation(boolean allow) {
            this.allowFrequencyExtrapolation = allow;
            return this;
        }

        public Builder searchRadiusArcsec(double radius) {
            validatePositive(radius, "searchRadiusArcsec");
            this.searchRadiusArcsec = radius;
            return this;
        }

        public Builder fluxCalibrationRadiusArcsec(double radius) {
            validatePositive(radius, "fluxCalibrationRadiusArcsec");
            this.fluxCalibrationRadiusArcsec = radius;
            return this;
        }

        public Builder offsetSmoothing(double smoothing) {
            if (!(smoothing >= 0.0) || Double.isInfinite(smoothing)) {
                throw new ConfigurationException("offsetSmoothing", "must be a finite value >= 0, got " + smoothing);
            }
            this.offsetSmoothing = smoothing;
            return this;
        }

        public Builder maxRounds(int maxRounds) {
            if (maxRounds <= 0) {
                throw new ConfigurationException("maxRounds", "must be positive, got " + maxRounds);
            }
            this.maxRounds = maxRounds;
            return this;
        }

        public Builder parallelism(int parallelism) {
            if (parallelism <= 0) {
                throw new ConfigurationException("parallelism", "must be positive, got " + parallelism);
            }
            this.parallelism = parallelism;
            return this;
        }

        public Builder forceFinalRound(boolean forceFinalRound) {
            this.forceFinalRound = forceFinalRound;
            return this;
        }

        public Builder referencePreFilter(boolean referencePreFilter) {
            this.referencePreFilter = referencePreFilter;
            return this;
        }

        public CrossMatchOptions build() {
            return new CrossMatchOptions(this);
        }

        private static void validateThreshold(double value, String name) {
            if (value < 0.0 || value > 1.0 || Double.isNaN(value)) {
                throw new ConfigurationException(name, "must be between 0.0 and 1.0, got " + value);
            }
        }

        private static void validatePositive(double value, String name) {
            if (!(value > 0.0) || Double.isInfinite(value)) {
                throw new ConfigurationException(name, "must be a finite positive value, got " + value);
            }
        }
    }

    @Override
    public String toString() {
        return "CrossMatchOptions{" +
                "snrRestriction=" + snrRestriction +
                ", snrCutoff=" + snrCutoff +
                ", fluxMatching=" + fluxMatching +
                ", fluxModel=" + fluxModel +
                ", fluxModelDegree=" + fluxModelDegree +
                ", fluxModelFallback=" + fluxModelFallback +
                ", singleMatchThreshold=" + singleMatchThreshold +
                ", multipleMatchThreshold=" + multipleMatchThreshold +
                ", negligibleLikelihood=" + negligibleLikelihood +
                ", targetFrequencyMHz=" + targetFrequencyMHz +
                ", searchRadiusArcsec=" + searchRadiusArcsec +
                ", maxRounds=" + maxRounds +
                ", parallelism=" + parallelism +
                ", forceFinalRound=" + forceFinalRound +
                ", referencePreFilter=" + referencePreFilter +
                '}';
    }
}
