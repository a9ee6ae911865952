package org.maccas.core;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable engine configuration, passed explicitly to every stage.
 */
@Value
@Builder(toBuilder = true)
public class MatchingConfig {
    public static final double DEFAULT_RBF_SMOOTHING = 0.032777778d;

    /**
     * Minimum normalized probability to accept the best of several candidates.
     */
    @Builder.Default
    double multipleMatchConfidence = 0.8d;

    /**
     * Minimum raw combined probability to accept a lone candidate.
     */
    @Builder.Default
    double singleMatchConfidence = 0.8d;

    /**
     * When true, flux agreement multiplies into the match probability.
     */
    @Builder.Default
    boolean fluxMatching = true;

    /**
     * Minimum peak_flux/local_rms for target sources in the initial pass. {@code null} disables the cut.
     */
    @Builder.Default
    Double initialSnrFloor = null;

    @Builder.Default
    boolean fluxCalibration = false;

    /**
     * Polynomial order per axis of the flux correction surface.
     */
    @Builder.Default
    int fluxModelDegree = 1;

    /**
     * Enables diagnostic callbacks. Never changes matching outcome.
     */
    @Builder.Default
    boolean diagnosticPlotting = false;

    @Builder.Default
    double coarseSearchRadiusArcsec = 600.0d;

    @Builder.Default
    double calibrationMatchRadiusArcsec = 118.0d;

    @Builder.Default
    double calibrationSnrFloor = 10.0d;

    @Builder.Default
    double rbfSmoothing = DEFAULT_RBF_SMOOTHING;

    /**
     * Multiple of (max source half-size + max PSF half-width) added around the target footprint.
     */
    @Builder.Default
    double prefilterBufferFactor = 5.0d;

    @Builder.Default
    boolean outlierRejection = true;

    @Builder.Default
    double outlierAngleThresholdDegrees = 45.0d;

    /**
     * Cap on MATCHING rounds before the engine moves on to the final pass.
     */
    @Builder.Default
    int maxRounds = 1000;

    /**
     * Seed for the outlier evaluation order.
     */
    @Builder.Default
    long randomSeed = 0x5EEDL;

    /**
     * Returns the default configuration.
     */
    public static MatchingConfig defaults() {
        return MatchingConfig.builder().build();
    }

    public boolean hasInitialSnrFloor() {
        return initialSnrFloor != null;
    }

    public double coarseSearchRadiusDegrees() {
        return coarseSearchRadiusArcsec / 3600.0d;
    }

    public double calibrationMatchRadiusDegrees() {
        return calibrationMatchRadiusArcsec / 3600.0d;
    }

    /**
     * Checks ranges of every field.
     *
     * @return this config, for chaining.
     * @throws IllegalArgumentException on the first out-of-range value.
     */
    public MatchingConfig validate() {
        requireProbability(multipleMatchConfidence, "multipleMatchConfidence");
        requireProbability(singleMatchConfidence, "singleMatchConfidence");
        if (initialSnrFloor != null && !Double.isFinite(initialSnrFloor)) {
            throw new IllegalArgumentException("initialSnrFloor must be finite when set");
        }
        if (fluxModelDegree < 1 || fluxModelDegree > 5) {
            throw new IllegalArgumentException("fluxModelDegree must be in [1, 5], got " + fluxModelDegree);
        }
        requirePositive(coarseSearchRadiusArcsec, "coarseSearchRadiusArcsec");
        requirePositive(calibrationMatchRadiusArcsec, "calibrationMatchRadiusArcsec");
        requirePositive(prefilterBufferFactor, "prefilterBufferFactor");
        if (!(calibrationSnrFloor >= 0.0d) || !Double.isFinite(calibrationSnrFloor)) {
            throw new IllegalArgumentException("calibrationSnrFloor must be finite and >= 0");
        }
        if (!(rbfSmoothing >= 0.0d) || !Double.isFinite(rbfSmoothing)) {
            throw new IllegalArgumentException("rbfSmoothing must be finite and >= 0");
        }
        if (!(outlierAngleThresholdDegrees > 0.0d) || outlierAngleThresholdDegrees > 180.0d) {
            throw new IllegalArgumentException("outlierAngleThresholdDegrees must be in (0, 180]");
        }
        if (maxRounds < 1) {
            throw new IllegalArgumentException("maxRounds must be >= 1");
        }
        return this;
    }

    private static void requireProbability(double value, String name) {
        if (!(value >= 0.0d && value <= 1.0d)) {
            throw new IllegalArgumentException(name + " must be in [0, 1], got " + value);
        }
    }

    private static void requirePositive(double value, String name) {
        if (!(value > 0.0d) || !Double.isFinite(value)) {
            throw new IllegalArgumentException(name + " must be finite and > 0, got " + value);
        }
    }
}
