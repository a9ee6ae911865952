package org.maccas.model;

import java.util.Objects;

/**
 * Fitted positional distortion: one surface per axis.
 */
public final class OffsetField {
    private final SkySurface raOffset;
    private final SkySurface decOffset;
    private final int sampleCount;

    public OffsetField(SkySurface raOffset, SkySurface decOffset, int sampleCount) {
        this.raOffset = Objects.requireNonNull(raOffset, "raOffset");
        this.decOffset = Objects.requireNonNull(decOffset, "decOffset");
        this.sampleCount = sampleCount;
    }

    /**
     * Predicted offset at an image position.
     */
    public OffsetVector predict(double ra, double dec) {
        return new OffsetVector(raOffset.evaluate(ra, dec), decOffset.evaluate(ra, dec));
    }

    public int sampleCount() {
        return sampleCount;
    }

    @Override
    public String toString() {
        return "OffsetField[samples=" + sampleCount + "]";
    }
}
