package org.maccas.outlier;

import org.maccas.model.OffsetVector;

/**
 * Leave-one-out evaluation of one confirmed match.
 *
 * @param reason rejection rule that fired, {@code null} when the match is kept.
 * @param observed the match's own offset (image minus reference).
 * @param predicted offset field prediction from all other matches; {@code null} when too few
 *                  other matches existed to fit one.
 * @param errorBudget combined positional error budget of the pair, degrees.
 */
public record OutlierVerdict(
        RejectionReason reason,
        OffsetVector observed,
        OffsetVector predicted,
        double errorBudget
) {
    public boolean rejected() {
        return reason != null;
    }

    /**
     * Unsigned angle between observed and predicted offsets, or {@code NaN} without a prediction.
     */
    public double angleDifferenceDegrees() {
        return predicted == null ? Double.NaN : observed.angleBetweenDegrees(predicted);
    }
}
