package org.maccas.outlier;

/**
 * Rule that moved a match to the rejected set.
 */
public enum RejectionReason {
    /**
     * Observed offset points more than the angle threshold away from the predicted offset, and
     * the predicted magnitude is smaller than the observed one.
     */
    DIRECTION_DISAGREES,
    /**
     * Observed magnitude exceeds predicted magnitude plus the positional error budget.
     */
    MAGNITUDE_EXCEEDS
}
