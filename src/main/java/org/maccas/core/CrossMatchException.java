package org.maccas.core;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Fatal cross-match failure with a deterministic reason code.
 *
 * <p>Any instance aborts the whole run; no partial output is written for the failing stage.</p>
 */
@Getter
@Accessors(fluent = true)
public final class CrossMatchException extends RuntimeException {
    public static final String REASON_REQUIRED_COLUMN_MISSING = "CM_REQUIRED_COLUMN_MISSING";
    public static final String REASON_INSUFFICIENT_INITIAL_MATCHES = "CM_INSUFFICIENT_INITIAL_MATCHES";
    public static final String REASON_INSUFFICIENT_MODEL_POINTS = "CM_INSUFFICIENT_MODEL_POINTS";
    public static final String REASON_MODEL_FIT_FAILED = "CM_MODEL_FIT_FAILED";
    public static final String REASON_INSUFFICIENT_CALIBRATION_SAMPLE = "CM_INSUFFICIENT_CALIBRATION_SAMPLE";
    public static final String REASON_TABLE_WRITE_FAILED = "CM_TABLE_WRITE_FAILED";

    private final String reasonCode;

    /**
     * Creates a reason-coded failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive message.
     */
    public CrossMatchException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Creates a reason-coded failure with a cause.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive message.
     * @param cause underlying exception.
     */
    public CrossMatchException(String reasonCode, String message, Throwable cause) {
        super(formatMessage(reasonCode, message), cause);
        this.reasonCode = requireReasonCode(reasonCode);
    }

    private static String formatMessage(String reasonCode, String message) {
        return "[" + requireReasonCode(reasonCode) + "] " + Objects.requireNonNull(message, "message");
    }

    private static String requireReasonCode(String reasonCode) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return code;
    }
}
