package org.Aayush.schedule.time;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Time-map contract exception with deterministic reason codes.
 *
 * <p>Messages are prefixed with the reason code, for example
 * {@code [TM_NON_MONOTONIC_TIME] times added must be in strictly increasing order}.</p>
 */
@Getter
@Accessors(fluent = true)
public final class TimeMapException extends RuntimeException {
    public static final String REASON_NON_MONOTONIC_TIME = "TM_NON_MONOTONIC_TIME";
    public static final String REASON_INVALID_CALENDAR_DATE = "TM_INVALID_CALENDAR_DATE";
    public static final String REASON_INDEX_OUT_OF_RANGE = "TM_INDEX_OUT_OF_RANGE";
    public static final String REASON_UNKNOWN_MONTH_NAME = "TM_UNKNOWN_MONTH_NAME";
    public static final String REASON_WRONG_DIRECTIVE_KIND = "TM_WRONG_DIRECTIVE_KIND";
    public static final String REASON_START_RECORD_REQUIRED = "TM_START_RECORD_REQUIRED";
    public static final String REASON_INVALID_CONFIG = "TM_INVALID_CONFIG";

    private final String reasonCode;

    /**
     * Creates a reason-coded time-map failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    public TimeMapException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Creates a reason-coded time-map failure with a cause.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     * @param cause underlying cause.
     */
    public TimeMapException(String reasonCode, String message, Throwable cause) {
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
