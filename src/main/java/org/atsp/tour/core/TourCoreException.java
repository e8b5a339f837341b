package org.atsp.tour.core;

import lombok.Getter;

import java.util.Objects;

/**
 * Tour-core contract exception with deterministic reason codes.
 */
@Getter
public final class TourCoreException extends RuntimeException {
    public static final String REASON_ARC_REQUIRED = "T01_ARC_REQUIRED";
    public static final String REASON_ARC_DEST_NOT_REMAINING = "T01_ARC_DEST_NOT_REMAINING";
    public static final String REASON_ARC_SOURCE_NOT_LAST = "T01_ARC_SOURCE_NOT_LAST";
    public static final String REASON_TOUR_INFEASIBLE = "T02_TOUR_INFEASIBLE";
    public static final String REASON_MOVE_OUT_OF_RANGE = "T03_MOVE_OUT_OF_RANGE";
    public static final String REASON_ORDER_INVALID = "T04_ORDER_INVALID";
    public static final String REASON_COLONY_SAMPLING_FAILED = "T05_COLONY_SAMPLING_FAILED";
    public static final String REASON_ENGINE_TYPE_REQUIRED = "T06_ENGINE_TYPE_REQUIRED";

    private final String reasonCode;

    /**
     * Creates a reason-coded tour-core contract failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    public TourCoreException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Creates a reason-coded tour-core contract failure with a cause.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     * @param cause underlying cause.
     */
    public TourCoreException(String reasonCode, String message, Throwable cause) {
        super(formatMessage(reasonCode, message), cause);
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Formats exception message with deterministic reason-code prefix.
     */
    private static String formatMessage(String reasonCode, String message) {
        return "[" + requireReasonCode(reasonCode) + "] " + Objects.requireNonNull(message, "message");
    }

    /**
     * Validates reason-code contract.
     */
    private static String requireReasonCode(String reasonCode) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return code;
    }
}
