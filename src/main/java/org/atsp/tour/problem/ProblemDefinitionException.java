package org.atsp.tour.problem;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Thrown when a distance matrix cannot back a {@link Problem}.
 *
 * <p>Messages are prefixed with deterministic reason-code text.</p>
 */
@Getter
@Accessors(fluent = true)
public final class ProblemDefinitionException extends RuntimeException {
    public static final String REASON_DIMENSION_INVALID = "P01_DIMENSION_INVALID";
    public static final String REASON_MATRIX_SHAPE = "P01_MATRIX_SHAPE";
    public static final String REASON_DISTANCE_INVALID = "P01_DISTANCE_INVALID";
    public static final String REASON_MATRIX_FORMAT = "P02_MATRIX_FORMAT";

    private final String reasonCode;

    /**
     * Creates a reason-coded problem failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive message.
     */
    public ProblemDefinitionException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Creates a reason-coded problem failure with a cause.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive message.
     * @param cause underlying exception.
     */
    public ProblemDefinitionException(String reasonCode, String message, Throwable cause) {
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
