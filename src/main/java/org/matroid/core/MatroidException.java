package org.matroid.core;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Matroid contract failure with a deterministic reason code.
 *
 * <p>Only structural and contract errors are raised this way. Invalid defining data and
 * missing isomorphisms are reported as plain results.</p>
 */
@Getter
@Accessors(fluent = true)
public final class MatroidException extends RuntimeException {
    /** A defining-set element lies outside the ground set, or arguments are malformed. */
    public static final String INVALID_INPUT = "INVALID_INPUT";
    /** A circuit was requested from an independent set. */
    public static final String NO_CIRCUIT_FOUND = "NO_CIRCUIT_FOUND";
    /** A search or enumeration ran out of its step or time budget. */
    public static final String SEARCH_BUDGET_EXCEEDED = "SEARCH_BUDGET_EXCEEDED";

    private final String reasonCode;

    /**
     * Creates a reason-coded failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive message.
     */
    public MatroidException(String reasonCode, String message) {
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
    public MatroidException(String reasonCode, String message, Throwable cause) {
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
