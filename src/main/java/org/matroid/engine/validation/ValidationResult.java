package org.matroid.engine.validation;

import lombok.Value;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Outcome of an axiom check: valid, or the first violation found.
 *
 * <p>Which violation is reported first depends on scan order; only {@link #valid()} is
 * guaranteed to be the same across equivalent inputs.</p>
 */
@Value
@Accessors(fluent = true)
public class ValidationResult {
    private static final ValidationResult VALID = new ValidationResult(true, null, null);

    /** True when every axiom holds. */
    boolean valid;
    /** Reason code of the first violation, {@code null} when valid. */
    String reasonCode;
    /** Human-readable description of the first violation, {@code null} when valid. */
    String message;

    public static ValidationResult ok() {
        return VALID;
    }

    public static ValidationResult violation(String reasonCode, String message) {
        return new ValidationResult(
                false,
                Objects.requireNonNull(reasonCode, "reasonCode"),
                Objects.requireNonNull(message, "message")
        );
    }
}
