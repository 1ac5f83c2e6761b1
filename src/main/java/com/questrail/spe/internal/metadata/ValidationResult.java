package com.questrail.spe.internal.metadata;

import com.questrail.spe.api.SchemaViolation;
import com.questrail.spe.api.SpeSchemaException;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of validating metadata: either a value or the complete list of
 * violations found, never both.
 */
public final class ValidationResult<T>
{
    private final T value;
    private final List<SchemaViolation> violations;

    private ValidationResult(T value, List<SchemaViolation> violations) {
        this.value = value;
        this.violations = List.copyOf(violations);
    }

    public static <T> ValidationResult<T> valid(T value) {
        return new ValidationResult<>(Objects.requireNonNull(value, "value"), List.of());
    }

    public static <T> ValidationResult<T> invalid(List<SchemaViolation> violations) {
        if (violations.isEmpty()) {
            throw new IllegalArgumentException("An invalid result needs at least one violation");
        }
        return new ValidationResult<>(null, violations);
    }

    public boolean isValid() {
        return violations.isEmpty();
    }

    public Optional<T> value() {
        return Optional.ofNullable(value);
    }

    public List<SchemaViolation> violations() {
        return violations;
    }

    /**
     * Returns the value, or throws one exception carrying every violation.
     *
     * @throws SpeSchemaException if validation failed
     */
    public T orElseThrow() {
        if (!isValid()) {
            throw new SpeSchemaException(violations);
        }
        return value;
    }
}
