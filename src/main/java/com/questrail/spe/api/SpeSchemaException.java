package com.questrail.spe.api;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Indicates that the unified metadata of an SPE file failed validation.
 *
 * <p>The exception carries every violation found in a single decode attempt,
 * not only the first one.</p>
 */
public final class SpeSchemaException extends RuntimeException
{
    private final List<SchemaViolation> violations;

    public SpeSchemaException(List<SchemaViolation> violations) {
        super(summarize(violations));
        this.violations = List.copyOf(violations);
    }

    public List<SchemaViolation> violations() {
        return violations;
    }

    private static String summarize(List<SchemaViolation> violations) {
        return violations.size() + " metadata violation(s): "
                + violations.stream().map(SchemaViolation::toString).collect(Collectors.joining("; "));
    }
}
