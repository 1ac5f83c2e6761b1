package com.questrail.spe.api;

import java.util.Objects;

/**
 * One metadata field that failed validation.
 *
 * @param field   dotted path of the offending field, e.g. {@code MetaFormat.TimeStamp[0].bitDepth}
 * @param kind    violation category
 * @param message human-readable detail
 */
public record SchemaViolation(String field, Kind kind, String message)
{
    public enum Kind
    {
        MISSING,
        WRONG_TYPE,
        OUT_OF_RANGE
    }

    public SchemaViolation {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
    }

    @Override
    public String toString() {
        return field + " (" + kind + "): " + message;
    }
}
