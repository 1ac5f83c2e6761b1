package com.questrail.spe.internal.metadata;

import com.questrail.spe.api.SchemaViolation;
import com.questrail.spe.api.SchemaViolation.Kind;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Accumulates schema violations while raw metadata strings are converted to
 * typed values. Conversions never throw; a failed conversion records a
 * violation and yields an empty result so validation can continue.
 */
final class Violations
{
    private final List<SchemaViolation> violations = new ArrayList<>();

    void missing(String field, String message) {
        violations.add(new SchemaViolation(field, Kind.MISSING, message));
    }

    void wrongType(String field, String message) {
        violations.add(new SchemaViolation(field, Kind.WRONG_TYPE, message));
    }

    void outOfRange(String field, String message) {
        violations.add(new SchemaViolation(field, Kind.OUT_OF_RANGE, message));
    }

    int size() {
        return violations.size();
    }

    boolean isEmpty() {
        return violations.isEmpty();
    }

    List<SchemaViolation> toList() {
        return List.copyOf(violations);
    }

    /**
     * Parses an optional integer attribute; {@code null} means absent.
     */
    Optional<Long> integer(String field, String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(Long.parseLong(raw.trim()));
        }
        catch (NumberFormatException e) {
            wrongType(field, "expected an integer, got '" + raw + "'");
            return Optional.empty();
        }
    }

    /**
     * Parses a required integer attribute.
     */
    Optional<Long> requiredInteger(String field, String raw) {
        if (raw == null) {
            missing(field, "required attribute is absent");
            return Optional.empty();
        }
        return integer(field, raw);
    }

    /**
     * Parses an optional finite number; {@code null} means absent.
     */
    Optional<Double> number(String field, String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        try {
            final double value = Double.parseDouble(raw.trim());
            if (!Double.isFinite(value)) {
                outOfRange(field, "value " + raw + " is not finite");
                return Optional.empty();
            }
            return Optional.of(value);
        }
        catch (NumberFormatException e) {
            wrongType(field, "expected a number, got '" + raw + "'");
            return Optional.empty();
        }
    }

    /**
     * Parses a required, non-empty, comma separated list of finite numbers.
     * Every bad entry is reported.
     */
    Optional<List<Double>> numbers(String field, String csv) {
        if (csv == null || csv.isBlank()) {
            missing(field, "no values given");
            return Optional.empty();
        }
        final int before = size();
        final String[] parts = csv.trim().split("\\s*,\\s*");
        final List<Double> values = new ArrayList<>(parts.length);
        for (int i = 0; i < parts.length; i++) {
            number(field + "[" + i + "]", parts[i]).ifPresent(values::add);
        }
        return size() == before ? Optional.of(values) : Optional.empty();
    }
}
