package com.questrail.spe.internal.metadata;

import com.questrail.spe.internal.document.RawTrackField;

import java.util.Locale;

/**
 * Derives coordinate names for tracking fields.
 *
 * <p>Precedence: an explicit {@code name} attribute; {@code TimeStamp@event};
 * {@code GateTracking@component} ({@code gate_} prefix);
 * {@code ModulationTracking@component} ({@code modulation_} prefix); otherwise
 * the element name. Derived names are snake case.</p>
 */
final class TrackingFieldNames
{
    private TrackingFieldNames() {}

    static String nameOf(RawTrackField field) {
        final String explicit = field.attribute("name");
        if (explicit != null && !explicit.isBlank()) {
            return explicit.trim();
        }

        final String component = field.attribute("component");
        switch (field.element()) {
            case "TimeStamp" -> {
                final String event = field.attribute("event");
                if (event != null && !event.isBlank()) {
                    return timeStampName(event.trim());
                }
            }
            case "GateTracking" -> {
                if (component != null && !component.isBlank()) {
                    return "gate_" + snakeCase(component.trim());
                }
            }
            case "ModulationTracking" -> {
                if (component != null && !component.isBlank()) {
                    return "modulation_" + snakeCase(component.trim());
                }
            }
            default -> {
            }
        }
        return snakeCase(field.element());
    }

    private static String timeStampName(String event) {
        return switch (event) {
            case "ExposureStarted" -> "exposure_start";
            case "ExposureEnded" -> "exposure_end";
            default -> snakeCase(event);
        };
    }

    static String snakeCase(String name) {
        final StringBuilder out = new StringBuilder(name.length() + 8);
        for (int i = 0; i < name.length(); i++) {
            final char c = name.charAt(i);
            if (Character.isUpperCase(c)) {
                if (i > 0 && (Character.isLowerCase(name.charAt(i - 1))
                        || (i + 1 < name.length() && Character.isLowerCase(name.charAt(i + 1))
                            && Character.isUpperCase(name.charAt(i - 1))))) {
                    out.append('_');
                }
                out.append(Character.toLowerCase(c));
            }
            else if (c == ' ' || c == '-') {
                out.append('_');
            }
            else {
                out.append(c);
            }
        }
        return out.toString().toLowerCase(Locale.ROOT);
    }
}
