package com.company.matching.oracle;

import java.util.Locale;

/**
 * Confidence level reported by the decision oracle, ordered {@code LOW < MEDIUM < HIGH}.
 */
public enum Confidence {
    LOW,
    MEDIUM,
    HIGH;

    public boolean isAtLeast(Confidence other) {
        return compareTo(other) >= 0;
    }

    /**
     * Parses the wire value ({@code low}, {@code medium} or {@code high}, any case, no padding).
     *
     * @throws VerdictParseException if the value is not one of the three levels
     */
    public static Confidence fromWireValue(String value) {
        if (value == null) {
            throw new VerdictParseException("confidence is missing");
        }
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "low" -> LOW;
            case "medium" -> MEDIUM;
            case "high" -> HIGH;
            default -> throw new VerdictParseException("Unknown confidence level: '" + value + "'");
        };
    }
}
