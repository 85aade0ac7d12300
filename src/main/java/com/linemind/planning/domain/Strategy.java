package com.linemind.planning.domain;

import java.util.Locale;

public enum Strategy {
    HEURISTIC,
    EXACT;

    /**
     * Accepts "heuristic" / "exact" in any case.
     *
     * @throws IllegalArgumentException for anything else
     */
    public static Strategy parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Strategy must not be empty");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "heuristic" -> HEURISTIC;
            case "exact" -> EXACT;
            default -> throw new IllegalArgumentException("Unknown strategy '" + value + "', expected heuristic or exact");
        };
    }
}
