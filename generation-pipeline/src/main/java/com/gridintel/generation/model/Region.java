package com.gridintel.generation.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Geographic buckets shared by generation and weather data.
 * The label is what gets persisted and used for folder names.
 */
public enum Region {
    NORTH("North"),
    CENTRAL("Central"),
    SOUTH("South"),
    EAST("East"),
    ISLANDS("Islands"),
    OTHER("Other"),
    UNKNOWN("Unknown");

    private final String label;

    Region(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /** Case-insensitive, whitespace-tolerant lookup by label. */
    public static Optional<Region> fromLabel(String label) {
        if (label == null || label.isBlank()) return Optional.empty();
        String trimmed = label.trim();
        return Arrays.stream(values())
                .filter(r -> r.label.equalsIgnoreCase(trimmed))
                .findFirst();
    }

    @Override
    public String toString() {
        return label;
    }
}
