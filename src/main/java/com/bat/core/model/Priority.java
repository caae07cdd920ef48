package com.bat.core.model;

import java.util.Locale;

/**
 * Task priority. The weight orders results only; it does not gate concurrency
 * unless the orchestrator runs with a bounded worker pool.
 */
public enum Priority {
    HIGH(3),
    MEDIUM(2),
    LOW(1);

    private final int weight;

    Priority(int weight) {
        this.weight = weight;
    }

    public int weight() {
        return weight;
    }

    /**
     * Parses a priority name case-insensitively.
     *
     * @throws IllegalArgumentException for anything other than high, medium or low
     */
    public static Priority parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Priority must not be blank");
        }
        try {
            return Priority.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid priority: " + value + ". Valid priorities: high, medium, low");
        }
    }
}
