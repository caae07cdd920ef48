package com.bat.core.agent.memory;

import java.util.Locale;

/**
 * Supported in-process memory kinds.
 */
public enum MemoryType {
    BUFFER,
    BUFFER_WINDOW,
    SUMMARY;

    /**
     * Accepts configuration spellings such as {@code buffer-window} or {@code BUFFER_WINDOW}.
     */
    public static MemoryType parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Memory type must not be blank");
        }
        try {
            return MemoryType.valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported memory type: " + value);
        }
    }
}
