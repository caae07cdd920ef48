package com.bat.core.model;

import java.util.Map;

/**
 * Decoded tool-selection reply: {@code {"tool": string, "input": object}}.
 */
public record ToolSelection(String tool, Map<String, Object> input) {

    public ToolSelection {
        input = input == null ? Map.of() : input;
    }
}
