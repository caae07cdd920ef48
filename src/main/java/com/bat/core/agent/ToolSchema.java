package com.bat.core.agent;

import java.util.Map;

/**
 * Describes an invocable tool to the reasoning oracle.
 *
 * @param name        unique tool name
 * @param description what the tool does
 * @param parameters  structured parameter schema (typically JSON-Schema shaped)
 */
public record ToolSchema(String name, String description, Map<String, Object> parameters) {

    public ToolSchema {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Tool name must not be blank");
        }
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
    }
}
