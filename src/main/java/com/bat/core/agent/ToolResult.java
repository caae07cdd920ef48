package com.bat.core.agent;

/**
 * Outcome of a tool call: either a result or an error message.
 */
public record ToolResult(boolean success, Object result, String error) {

    public static ToolResult success(Object result) {
        return new ToolResult(true, result, null);
    }

    public static ToolResult failure(String error) {
        return new ToolResult(false, null, error);
    }
}
