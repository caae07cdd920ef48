package com.bat.core.agent;

/**
 * A selected tool reported failure.
 */
public class ToolExecutionFailedException extends RuntimeException {

    private final String toolName;

    public ToolExecutionFailedException(String toolName, String error) {
        super("Tool execution failed: " + error);
        this.toolName = toolName;
    }

    public String getToolName() {
        return toolName;
    }
}
