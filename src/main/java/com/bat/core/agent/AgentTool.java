package com.bat.core.agent;

import java.util.Map;

/**
 * A named operation an agent can invoke. Register implementations as Spring beans and
 * reference them by name from an agent definition.
 */
public interface AgentTool {

    ToolSchema schema();

    /**
     * Runs the tool. Long-running implementations should poll {@code cancellation}
     * so a timed-out attempt stops consuming resources.
     */
    ToolResult execute(Map<String, Object> input, CancellationToken cancellation);

    default String name() {
        return schema().name();
    }
}
