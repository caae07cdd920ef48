package com.bat.core.agent;

import com.bat.core.agent.memory.AgentMemory;

import java.util.List;

/**
 * Identity and equipment of an agent.
 *
 * @param role         unique key used for lookup and delegation targeting
 * @param goal         what the agent is trying to achieve
 * @param backstory    free text shaping the oracle prompt
 * @param capabilities capability tags
 * @param tools        invocable tools, in prompt order
 * @param memory       conversation memory; nullable
 */
public record AgentConfig(
    String role,
    String goal,
    String backstory,
    List<String> capabilities,
    List<AgentTool> tools,
    AgentMemory memory
) {

    public AgentConfig {
        if (role == null || role.isBlank()) {
            throw new IllegalArgumentException("Agent role must not be blank");
        }
        goal = goal == null ? "" : goal;
        backstory = backstory == null ? "" : backstory;
        capabilities = capabilities == null ? List.of() : List.copyOf(capabilities);
        tools = tools == null ? List.of() : List.copyOf(tools);
    }

    public AgentConfig(String role, String goal, String backstory) {
        this(role, goal, backstory, List.of(), List.of(), null);
    }
}
