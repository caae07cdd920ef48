package com.bat.core.agent;

import com.bat.core.agent.memory.AgentMemory;
import com.bat.core.llm.ReasoningOracle;
import com.bat.core.model.Delegation;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * An actor with a role, goal and tool set that executes task descriptions.
 * <p>
 * Tools and capabilities are read-only after construction. The agent owns its memory and
 * tool list; it never owns other agents, it only receives them as delegation candidates.
 */
public class Agent {

    private final AgentConfig config;
    private final ReasoningOracle oracle;
    private final CapabilityResolver resolver;

    public Agent(AgentConfig config, ReasoningOracle oracle) {
        this(config, oracle, new CapabilityResolver());
    }

    public Agent(AgentConfig config, ReasoningOracle oracle, CapabilityResolver resolver) {
        if (oracle == null) {
            throw new IllegalArgumentException("Agent " + config.role() + " needs a reasoning oracle");
        }
        this.config = config;
        this.oracle = oracle;
        this.resolver = resolver;
    }

    public String getRole() {
        return config.role();
    }

    public String getGoal() {
        return config.goal();
    }

    public String getBackstory() {
        return config.backstory();
    }

    public List<String> getCapabilities() {
        return config.capabilities();
    }

    public List<AgentTool> getAvailableTools() {
        return config.tools();
    }

    public Optional<AgentMemory> getMemory() {
        return Optional.ofNullable(config.memory());
    }

    ReasoningOracle oracle() {
        return oracle;
    }

    public String execute(String taskDescription) {
        return execute(taskDescription, List.of());
    }

    /**
     * Executes a task, possibly delegating to one of {@code availableAgents}.
     *
     * @throws AgentExecutionException on any oracle, tool or delegation failure
     */
    public String execute(String taskDescription, List<Agent> availableAgents) {
        return execute(taskDescription, ExecutionContext.forAgent(this, availableAgents));
    }

    public String execute(String taskDescription, ExecutionContext context) {
        return resolver.resolve(this, taskDescription, context);
    }

    public Object useTool(String toolName, Map<String, Object> input) {
        return useTool(toolName, input, new CancellationToken());
    }

    /**
     * Invokes one of this agent's tools.
     *
     * @throws IllegalArgumentException     if the agent has no tool with that name
     * @throws ToolExecutionFailedException if the tool reports failure
     */
    public Object useTool(String toolName, Map<String, Object> input, CancellationToken cancellation) {
        AgentTool tool = findTool(toolName)
                .orElseThrow(() -> new IllegalArgumentException("Tool " + toolName + " not found"));
        cancellation.throwIfCancelled();
        ToolResult result = tool.execute(input == null ? Map.of() : input, cancellation);
        if (result == null || !result.success()) {
            throw new ToolExecutionFailedException(toolName, result == null ? "no result" : result.error());
        }
        return result.result();
    }

    public Optional<AgentTool> findTool(String toolName) {
        return config.tools().stream()
                .filter(t -> t.name().equals(toolName))
                .findFirst();
    }

    public boolean canHandleTask(String taskDescription) {
        return resolver.checkCapability(this, taskDescription, new CancellationToken());
    }

    public Optional<Delegation> shouldDelegateTask(String taskDescription, List<Agent> availableAgents) {
        return resolver.recommendDelegation(this, taskDescription, availableAgents, new CancellationToken());
    }

    @Override
    public String toString() {
        return "Agent[" + getRole() + "]";
    }
}
