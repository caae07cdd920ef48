package com.bat.config;

import com.bat.core.model.Priority;
import com.bat.core.model.RetryConfig;
import com.bat.core.orchestrator.OrchestratorSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "bat")
public class BatProperties {

    private TaskDefaults task = new TaskDefaults();
    private Orchestrator orchestrator = new Orchestrator();
    private Delegation delegation = new Delegation();
    private Logging logging = new Logging();
    private List<AgentDefinition> agents = new ArrayList<>();

    /**
     * Folds the task defaults and the fan-out policy into the orchestrator's settings.
     */
    public OrchestratorSettings toOrchestratorSettings() {
        return new OrchestratorSettings(
                orchestrator.maxConcurrency,
                Priority.parse(task.priority),
                task.timeoutMs,
                new RetryConfig(task.maxRetries, task.retryDelayMs));
    }

    public TaskDefaults getTask() { return task; }
    public void setTask(TaskDefaults task) { this.task = task; }
    public Orchestrator getOrchestrator() { return orchestrator; }
    public void setOrchestrator(Orchestrator orchestrator) { this.orchestrator = orchestrator; }
    public Delegation getDelegation() { return delegation; }
    public void setDelegation(Delegation delegation) { this.delegation = delegation; }
    public Logging getLogging() { return logging; }
    public void setLogging(Logging logging) { this.logging = logging; }
    public List<AgentDefinition> getAgents() { return agents; }
    public void setAgents(List<AgentDefinition> agents) { this.agents = agents; }

    public static class TaskDefaults {
        private long timeoutMs = 30_000;
        private int maxRetries = 3;
        private long retryDelayMs = 1000;
        private String priority = "medium";

        public long getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }
        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
        public long getRetryDelayMs() { return retryDelayMs; }
        public void setRetryDelayMs(long retryDelayMs) { this.retryDelayMs = retryDelayMs; }
        public String getPriority() { return priority; }
        public void setPriority(String priority) { this.priority = priority; }
    }

    public static class Orchestrator {
        /** 0 launches every task at once. */
        private int maxConcurrency = 0;

        public int getMaxConcurrency() { return maxConcurrency; }
        public void setMaxConcurrency(int maxConcurrency) { this.maxConcurrency = maxConcurrency; }
    }

    public static class Delegation {
        private int maxDepth = 3;

        public int getMaxDepth() { return maxDepth; }
        public void setMaxDepth(int maxDepth) { this.maxDepth = maxDepth; }
    }

    public static class Logging {
        private int historySize = 1000;

        public int getHistorySize() { return historySize; }
        public void setHistorySize(int historySize) { this.historySize = historySize; }
    }

    public static class AgentDefinition {
        private String role;
        private String goal;
        private String backstory;
        private List<String> capabilities = new ArrayList<>();
        /** Tool names, matched against the schemas of registered {@code AgentTool} beans. */
        private List<String> tools = new ArrayList<>();
        private Memory memory;

        public String getRole() { return role; }
        public void setRole(String role) { this.role = role; }
        public String getGoal() { return goal; }
        public void setGoal(String goal) { this.goal = goal; }
        public String getBackstory() { return backstory; }
        public void setBackstory(String backstory) { this.backstory = backstory; }
        public List<String> getCapabilities() { return capabilities; }
        public void setCapabilities(List<String> capabilities) { this.capabilities = capabilities; }
        public List<String> getTools() { return tools; }
        public void setTools(List<String> tools) { this.tools = tools; }
        public Memory getMemory() { return memory; }
        public void setMemory(Memory memory) { this.memory = memory; }
    }

    public static class Memory {
        private String type = "buffer";
        private int windowSize = 3;

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }
        public int getWindowSize() { return windowSize; }
        public void setWindowSize(int windowSize) { this.windowSize = windowSize; }
    }
}
