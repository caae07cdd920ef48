package com.bat.core.agent;

import com.bat.core.agent.memory.MemoryMessage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds the oracle prompts for each step of the decision protocol.
 * Pure functions, no Spring dependencies.
 */
public final class AgentPrompts {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private AgentPrompts() {}

    public static String toolSelection(Agent agent, String taskDescription) {
        var sb = new StringBuilder();
        appendIdentity(sb, agent);
        sb.append("\nAvailable tools:\n");
        for (AgentTool tool : agent.getAvailableTools()) {
            ToolSchema schema = tool.schema();
            sb.append("- ").append(schema.name()).append(": ").append(schema.description()).append("\n");
            sb.append("  Parameters: ").append(toJson(schema.parameters())).append("\n");
        }
        sb.append("\nTask: ").append(taskDescription).append("\n\n");
        sb.append("Select the most appropriate tool and provide input parameters.\n");
        sb.append("Respond with a valid JSON object in this exact format (no markdown, no code blocks):\n");
        sb.append("{\n");
        sb.append("  \"tool\": \"tool_name\",\n");
        sb.append("  \"input\": {\n");
        sb.append("    \"param1\": \"value1\",\n");
        sb.append("    \"param2\": \"value2\"\n");
        sb.append("  }\n");
        sb.append("}\n");
        return sb.toString();
    }

    public static String capabilityCheck(Agent agent, String taskDescription) {
        var sb = new StringBuilder();
        appendIdentity(sb, agent);
        sb.append("Your capabilities: ").append(String.join(", ", agent.getCapabilities())).append("\n");
        sb.append("\nTask: ").append(taskDescription).append("\n\n");
        sb.append("Can you handle this task effectively? Answer with only \"yes\" or \"no\".\n");
        return sb.toString();
    }

    public static String delegation(Agent agent, String taskDescription, List<Agent> availableAgents) {
        var sb = new StringBuilder();
        appendIdentity(sb, agent);
        sb.append("Your capabilities: ").append(String.join(", ", agent.getCapabilities())).append("\n");
        sb.append("\nAvailable agents:\n");
        for (Agent other : availableAgents) {
            sb.append("- ").append(other.getRole()).append(": ")
              .append(String.join(", ", other.getCapabilities())).append("\n");
        }
        sb.append("\nTask: ").append(taskDescription).append("\n\n");
        sb.append("Should this task be delegated to another agent? If yes, provide:\n");
        sb.append("1. The reason for delegation\n");
        sb.append("2. The role of the most suitable agent\n\n");
        sb.append("Respond with a valid JSON object in this exact format (no markdown, no code blocks):\n");
        sb.append("{\n");
        sb.append("  \"shouldDelegate\": true or false,\n");
        sb.append("  \"reason\": \"explanation of why delegation is needed\",\n");
        sb.append("  \"targetAgentRole\": \"role of the agent to delegate to\"\n");
        sb.append("}\n");
        return sb.toString();
    }

    public static String direct(Agent agent, String taskDescription) {
        var sb = new StringBuilder();
        appendIdentity(sb, agent);
        sb.append("\nAvailable tools: ")
          .append(agent.getAvailableTools().stream().map(AgentTool::name).collect(Collectors.joining(", ")))
          .append("\n");
        sb.append("\nTask: ").append(taskDescription).append("\n\n");
        sb.append("Please provide a detailed response to complete this task.\n");
        return sb.toString();
    }

    /**
     * Prefixes {@code prompt} with remembered messages; returns it unchanged when there are none.
     */
    public static String withMemory(String prompt, List<MemoryMessage> previousContext) {
        if (previousContext == null || previousContext.isEmpty()) {
            return prompt;
        }
        String summary = previousContext.stream()
                .map(m -> m.type() + ": " + m.content())
                .collect(Collectors.joining("\n"));
        return "Previous Context:\n" + summary + "\n\n" + prompt;
    }

    private static void appendIdentity(StringBuilder sb, Agent agent) {
        sb.append("You are a ").append(agent.getRole()).append(".\n");
        sb.append("Your goal is: ").append(agent.getGoal()).append("\n");
        sb.append("Your backstory: ").append(agent.getBackstory()).append("\n");
    }

    private static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }
}
