package com.bat.core.orchestrator;

/**
 * No managed agent has the requested role.
 */
public class AgentNotFoundException extends RuntimeException {

    private final String agentRole;

    public AgentNotFoundException(String agentRole) {
        super("Agent with role " + agentRole + " not found");
        this.agentRole = agentRole;
    }

    public String getAgentRole() {
        return agentRole;
    }
}
