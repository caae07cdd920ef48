package com.bat.core.model;

/**
 * A decision to hand a task to another agent. Lives only for the call that produced it.
 *
 * @param reason          why the oracle recommended delegation
 * @param targetAgentRole role of the agent that should take the task
 */
public record Delegation(String reason, String targetAgentRole) {
}
