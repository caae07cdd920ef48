package com.bat.core.model;

/**
 * Decoded delegation reply: {@code {"shouldDelegate": boolean, "reason": string, "targetAgentRole": string}}.
 */
public record DelegationDecision(boolean shouldDelegate, String reason, String targetAgentRole) {

    public Delegation toDelegation() {
        return new Delegation(reason, targetAgentRole);
    }
}
