package com.bat.core.agent;

import java.util.ArrayList;
import java.util.List;

/**
 * Roles visited by a delegation path, starting with the agent the task was assigned to.
 *
 * @param roles    visited roles, in order
 * @param maxDepth number of hand-offs allowed
 */
public record DelegationChain(List<String> roles, int maxDepth) {

    public static final int DEFAULT_MAX_DEPTH = 3;

    public DelegationChain {
        roles = List.copyOf(roles);
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must not be negative, was " + maxDepth);
        }
    }

    public static DelegationChain start(String role, int maxDepth) {
        return new DelegationChain(List.of(role), maxDepth);
    }

    /** Hand-offs made so far. */
    public int depth() {
        return roles.size() - 1;
    }

    /**
     * Extends the chain by one hand-off.
     *
     * @throws DelegationCycleException if the target was already visited or the depth would exceed {@code maxDepth}
     */
    public DelegationChain descend(String targetRole) {
        var next = new ArrayList<>(roles);
        next.add(targetRole);
        if (roles.contains(targetRole)) {
            throw new DelegationCycleException("Delegation cycle detected: " + String.join(" -> ", next), next);
        }
        if (depth() + 1 > maxDepth) {
            throw new DelegationCycleException("Delegation depth exceeds maximum of " + maxDepth + ": "
                    + String.join(" -> ", next), next);
        }
        return new DelegationChain(next, maxDepth);
    }
}
