package com.bat.core.agent;

import java.util.List;

/**
 * Per-call state threaded through an agent's decision protocol.
 *
 * @param availableAgents agents this agent may delegate to
 * @param cancellation    token of the attempt this call belongs to
 * @param chain           delegation path so far
 */
public record ExecutionContext(List<Agent> availableAgents, CancellationToken cancellation, DelegationChain chain) {

    public ExecutionContext {
        availableAgents = availableAgents == null ? List.of() : List.copyOf(availableAgents);
        cancellation = cancellation == null ? new CancellationToken() : cancellation;
    }

    public static ExecutionContext forAgent(Agent agent, List<Agent> availableAgents) {
        return forAgent(agent, availableAgents, new CancellationToken(), DelegationChain.DEFAULT_MAX_DEPTH);
    }

    public static ExecutionContext forAgent(Agent agent, List<Agent> availableAgents,
                                            CancellationToken cancellation, int maxDelegationDepth) {
        return new ExecutionContext(availableAgents, cancellation,
                DelegationChain.start(agent.getRole(), maxDelegationDepth));
    }

    ExecutionContext delegate(DelegationChain next, List<Agent> nextAvailable) {
        return new ExecutionContext(nextAvailable, cancellation, next);
    }
}
