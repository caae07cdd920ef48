package com.bat.core.agent;

import java.util.List;

/**
 * Delegation revisited a role already in the chain, or went deeper than allowed.
 */
public class DelegationCycleException extends RuntimeException {

    private final List<String> chain;

    public DelegationCycleException(String message, List<String> chain) {
        super(message);
        this.chain = List.copyOf(chain);
    }

    public List<String> getChain() {
        return chain;
    }
}
