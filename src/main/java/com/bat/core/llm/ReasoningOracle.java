package com.bat.core.llm;

/**
 * External text-in/text-out decision service consulted by agents.
 * <p>
 * Implementations carry no retry semantics of their own; latency is bounded only by the
 * per-attempt timeout of the task that triggered the query. A blocking implementation should
 * respond to thread interruption, which is how a timed-out attempt is cancelled.
 */
@FunctionalInterface
public interface ReasoningOracle {

    /**
     * @param prompt structured textual prompt
     * @return the raw response text
     */
    String query(String prompt);
}
