package com.bat.core.agent.memory;

import java.util.List;

/**
 * Conversation memory owned by a single agent.
 * Mutated only by its owning agent, within one task's direct execution.
 */
public interface AgentMemory {

    /**
     * Loads the prior exchanges relevant to {@code scope} (the task description).
     */
    List<MemoryMessage> loadContext(String scope);

    /**
     * Records a completed exchange.
     */
    void saveContext(String input, String output);

    void clear();
}
