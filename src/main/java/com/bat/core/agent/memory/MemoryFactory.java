package com.bat.core.agent.memory;

import com.bat.core.llm.ReasoningOracle;

/**
 * Creates agent memories from configuration.
 */
public final class MemoryFactory {

    public static final int DEFAULT_WINDOW_SIZE = 3;

    private MemoryFactory() {}

    public static AgentMemory createMemory(MemoryType type, int windowSize, ReasoningOracle oracle) {
        return switch (type) {
            case BUFFER -> new BufferMemory();
            case BUFFER_WINDOW -> new WindowBufferMemory(windowSize > 0 ? windowSize : DEFAULT_WINDOW_SIZE);
            case SUMMARY -> {
                if (oracle == null) {
                    throw new IllegalArgumentException("A reasoning oracle is required for summary memory");
                }
                yield new SummaryMemory(oracle);
            }
        };
    }
}
