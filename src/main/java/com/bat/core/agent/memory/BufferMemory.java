package com.bat.core.agent.memory;

import java.util.ArrayList;
import java.util.List;

/**
 * Keeps every exchange, in order.
 */
public class BufferMemory implements AgentMemory {

    private final List<MemoryMessage> messages = new ArrayList<>();

    @Override
    public synchronized List<MemoryMessage> loadContext(String scope) {
        return List.copyOf(messages);
    }

    @Override
    public synchronized void saveContext(String input, String output) {
        messages.add(MemoryMessage.human(input));
        messages.add(MemoryMessage.ai(output));
    }

    @Override
    public synchronized void clear() {
        messages.clear();
    }
}
