package com.bat.core.agent.memory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Keeps only the last {@code windowSize} exchanges.
 */
public class WindowBufferMemory implements AgentMemory {

    private final int windowSize;
    private final Deque<MemoryMessage[]> exchanges = new ArrayDeque<>();

    public WindowBufferMemory(int windowSize) {
        if (windowSize < 1) {
            throw new IllegalArgumentException("windowSize must be at least 1, was " + windowSize);
        }
        this.windowSize = windowSize;
    }

    @Override
    public synchronized List<MemoryMessage> loadContext(String scope) {
        var result = new ArrayList<MemoryMessage>(exchanges.size() * 2);
        for (MemoryMessage[] exchange : exchanges) {
            result.add(exchange[0]);
            result.add(exchange[1]);
        }
        return List.copyOf(result);
    }

    @Override
    public synchronized void saveContext(String input, String output) {
        exchanges.addLast(new MemoryMessage[]{MemoryMessage.human(input), MemoryMessage.ai(output)});
        while (exchanges.size() > windowSize) {
            exchanges.removeFirst();
        }
    }

    @Override
    public synchronized void clear() {
        exchanges.clear();
    }

    public int getWindowSize() {
        return windowSize;
    }
}
