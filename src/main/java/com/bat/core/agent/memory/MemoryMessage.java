package com.bat.core.agent.memory;

/**
 * One remembered message.
 *
 * @param type    "human", "ai" or "system"
 * @param content message text
 */
public record MemoryMessage(String type, String content) {

    public static MemoryMessage human(String content) {
        return new MemoryMessage("human", content);
    }

    public static MemoryMessage ai(String content) {
        return new MemoryMessage("ai", content);
    }

    public static MemoryMessage system(String content) {
        return new MemoryMessage("system", content);
    }
}
