package com.bat.core.agent.memory;

import com.bat.core.llm.ReasoningOracle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Maintains a running summary of the conversation, refreshed through the reasoning oracle
 * after every exchange. Loads as a single system message.
 * <p>
 * The oracle is queried without holding the memory's lock, so a slow or abandoned
 * summarization never blocks {@link #loadContext}. A summary computed before a
 * {@link #clear()} is discarded.
 */
public class SummaryMemory implements AgentMemory {

    private static final Logger log = LoggerFactory.getLogger(SummaryMemory.class);

    private final ReasoningOracle oracle;
    private String summary = "";
    private long clears;

    public SummaryMemory(ReasoningOracle oracle) {
        this.oracle = oracle;
    }

    @Override
    public synchronized List<MemoryMessage> loadContext(String scope) {
        if (summary.isBlank()) {
            return List.of();
        }
        return List.of(MemoryMessage.system(summary));
    }

    @Override
    public void saveContext(String input, String output) {
        String previous;
        long generation;
        synchronized (this) {
            previous = summary;
            generation = clears;
        }
        String prompt = """
                Progressively summarize the conversation, adding onto the previous summary.
                Return only the new summary.

                Current summary:
                %s

                New lines of conversation:
                human: %s
                ai: %s
                """.formatted(previous.isBlank() ? "(none)" : previous, input, output);
        String updated = oracle.query(prompt).trim();
        synchronized (this) {
            if (generation != clears) {
                log.debug("Memory cleared during summarization, dropping the update");
                return;
            }
            summary = updated;
        }
        log.debug("Conversation summary updated ({} chars)", updated.length());
    }

    @Override
    public synchronized void clear() {
        summary = "";
        clears++;
    }
}
