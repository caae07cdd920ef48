package com.bat.core.agent;

import com.bat.core.llm.ReasoningOracle;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/**
 * Test oracle that answers each kind of decision prompt with a fixed or computed reply
 * and records the prompts it saw.
 */
public class ScriptedOracle implements ReasoningOracle {

    private Function<String, String> toolSelection = p -> "no tool";
    private Function<String, String> capability = p -> "yes";
    private Function<String, String> delegation = p -> "{\"shouldDelegate\": false}";
    private Function<String, String> direct = p -> "direct answer";

    private final List<String> prompts = Collections.synchronizedList(new ArrayList<>());

    public ScriptedOracle toolSelection(String reply) {
        this.toolSelection = p -> reply;
        return this;
    }

    public ScriptedOracle capability(String reply) {
        this.capability = p -> reply;
        return this;
    }

    public ScriptedOracle delegation(String reply) {
        this.delegation = p -> reply;
        return this;
    }

    public ScriptedOracle direct(String reply) {
        this.direct = p -> reply;
        return this;
    }

    public ScriptedOracle direct(Function<String, String> reply) {
        this.direct = reply;
        return this;
    }

    @Override
    public String query(String prompt) {
        prompts.add(prompt);
        if (prompt.contains("Select the most appropriate tool")) {
            return toolSelection.apply(prompt);
        }
        if (prompt.contains("Answer with only")) {
            return capability.apply(prompt);
        }
        if (prompt.contains("Should this task be delegated")) {
            return delegation.apply(prompt);
        }
        return direct.apply(prompt);
    }

    public List<String> prompts() {
        synchronized (prompts) {
            return List.copyOf(prompts);
        }
    }

    public long count(String marker) {
        return prompts().stream().filter(p -> p.contains(marker)).count();
    }
}
