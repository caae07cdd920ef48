package com.bat.core.agent;

import com.bat.core.agent.memory.AgentMemory;
import com.bat.core.agent.memory.MemoryMessage;
import com.bat.core.llm.OracleResponseDecoder;
import com.bat.core.llm.OracleResponseUnparseableException;
import com.bat.core.metrics.BatMetrics;
import com.bat.core.model.Delegation;
import com.bat.core.model.DelegationDecision;
import com.bat.core.model.ToolSelection;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Runs an agent's decision protocol for one task description:
 * tool selection, then capability check, then delegation, then direct execution.
 * <p>
 * Malformed oracle replies never abort a task. They degrade to the next path and are
 * logged at WARN with a metric, separately from a legitimate "no" which is logged at DEBUG.
 */
public class CapabilityResolver {

    private static final Logger log = LoggerFactory.getLogger(CapabilityResolver.class);

    private final OracleResponseDecoder decoder;
    private final ObjectMapper mapper;
    private final BatMetrics metrics;

    public CapabilityResolver() {
        this(new OracleResponseDecoder(), new ObjectMapper(), null);
    }

    public CapabilityResolver(OracleResponseDecoder decoder, ObjectMapper mapper, BatMetrics metrics) {
        this.decoder = decoder;
        this.mapper = mapper;
        this.metrics = metrics;
    }

    /**
     * @throws AgentExecutionException wrapping any failure of the chosen path
     * @throws TaskCancelledException  if the attempt was cancelled mid-protocol
     */
    public String resolve(Agent agent, String taskDescription, ExecutionContext context) {
        CancellationToken token = context.cancellation();
        try {
            Optional<ToolSelection> selection = agent.getAvailableTools().isEmpty()
                    ? Optional.empty()
                    : selectTool(agent, taskDescription, token);
            if (selection.isPresent()) {
                return runTool(agent, selection.get(), token);
            }

            if (!checkCapability(agent, taskDescription, token) && !context.availableAgents().isEmpty()) {
                Optional<Delegation> delegation =
                        recommendDelegation(agent, taskDescription, context.availableAgents(), token);
                if (delegation.isPresent()) {
                    Optional<String> delegated = delegate(agent, taskDescription, delegation.get(), context);
                    if (delegated.isPresent()) {
                        return delegated.get();
                    }
                }
            }

            return executeDirect(agent, taskDescription, token);
        } catch (AgentExecutionException | TaskCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new AgentExecutionException("Agent execution failed: " + e.getMessage(), e);
        }
    }

    /**
     * Asks the oracle which tool fits the task. Empty when the reply is malformed or names no
     * tool this agent has.
     */
    public Optional<ToolSelection> selectTool(Agent agent, String taskDescription, CancellationToken token) {
        String raw = ask(agent, AgentPrompts.toolSelection(agent, taskDescription), token);
        ToolSelection selection;
        try {
            selection = decoder.decodeToolSelection(raw);
        } catch (OracleResponseUnparseableException e) {
            unparseable(agent, "tool_selection", e);
            return Optional.empty();
        }
        if (agent.findTool(selection.tool()).isEmpty()) {
            log.warn("Agent {} selected unknown tool '{}', falling back", agent.getRole(), selection.tool());
            return Optional.empty();
        }
        return Optional.of(selection);
    }

    public boolean checkCapability(Agent agent, String taskDescription, CancellationToken token) {
        String raw = ask(agent, AgentPrompts.capabilityCheck(agent, taskDescription), token);
        try {
            boolean capable = decoder.decodeCapability(raw);
            log.debug("Agent {} capability check: {}", agent.getRole(), capable ? "yes" : "no");
            return capable;
        } catch (OracleResponseUnparseableException e) {
            unparseable(agent, "capability", e);
            return false;
        }
    }

    public Optional<Delegation> recommendDelegation(Agent agent, String taskDescription,
                                                    List<Agent> availableAgents, CancellationToken token) {
        String raw = ask(agent, AgentPrompts.delegation(agent, taskDescription, availableAgents), token);
        DelegationDecision decision;
        try {
            decision = decoder.decodeDelegation(raw);
        } catch (OracleResponseUnparseableException e) {
            unparseable(agent, "delegation", e);
            return Optional.empty();
        }
        if (!decision.shouldDelegate()) {
            log.debug("Agent {} keeps the task: {}", agent.getRole(), decision.reason());
            return Optional.empty();
        }
        return Optional.of(decision.toDelegation());
    }

    /**
     * Asks the oracle for a direct answer, with the agent's remembered context prepended,
     * and records the exchange.
     */
    public String executeDirect(Agent agent, String taskDescription, CancellationToken token) {
        Optional<AgentMemory> memory = agent.getMemory();
        List<MemoryMessage> previous = memory.map(m -> m.loadContext(taskDescription)).orElse(List.of());
        String prompt = AgentPrompts.withMemory(AgentPrompts.direct(agent, taskDescription), previous);
        String result = ask(agent, prompt, token);
        token.throwIfCancelled();
        memory.ifPresent(m -> m.saveContext(taskDescription, result));
        record(agent, "direct");
        return result;
    }

    private String runTool(Agent agent, ToolSelection selection, CancellationToken token) {
        log.info("Agent {} using tool {}", agent.getRole(), selection.tool());
        Object result;
        try {
            result = agent.useTool(selection.tool(), selection.input(), token);
        } catch (ToolExecutionFailedException e) {
            if (metrics != null) {
                metrics.recordToolInvocation(selection.tool(), false);
            }
            throw e;
        }
        token.throwIfCancelled();
        if (metrics != null) {
            metrics.recordToolInvocation(selection.tool(), true);
        }
        record(agent, "tool");
        try {
            return mapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new AgentExecutionException("Agent execution failed: cannot serialize result of tool "
                    + selection.tool(), e);
        }
    }

    private Optional<String> delegate(Agent agent, String taskDescription, Delegation delegation,
                                      ExecutionContext context) {
        Optional<Agent> target = context.availableAgents().stream()
                .filter(a -> a.getRole().equals(delegation.targetAgentRole()))
                .findFirst();
        if (target.isEmpty()) {
            log.warn("Agent {} recommended unknown role '{}', executing directly",
                    agent.getRole(), delegation.targetAgentRole());
            return Optional.empty();
        }
        Agent next = target.get();
        DelegationChain chain = context.chain().descend(next.getRole());
        List<Agent> remaining = context.availableAgents().stream()
                .filter(a -> a != next)
                .toList();

        log.info("Agent {} delegating to {}: {}", agent.getRole(), next.getRole(), delegation.reason());
        if (metrics != null) {
            metrics.recordDelegation(agent.getRole(), next.getRole());
        }
        record(agent, "delegation");
        String result = next.execute(taskDescription, context.delegate(chain, remaining));
        return Optional.of("Task delegated to " + next.getRole() + ":\n" + result);
    }

    private String ask(Agent agent, String prompt, CancellationToken token) {
        token.throwIfCancelled();
        String raw = agent.oracle().query(prompt);
        token.throwIfCancelled();
        return raw;
    }

    private void unparseable(Agent agent, String kind, OracleResponseUnparseableException e) {
        log.warn("Agent {} got an unparseable {} reply: {}", agent.getRole(), kind, e.getMessage());
        log.debug("Raw {} reply: {}", kind, e.getRawResponse());
        if (metrics != null) {
            metrics.recordUnparseableReply(kind);
        }
    }

    private void record(Agent agent, String path) {
        if (metrics != null) {
            metrics.recordDecision(agent.getRole(), path);
        }
    }
}
