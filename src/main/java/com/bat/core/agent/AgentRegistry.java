package com.bat.core.agent;

import com.bat.config.BatProperties;
import com.bat.config.BatProperties.AgentDefinition;
import com.bat.core.agent.memory.AgentMemory;
import com.bat.core.agent.memory.MemoryFactory;
import com.bat.core.agent.memory.MemoryType;
import com.bat.core.llm.ReasoningOracle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Holds the agents defined under {@code bat.agents}, keyed by role.
 * Tools are resolved by name from the registered {@link AgentTool} beans.
 */
@Service
public class AgentRegistry {

    private static final Logger log = LoggerFactory.getLogger(AgentRegistry.class);

    private final Map<String, Agent> agents = new LinkedHashMap<>();

    @Autowired
    public AgentRegistry(BatProperties properties, ReasoningOracle oracle, CapabilityResolver resolver,
                         ObjectProvider<AgentTool> toolBeans) {
        this(properties.getAgents(), oracle, resolver, toolBeans.orderedStream().toList());
    }

    public AgentRegistry(List<AgentDefinition> definitions, ReasoningOracle oracle, CapabilityResolver resolver,
                         List<AgentTool> tools) {
        Map<String, AgentTool> toolsByName = new LinkedHashMap<>();
        for (AgentTool tool : tools) {
            toolsByName.put(tool.name(), tool);
        }
        for (AgentDefinition definition : definitions) {
            Agent agent = build(definition, oracle, resolver, toolsByName);
            if (agents.putIfAbsent(agent.getRole(), agent) != null) {
                throw new IllegalStateException("Duplicate agent role in bat.agents: " + agent.getRole());
            }
        }
        log.info("Registered {} agents: {}", agents.size(), agents.keySet());
    }

    public Optional<Agent> findByRole(String role) {
        return Optional.ofNullable(agents.get(role));
    }

    public List<Agent> all() {
        return List.copyOf(agents.values());
    }

    private static Agent build(AgentDefinition definition, ReasoningOracle oracle, CapabilityResolver resolver,
                               Map<String, AgentTool> toolsByName) {
        var tools = new ArrayList<AgentTool>();
        for (String name : definition.getTools()) {
            AgentTool tool = toolsByName.get(name);
            if (tool == null) {
                throw new IllegalStateException("Agent " + definition.getRole() + " references unknown tool " + name);
            }
            tools.add(tool);
        }
        AgentMemory memory = null;
        if (definition.getMemory() != null) {
            memory = MemoryFactory.createMemory(MemoryType.parse(definition.getMemory().getType()),
                    definition.getMemory().getWindowSize(), oracle);
        }
        var config = new AgentConfig(definition.getRole(), definition.getGoal(), definition.getBackstory(),
                definition.getCapabilities(), tools, memory);
        return new Agent(config, oracle, resolver);
    }
}
