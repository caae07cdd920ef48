package com.bat.core.agent;

import com.bat.config.BatProperties.AgentDefinition;
import com.bat.config.BatProperties.Memory;
import com.bat.core.agent.memory.SummaryMemory;
import com.bat.core.agent.memory.WindowBufferMemory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AgentRegistryTest {

    private static AgentDefinition definition(String role, List<String> tools, Memory memory) {
        var definition = new AgentDefinition();
        definition.setRole(role);
        definition.setGoal("goal of " + role);
        definition.setBackstory("backstory");
        definition.setCapabilities(List.of("research"));
        definition.setTools(tools);
        definition.setMemory(memory);
        return definition;
    }

    private static Memory memory(String type, int windowSize) {
        var memory = new Memory();
        memory.setType(type);
        memory.setWindowSize(windowSize);
        return memory;
    }

    @Test
    @DisplayName("builds agents with their tools and memory, keyed by role")
    void buildsAgents() {
        var search = CapabilityResolverTest.tool("web_search", i -> ToolResult.success("hits"));
        var registry = new AgentRegistry(List.of(
                definition("Researcher", List.of("web_search"), memory("buffer-window", 2)),
                definition("Writer", List.of(), memory("summary", 0))),
                new ScriptedOracle(), new CapabilityResolver(), List.of(search));

        var researcher = registry.findByRole("Researcher").orElseThrow();
        assertEquals(List.of("web_search"), researcher.getAvailableTools().stream().map(AgentTool::name).toList());
        var window = assertInstanceOf(WindowBufferMemory.class, researcher.getMemory().orElseThrow());
        assertEquals(2, window.getWindowSize());
        assertInstanceOf(SummaryMemory.class, registry.findByRole("Writer").orElseThrow().getMemory().orElseThrow());
        assertEquals(List.of("Researcher", "Writer"), registry.all().stream().map(Agent::getRole).toList());
    }

    @Test
    @DisplayName("an agent without memory configuration has none")
    void noMemory() {
        var registry = new AgentRegistry(List.of(definition("Writer", List.of(), null)),
                new ScriptedOracle(), new CapabilityResolver(), List.of());
        assertTrue(registry.findByRole("Writer").orElseThrow().getMemory().isEmpty());
        assertTrue(registry.findByRole("Ghost").isEmpty());
    }

    @Test
    @DisplayName("unknown tool names and duplicate roles fail at startup")
    void invalidDefinitions() {
        assertThrows(IllegalStateException.class, () -> new AgentRegistry(
                List.of(definition("Writer", List.of("teleport"), null)),
                new ScriptedOracle(), new CapabilityResolver(), List.of()));
        assertThrows(IllegalStateException.class, () -> new AgentRegistry(
                List.of(definition("Writer", List.of(), null), definition("Writer", List.of(), null)),
                new ScriptedOracle(), new CapabilityResolver(), List.of()));
    }
}
