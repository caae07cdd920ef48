package com.bat.dispatch.cli;

import com.bat.core.agent.Agent;
import com.bat.core.agent.AgentRegistry;
import com.bat.core.agent.AgentTool;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.stream.Collectors;

/**
 * CLI command: bat agents
 * <p>
 * Lists the configured agents with their capabilities and tools.
 */
@Command(name = "agents", mixinStandardHelpOptions = true, description = "List configured agents")
@Component
public class AgentsCommand implements Runnable {

    private final AgentRegistry registry;

    public AgentsCommand(AgentRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        var agents = registry.all();
        if (agents.isEmpty()) {
            ConsoleOutput.info("No agents configured. Define them under bat.agents.");
            return;
        }
        for (Agent agent : agents) {
            ConsoleOutput.agent(agent.getRole(), agent.getGoal());
            if (!agent.getCapabilities().isEmpty()) {
                System.out.println("  Capabilities: " + String.join(", ", agent.getCapabilities()));
            }
            if (!agent.getAvailableTools().isEmpty()) {
                System.out.println("  Tools: " + agent.getAvailableTools().stream()
                        .map(AgentTool::name)
                        .collect(Collectors.joining(", ")));
            }
        }
    }
}
