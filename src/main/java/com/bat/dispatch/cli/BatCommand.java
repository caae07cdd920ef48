package com.bat.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Bat.
 * Routes to subcommands: run, agents, serve.
 */
@Command(
        name = "bat",
        mixinStandardHelpOptions = true,
        version = "Bat 0.1.0",
        description = "Runs prioritized tasks across a team of LLM-backed agents",
        subcommands = {
                RunCommand.class,
                AgentsCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class BatCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
