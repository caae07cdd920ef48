package com.bat.dispatch.cli;

import com.bat.core.engine.KickoffEngine;
import com.bat.core.events.BatEvent;
import com.bat.core.events.EventBus;
import com.bat.core.model.KickoffResult;
import com.bat.core.model.TaskPlan;
import com.bat.core.model.TaskRequest;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * CLI command: bat run [--plan plan.json] [-t "role::description"]...
 * <p>
 * Builds a task plan from a JSON file and/or inline tasks, kicks it off, prints task
 * progress as it happens and then every task's result in priority order, failures included.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Kick off a batch of tasks")
@Component
public class RunCommand implements Runnable {

    static final String TASK_SEPARATOR = "::";

    @Option(names = {"--plan", "-p"}, description = "JSON plan file: {\"tasks\": [{\"description\", \"agentRole\", ...}]}")
    private Path planFile;

    @Option(names = {"--task", "-t"}, description = "Inline task as \"role::description\" (repeatable)")
    private List<String> inlineTasks = new ArrayList<>();

    @Option(names = "--priority", description = "Priority of inline tasks: high, medium, low")
    private String priority;

    private final KickoffEngine kickoffEngine;
    private final EventBus eventBus;
    private final ObjectMapper objectMapper;

    public RunCommand(KickoffEngine kickoffEngine, EventBus eventBus, ObjectMapper objectMapper) {
        this.kickoffEngine = kickoffEngine;
        this.eventBus = eventBus;
        this.objectMapper = objectMapper;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        var requests = new ArrayList<TaskRequest>();
        if (planFile != null) {
            try {
                requests.addAll(objectMapper.readValue(planFile.toFile(), TaskPlan.class).tasks());
            } catch (IOException e) {
                ConsoleOutput.error("Cannot read plan " + planFile + ": " + e.getMessage());
                return;
            }
        }
        for (String inline : inlineTasks) {
            int split = inline.indexOf(TASK_SEPARATOR);
            if (split <= 0) {
                ConsoleOutput.error("Invalid task: " + inline + ". Expected \"role::description\"");
                return;
            }
            requests.add(new TaskRequest(inline.substring(split + TASK_SEPARATOR.length()).trim(),
                    inline.substring(0, split).trim(), priority, null, null));
        }
        if (requests.isEmpty()) {
            ConsoleOutput.error("Nothing to run. Pass --plan or at least one --task.");
            return;
        }

        ConsoleOutput.info("Kicking off " + requests.size() + " task" + (requests.size() != 1 ? "s" : "") + "...");
        String runId = kickoffEngine.generateRunId();
        KickoffResult result;
        try (var progress = eventBus.subscribe(runId, RunCommand::printProgress)) {
            result = kickoffEngine.run(runId, new TaskPlan(requests));
        } catch (Exception e) {
            ConsoleOutput.error("Kickoff failed: " + e.getMessage());
            return;
        }

        System.out.println();
        System.out.println("RUN " + result.runId());
        for (int i = 0; i < result.tasks().size(); i++) {
            ConsoleOutput.taskReport(i + 1, result.tasks().get(i));
        }
        ConsoleOutput.summary(result.tasks().size(), result.failedCount());
    }

    static void printProgress(BatEvent event) {
        Map<String, Object> payload = event.payload();
        switch (event.eventType()) {
            case "task.started" -> ConsoleOutput.agent(String.valueOf(payload.get("agent")),
                    event.taskId() + " started (" + payload.get("priority") + ")");
            case "task.completed" -> ConsoleOutput.success(event.taskId() + " completed");
            case "task.failed" -> ConsoleOutput.error(event.taskId() + " failed: " + payload.get("error"));
            default -> { }
        }
    }
}
