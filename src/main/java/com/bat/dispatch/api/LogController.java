package com.bat.dispatch.api;

import com.bat.core.logging.Slf4jTaskLogger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST access to the retained task and agent log entries.
 */
@RestController
@RequestMapping("/api/v1/logs")
public class LogController {

    private final Slf4jTaskLogger taskLogger;

    public LogController(Slf4jTaskLogger taskLogger) {
        this.taskLogger = taskLogger;
    }

    @GetMapping
    public ResponseEntity<List<String>> logs() {
        return ResponseEntity.ok(taskLogger.getLogs());
    }

    @DeleteMapping
    public ResponseEntity<Void> clear() {
        taskLogger.clearLogs();
        return ResponseEntity.noContent().build();
    }
}
