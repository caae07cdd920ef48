package com.bat.dispatch.api;

import com.bat.core.agent.Agent;
import com.bat.core.agent.AgentRegistry;
import com.bat.core.agent.AgentTool;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller listing the configured agents.
 */
@RestController
@RequestMapping("/api/v1/agents")
public class AgentController {

    private final AgentRegistry registry;

    public AgentController(AgentRegistry registry) {
        this.registry = registry;
    }

    @GetMapping
    public ResponseEntity<List<Map<String, Object>>> listAgents() {
        return ResponseEntity.ok(registry.all().stream().map(AgentController::describe).toList());
    }

    private static Map<String, Object> describe(Agent agent) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("role", agent.getRole());
        body.put("goal", agent.getGoal());
        body.put("capabilities", agent.getCapabilities());
        body.put("tools", agent.getAvailableTools().stream().map(AgentTool::name).toList());
        body.put("memory", agent.getMemory().isPresent());
        return body;
    }
}
