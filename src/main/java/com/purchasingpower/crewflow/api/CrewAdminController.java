package com.purchasingpower.crewflow.api;

import com.purchasingpower.crewflow.agent.ToolRegistry;
import com.purchasingpower.crewflow.crew.CrewEditorService;
import com.purchasingpower.crewflow.crew.CrewRegistry;
import com.purchasingpower.crewflow.crew.CrewSnapshot;
import com.purchasingpower.crewflow.crew.CrewSummary;
import com.purchasingpower.crewflow.exception.CrewConfigurationException;
import com.purchasingpower.crewflow.exception.CrewFlowException;
import com.purchasingpower.crewflow.exception.CrewNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Crew introspection and hot reload.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/agents")
@RequiredArgsConstructor
public class CrewAdminController {

    private final CrewRegistry crewRegistry;
    private final CrewEditorService crewEditorService;
    private final ToolRegistry toolRegistry;

    /**
     * GET /api/v1/agents
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> listAgents() {
        return ResponseEntity.ok(Map.of(
                "loaded", crewRegistry.loadedAgents(),
                "available", crewRegistry.availableAgents(),
                "tools", toolRegistry.list()));
    }

    /**
     * GET /api/v1/agents/{agent}/crew
     */
    @GetMapping("/{agentName}/crew")
    public ResponseEntity<?> listCrew(@PathVariable String agentName) {
        return handle(() -> crewRegistry.listCrew(agentName));
    }

    /**
     * Edit one crew and hot-swap it.
     *
     * PUT /api/v1/agents/{agent}/crew/{crew}
     */
    @PutMapping("/{agentName}/crew/{crewName}")
    public ResponseEntity<?> updateCrew(@PathVariable String agentName, @PathVariable String crewName,
                                        @RequestBody CrewUpdateRequest request) {
        return handle(() -> {
            CrewSnapshot published = crewEditorService.update(agentName, crewName,
                    current -> request.applyTo(current, toolRegistry));
            log.info("Crew {}/{} updated through admin API", agentName, crewName);
            return CrewSummary.from(published.resolve(crewName), published.getVersion());
        });
    }

    /**
     * POST /api/v1/agents/{agent}/crew/{crew}/restore
     */
    @PostMapping("/{agentName}/crew/{crewName}/restore")
    public ResponseEntity<?> restoreCrew(@PathVariable String agentName, @PathVariable String crewName) {
        return handle(() -> {
            CrewSnapshot published = crewEditorService.restorePrevious(agentName, crewName);
            return CrewSummary.from(published.resolve(crewName), published.getVersion());
        });
    }

    /**
     * POST /api/v1/agents/{agent}/reload
     */
    @PostMapping("/{agentName}/reload")
    public ResponseEntity<?> reload(@PathVariable String agentName) {
        return handle(() -> {
            crewRegistry.reload(agentName);
            List<CrewSummary> crews = crewRegistry.listCrew(agentName);
            return crews;
        });
    }

    private ResponseEntity<?> handle(Supplier<Object> action) {
        try {
            return ResponseEntity.ok(action.get());
        } catch (CrewNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ChatResponse.error(e.getMessage()));
        } catch (CrewConfigurationException | IllegalArgumentException e) {
            log.warn("Rejected crew change: {}", e.getMessage());
            return ResponseEntity.badRequest().body(ChatResponse.error(e.getMessage()));
        } catch (CrewFlowException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(ChatResponse.error(e.getMessage()));
        }
    }
}
