package com.structurescout.api.controller;

import com.structurescout.domain.enums.DecisionSource;
import com.structurescout.domain.model.DecisionRecord;
import com.structurescout.observability.DecisionArchiveService;
import com.structurescout.observability.DecisionLogger;
import java.util.List;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints over the decision audit trail (in-memory ring buffer) and its archiver.
 */
@RestController
@RequestMapping("/api/decisions")
public class DecisionLogController {

    private final DecisionLogger decisionLogger;
    private final DecisionArchiveService decisionArchiveService;

    public DecisionLogController(DecisionLogger decisionLogger, DecisionArchiveService decisionArchiveService) {
        this.decisionLogger = decisionLogger;
        this.decisionArchiveService = decisionArchiveService;
    }

    @GetMapping("/recent")
    public ResponseEntity<List<DecisionRecord>> getRecentDecisions(
            @RequestParam(defaultValue = "50") int count, @RequestParam(required = false) DecisionSource source) {
        int limit = Math.max(1, Math.min(count, 1000));
        return ResponseEntity.ok(
                source != null
                        ? decisionLogger.getRecentDecisions(limit, source)
                        : decisionLogger.getRecentDecisions(limit));
    }

    @GetMapping("/{sourceId}")
    public ResponseEntity<List<DecisionRecord>> getDecisionsFor(@PathVariable String sourceId) {
        return ResponseEntity.ok(decisionLogger.getDecisionsFor(sourceId));
    }

    @GetMapping("/archive")
    public ResponseEntity<Map<String, Object>> getArchiveStatus() {
        return ResponseEntity.ok(Map.of(
                "pending", decisionArchiveService.getPendingCount(),
                "dropped", decisionArchiveService.getDroppedCount(),
                "circuitOpen", decisionArchiveService.isCircuitOpen(),
                "consecutiveFailures", decisionArchiveService.getConsecutiveFailures(),
                "persistDebug", decisionArchiveService.isPersistDebug()));
    }

    @PutMapping("/archive/persist-debug")
    public ResponseEntity<Map<String, Object>> setPersistDebug(@RequestParam boolean enabled) {
        decisionArchiveService.setPersistDebug(enabled);
        return ResponseEntity.ok(Map.of("persistDebug", enabled));
    }

    @PostMapping("/archive/flush")
    public ResponseEntity<Map<String, Object>> flush() {
        decisionArchiveService.forceFlush();
        return ResponseEntity.ok(Map.of("flushRequested", true));
    }
}
