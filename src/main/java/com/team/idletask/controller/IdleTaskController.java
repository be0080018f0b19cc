package com.team.idletask.controller;

import com.team.idletask.model.analysis.ProjectAnalysis;
import com.team.idletask.model.analysis.SecurityVulnerability;
import com.team.idletask.model.candidate.IdleTask;
import com.team.idletask.model.candidate.TaskCandidate;
import com.team.idletask.service.security.VulnerabilityParser;
import com.team.idletask.service.selection.IdleTaskGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST Controller for idle-time task selection.
 * The idle worker posts a project snapshot and gets back the task to run.
 */
@RestController
@RequestMapping("/api")
@Slf4j
@RequiredArgsConstructor
public class IdleTaskController {

    private final IdleTaskGenerator idleTaskGenerator;
    private final VulnerabilityParser vulnerabilityParser;

    /**
     * All candidates for a snapshot, in analyzer order.
     *
     * Example:
     * POST /api/idle/candidates
     * {
     *   "dependencies": { "securityIssues": [ { "name": "lodash", "cveId": "CVE-2020-8203", "severity": "high" } ] },
     *   "documentation": { "coverage": 35.0 }
     * }
     */
    @PostMapping("/idle/candidates")
    public ResponseEntity<List<TaskCandidate>> candidates(@RequestBody(required = false) ProjectAnalysis analysis) {
        List<TaskCandidate> candidates = idleTaskGenerator.generateCandidates(analysis);
        log.info("Generated {} idle task candidates", candidates.size());
        return ResponseEntity.ok(candidates);
    }

    /**
     * The single task to run next, or 204 when there is nothing to do.
     */
    @PostMapping("/idle/select")
    public ResponseEntity<IdleTask> select(@RequestBody(required = false) ProjectAnalysis analysis) {
        return idleTaskGenerator.selectTask(analysis)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    /**
     * Convert raw {@code npm audit --json} output into vulnerability records.
     */
    @PostMapping("/idle/npm-audit")
    public ResponseEntity<List<SecurityVulnerability>> parseNpmAudit(@RequestBody String rawAuditJson) {
        return ResponseEntity.ok(vulnerabilityParser.parseNpmAuditOutput(rawAuditJson));
    }

    /**
     * Health check endpoint.
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "UP",
                "service", "Idle Task Engine",
                "version", "0.0.1"
        ));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException e) {
        log.warn("Rejected idle task request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }
}
