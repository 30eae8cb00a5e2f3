package com.adlanda.codexai.controller;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Root API controller providing endpoint discovery.
 *
 * Health checks are handled by Spring Actuator at /actuator/health.
 */
@RestController
@RequestMapping("/api/v1")
public class ApiController {

    @Value("${info.app.version:0.0.1-SNAPSHOT}")
    private String appVersion;

    @GetMapping
    public ResponseEntity<Map<String, Object>> root() {
        return ResponseEntity.ok(Map.of(
                "service", "Codex AI",
                "version", appVersion,
                "endpoints", Map.of(
                        "query", "POST /api/v1/ai/projects/{projectId}/query - Ask about a project",
                        "sceneDraft", "POST /api/v1/ai/projects/{projectId}/scene-draft - Draft the next scene of a chapter",
                        "rephrase", "POST /api/v1/ai/projects/{projectId}/rephrase - Suggest alternative phrasings",
                        "splitChapter", "POST /api/v1/ai/projects/{projectId}/split-chapter - Split a chapter into scenes",
                        "rebuildIndex", "POST /api/v1/ai/projects/{projectId}/rebuild-index - Rebuild a project's index",
                        "indexStats", "GET /api/v1/index/projects/{projectId} - Indexed documents of a project",
                        "health", "GET /actuator/health - Health check"
                )
        ));
    }
}
