package com.adlanda.codexai.controller;

import com.adlanda.codexai.model.IndexStats;
import com.adlanda.codexai.service.ContentSyncManager;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Index statistics per project.
 */
@RestController
@RequestMapping("/api/v1/index")
public class IndexController {

    private final ContentSyncManager syncManager;

    public IndexController(ContentSyncManager syncManager) {
        this.syncManager = syncManager;
    }

    @GetMapping("/projects/{projectId}")
    public ResponseEntity<IndexStats> projectStats(@PathVariable String projectId) {
        return ResponseEntity.ok(syncManager.stats(projectId));
    }
}
