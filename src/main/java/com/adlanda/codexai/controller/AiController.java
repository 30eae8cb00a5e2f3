package com.adlanda.codexai.controller;

import com.adlanda.codexai.model.Answer;
import com.adlanda.codexai.model.ChapterSplitRequest;
import com.adlanda.codexai.model.ProposedScenes;
import com.adlanda.codexai.model.QueryRequest;
import com.adlanda.codexai.model.RebuildResult;
import com.adlanda.codexai.model.RephraseRequest;
import com.adlanda.codexai.model.RephraseSuggestions;
import com.adlanda.codexai.model.SceneDraft;
import com.adlanda.codexai.model.SceneDraftRequest;
import com.adlanda.codexai.service.GenerationOrchestrator;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST controller for the AI operations of a project.
 */
@RestController
@RequestMapping("/api/v1/ai/projects/{projectId}")
public class AiController {

    private final GenerationOrchestrator orchestrator;

    public AiController(GenerationOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping("/query")
    public ResponseEntity<Answer> query(@PathVariable String projectId,
                                        @Valid @RequestBody QueryRequest request) {
        return ResponseEntity.ok(orchestrator.query(projectId, request.text()));
    }

    @PostMapping("/scene-draft")
    public ResponseEntity<SceneDraft> sceneDraft(@PathVariable String projectId,
                                                 @Valid @RequestBody SceneDraftRequest request) {
        return ResponseEntity.ok(orchestrator.generateSceneDraft(
                projectId, request.chapterId(), request.promptSummary(), request.previousSceneCount()));
    }

    @PostMapping("/rephrase")
    public ResponseEntity<RephraseSuggestions> rephrase(@PathVariable String projectId,
                                                        @Valid @RequestBody RephraseRequest request) {
        return ResponseEntity.ok(orchestrator.rephraseText(
                projectId, request.selectedText(), request.contextBefore(), request.contextAfter()));
    }

    @PostMapping("/split-chapter")
    public ResponseEntity<ProposedScenes> splitChapter(@PathVariable String projectId,
                                                       @Valid @RequestBody ChapterSplitRequest request) {
        return ResponseEntity.ok(orchestrator.splitChapterIntoScenes(
                projectId, request.chapterId(), request.chapterText()));
    }

    /**
     * Rebuilds the project's index; a rebuild that could not clear the old index answers 503.
     */
    @PostMapping("/rebuild-index")
    public ResponseEntity<RebuildResult> rebuildIndex(@PathVariable String projectId) {
        RebuildResult result = orchestrator.rebuildProjectIndex(projectId);
        return ResponseEntity.status(result.success() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
                .body(result);
    }
}
