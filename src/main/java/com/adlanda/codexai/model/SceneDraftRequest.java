package com.adlanda.codexai.model;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * Request for a draft of the next scene of a chapter.
 *
 * @param chapterId          Chapter the new scene belongs to
 * @param promptSummary      Optional guidance for the scene
 * @param previousSceneCount How many preceding scenes to include in full; null means the configured default
 */
public record SceneDraftRequest(
        @NotBlank(message = "Chapter id is required")
        String chapterId,

        String promptSummary,

        @Min(0) @Max(20)
        Integer previousSceneCount
) implements GenerationRequest {}
