package com.adlanda.codexai.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Request to split a chapter's text into proposed scenes.
 */
public record ChapterSplitRequest(
        @NotBlank(message = "Chapter id is required")
        String chapterId,

        @NotNull(message = "Chapter text is required")
        String chapterText
) implements GenerationRequest {}
