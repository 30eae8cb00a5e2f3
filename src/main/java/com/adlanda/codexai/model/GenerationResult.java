package com.adlanda.codexai.model;

/**
 * Structured result of one AI operation.
 */
public sealed interface GenerationResult
        permits Answer, SceneDraft, RephraseSuggestions, ProposedScenes {
}
