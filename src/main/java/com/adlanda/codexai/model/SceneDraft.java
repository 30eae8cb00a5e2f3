package com.adlanda.codexai.model;

/**
 * A generated scene draft.
 */
public record SceneDraft(String title, String content) implements GenerationResult {}
