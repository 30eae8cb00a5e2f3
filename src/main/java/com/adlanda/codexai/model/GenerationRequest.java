package com.adlanda.codexai.model;

/**
 * One AI operation request. Exactly one variant is active per call.
 */
public sealed interface GenerationRequest
        permits QueryRequest, SceneDraftRequest, RephraseRequest, ChapterSplitRequest {
}
