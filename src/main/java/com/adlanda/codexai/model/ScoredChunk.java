package com.adlanda.codexai.model;

/**
 * A chunk with its similarity score.
 */
public record ScoredChunk(ContentChunk chunk, double score) {}
