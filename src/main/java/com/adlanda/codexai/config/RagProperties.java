package com.adlanda.codexai.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Retrieval and generation settings.
 *
 * Maps to properties prefixed with 'codex.rag' in application.properties.
 */
@Component
@ConfigurationProperties(prefix = "codex.rag")
public class RagProperties {

    /**
     * How many chunks to retrieve for project queries.
     */
    private int queryTopK = 3;

    /**
     * How many chunks to retrieve for generation (scene drafts, rephrasing, splitting).
     */
    private int generationTopK = 5;

    /**
     * Number of alternatives requested from the model when rephrasing.
     */
    private int rephraseSuggestionCount = 3;

    /**
     * Previous scenes included in full when a scene draft request does not say.
     */
    private int previousSceneCount = 3;

    /**
     * Maximum time to wait for a language model reply.
     */
    private Duration generationTimeout = Duration.ofSeconds(120);

    public int getQueryTopK() {
        return queryTopK;
    }

    public void setQueryTopK(int queryTopK) {
        this.queryTopK = queryTopK;
    }

    public int getGenerationTopK() {
        return generationTopK;
    }

    public void setGenerationTopK(int generationTopK) {
        this.generationTopK = generationTopK;
    }

    public int getRephraseSuggestionCount() {
        return rephraseSuggestionCount;
    }

    public void setRephraseSuggestionCount(int rephraseSuggestionCount) {
        this.rephraseSuggestionCount = rephraseSuggestionCount;
    }

    public int getPreviousSceneCount() {
        return previousSceneCount;
    }

    public void setPreviousSceneCount(int previousSceneCount) {
        this.previousSceneCount = previousSceneCount;
    }

    public Duration getGenerationTimeout() {
        return generationTimeout;
    }

    public void setGenerationTimeout(Duration generationTimeout) {
        this.generationTimeout = generationTimeout;
    }
}
