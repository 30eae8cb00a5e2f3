package com.adlanda.codexai.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the project index.
 *
 * Maps to properties prefixed with 'codex.index' in application.properties.
 */
@Component
@ConfigurationProperties(prefix = "codex.index")
public class IndexProperties {

    /**
     * Which vector index backs retrieval: memory, pgvector or none.
     */
    private Backend backend = Backend.MEMORY;

    /**
     * Whether to skip re-indexing files whose content hash has not changed.
     */
    private boolean incremental = true;

    /**
     * Rough chunk size in tokens (about 4 characters per token).
     */
    private int maxTokens = 512;

    /**
     * Whether every project is rebuilt when the application starts.
     */
    private boolean rebuildOnStartup = false;

    private String tableName = "vector_store";

    private int dimensions = 1536;

    public enum Backend {
        MEMORY,
        PGVECTOR,
        NONE
    }

    public Backend getBackend() {
        return backend;
    }

    public void setBackend(Backend backend) {
        this.backend = backend;
    }

    public boolean isIncremental() {
        return incremental;
    }

    public void setIncremental(boolean incremental) {
        this.incremental = incremental;
    }

    public int getMaxTokens() {
        return maxTokens;
    }

    public void setMaxTokens(int maxTokens) {
        this.maxTokens = maxTokens;
    }

    public boolean isRebuildOnStartup() {
        return rebuildOnStartup;
    }

    public void setRebuildOnStartup(boolean rebuildOnStartup) {
        this.rebuildOnStartup = rebuildOnStartup;
    }

    public String getTableName() {
        return tableName;
    }

    public void setTableName(String tableName) {
        this.tableName = tableName;
    }

    public int getDimensions() {
        return dimensions;
    }

    public void setDimensions(int dimensions) {
        this.dimensions = dimensions;
    }
}
