package com.adlanda.codexai.repository;

import com.adlanda.codexai.model.ChunkMetadata;
import com.adlanda.codexai.model.ScoredChunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;

/**
 * Index that stores nothing. Selected with {@code codex.index.backend=none}.
 */
public class NullIndexStore implements VectorIndexStore {

    private static final Logger log = LoggerFactory.getLogger(NullIndexStore.class);

    @Override
    public int upsert(String sourcePath, String projectId, ChunkMetadata metadata, String text) {
        log.debug("Indexing disabled, ignoring upsert of {}", sourcePath);
        return 0;
    }

    @Override
    public boolean delete(String sourcePath) {
        return false;
    }

    @Override
    public int deleteProject(String projectId) {
        return 0;
    }

    @Override
    public List<ScoredChunk> query(String projectId, List<Double> queryEmbedding, int topK,
                                   Set<String> excludePaths) {
        return List.of();
    }

    @Override
    public boolean isSearchable() {
        return false;
    }

    @Override
    public int size() {
        return 0;
    }
}
