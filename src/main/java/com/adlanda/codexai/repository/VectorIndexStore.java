package com.adlanda.codexai.repository;

import com.adlanda.codexai.model.ChunkMetadata;
import com.adlanda.codexai.model.ScoredChunk;

import java.util.List;
import java.util.Set;

/**
 * Holds embedded content chunks per project.
 *
 * Every chunk is keyed by its source path and scoped by project id. Embedding and
 * backend faults surface as {@link com.adlanda.codexai.exception.IndexBackendException}.
 */
public interface VectorIndexStore {

    /**
     * Chunks and embeds {@code text} and replaces every prior chunk of {@code sourcePath}.
     * The old chunk set stays in place if chunking or embedding fails. Blank text leaves
     * the path with no chunks.
     *
     * @return number of chunks now stored for the path
     */
    int upsert(String sourcePath, String projectId, ChunkMetadata metadata, String text);

    /**
     * Removes every chunk of {@code sourcePath}. Deleting an absent path is a no-op.
     *
     * @return true if anything was removed
     */
    boolean delete(String sourcePath);

    /**
     * Removes every chunk of a project.
     *
     * @return number of distinct source documents removed
     */
    int deleteProject(String projectId);

    /**
     * Returns up to {@code topK} chunks of {@code projectId} ranked by similarity to
     * {@code queryEmbedding}. Chunks whose source path is in {@code excludePaths} are dropped
     * before the result is cut to {@code topK}.
     */
    List<ScoredChunk> query(String projectId, List<Double> queryEmbedding, int topK, Set<String> excludePaths);

    /**
     * False for a store that never returns results, so callers can skip embedding the query.
     */
    default boolean isSearchable() {
        return true;
    }

    /**
     * Total number of chunks stored.
     */
    int size();
}
