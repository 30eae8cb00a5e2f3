package com.adlanda.codexai.service;

import com.adlanda.codexai.model.ScoredChunk;
import com.adlanda.codexai.model.SourceAttribution;
import com.adlanda.codexai.repository.VectorIndexStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;

/**
 * Retrieves project chunks similar to a query.
 *
 * The query is embedded first; only the ranking against the index runs under the
 * project's read lock.
 */
@Service
public class RetrievalService {

    private static final Logger log = LoggerFactory.getLogger(RetrievalService.class);

    private final EmbeddingService embeddingService;
    private final VectorIndexStore indexStore;
    private final ProjectLockRegistry locks;

    public RetrievalService(EmbeddingService embeddingService, VectorIndexStore indexStore,
                            ProjectLockRegistry locks) {
        this.embeddingService = embeddingService;
        this.indexStore = indexStore;
        this.locks = locks;
    }

    /**
     * Queries the index for chunks of one project.
     *
     * @param projectId    Project to search
     * @param query        Text to search for
     * @param topK         Maximum number of results to return
     * @param excludePaths Source paths whose chunks must not be returned
     * @return matched chunks, best first
     */
    public List<SourceAttribution> retrieve(String projectId, String query, int topK, Set<String> excludePaths) {
        if (topK <= 0 || !indexStore.isSearchable()) {
            return List.of();
        }
        long startTime = System.currentTimeMillis();

        // 1. Embed the query
        List<Double> queryEmbedding = embeddingService.embed(query);

        // 2. Rank the project's chunks
        List<ScoredChunk> scoredChunks = locks.withReadLock(projectId,
                () -> indexStore.query(projectId, queryEmbedding, topK, excludePaths));

        List<SourceAttribution> results = scoredChunks.stream()
                .map(SourceAttribution::from)
                .toList();

        long queryTimeMs = System.currentTimeMillis() - startTime;
        log.debug("Query '{}' on project {} returned {} results in {}ms (excluded {} paths)",
                truncate(query, 50), projectId, results.size(), queryTimeMs, excludePaths.size());
        return results;
    }

    private String truncate(String s, int maxLen) {
        return s.length() <= maxLen ? s : s.substring(0, maxLen) + "...";
    }
}
