package com.adlanda.codexai.model;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Ledger view of one project's index.
 *
 * @param projectId  Project the statistics are for
 * @param documents  Number of indexed documents
 * @param chunks     Total chunks across those documents
 * @param sources    One entry per indexed document, ordered by source path
 */
public record IndexStats(String projectId, long documents, long chunks, List<IndexedDocument> sources) {

    public IndexStats {
        sources = List.copyOf(sources);
    }

    public record IndexedDocument(String sourcePath, String contentHash, int chunkCount, LocalDateTime indexedAt) {}
}
