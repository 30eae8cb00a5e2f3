package com.adlanda.codexai.repository;

import com.adlanda.codexai.exception.IndexBackendException;
import com.adlanda.codexai.model.ChunkMetadata;
import com.adlanda.codexai.model.ContentChunk;
import com.adlanda.codexai.model.ScoredChunk;
import com.adlanda.codexai.service.ContentHashService;
import com.adlanda.codexai.service.EmbeddingService;
import com.adlanda.codexai.service.TextChunker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory vector index.
 *
 * Chunks are grouped per source path; an upsert swaps the whole group in one map
 * write, so readers see either the old chunk set or the new one.
 */
public class InMemoryVectorIndexStore implements VectorIndexStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryVectorIndexStore.class);

    private final Map<String, List<ContentChunk>> chunksBySource = new ConcurrentHashMap<>();

    private final TextChunker chunker;
    private final EmbeddingService embeddingService;
    private final ContentHashService hashService;

    public InMemoryVectorIndexStore(TextChunker chunker, EmbeddingService embeddingService,
                                    ContentHashService hashService) {
        this.chunker = chunker;
        this.embeddingService = embeddingService;
        this.hashService = hashService;
    }

    @Override
    public int upsert(String sourcePath, String projectId, ChunkMetadata metadata, String text) {
        List<String> pieces = chunker.chunk(text);
        if (pieces.isEmpty()) {
            if (chunksBySource.remove(sourcePath) != null) {
                log.info("Removed chunks of now-empty document {}", sourcePath);
            }
            return 0;
        }

        String contentHash = hashService.computeHash(text);
        List<ContentChunk> current = chunksBySource.get(sourcePath);
        if (isSameContent(current, projectId, metadata, contentHash)) {
            log.debug("Unchanged content for {}, keeping {} chunks", sourcePath, current.size());
            return current.size();
        }

        // Embed before touching the map so a failure keeps the previous chunk set
        List<List<Double>> vectors = embeddingService.embedAll(pieces);
        List<ContentChunk> chunks = new ArrayList<>(pieces.size());
        for (int i = 0; i < pieces.size(); i++) {
            ContentChunk chunk = ContentChunk.withoutEmbedding(
                    hashService.chunkId(sourcePath, i, contentHash),
                    projectId, sourcePath, metadata, i, pieces.get(i), contentHash);
            chunks.add(chunk.withEmbedding(vectors.get(i)));
        }

        chunksBySource.put(sourcePath, List.copyOf(chunks));
        log.debug("Stored {} chunks for {}", chunks.size(), sourcePath);
        return chunks.size();
    }

    @Override
    public boolean delete(String sourcePath) {
        List<ContentChunk> removed = chunksBySource.remove(sourcePath);
        if (removed != null) {
            log.debug("Deleted {} chunks for {}", removed.size(), sourcePath);
        }
        return removed != null;
    }

    @Override
    public int deleteProject(String projectId) {
        List<String> paths = chunksBySource.entrySet().stream()
                .filter(entry -> entry.getValue().stream().anyMatch(c -> projectId.equals(c.projectId())))
                .map(Map.Entry::getKey)
                .toList();

        int removed = 0;
        for (String path : paths) {
            if (chunksBySource.remove(path) != null) {
                removed++;
            }
        }
        log.info("Deleted {} documents of project {} from the index", removed, projectId);
        return removed;
    }

    @Override
    public List<ScoredChunk> query(String projectId, List<Double> queryEmbedding, int topK,
                                   Set<String> excludePaths) {
        if (topK <= 0) {
            return List.of();
        }

        // Project and exclusion filters run before the top-K cut
        return chunksBySource.values().stream()
                .flatMap(List::stream)
                .filter(chunk -> projectId.equals(chunk.projectId()))
                .filter(chunk -> !excludePaths.contains(chunk.sourcePath()))
                .filter(ContentChunk::hasEmbedding)
                .map(chunk -> new ScoredChunk(chunk, cosineSimilarity(queryEmbedding, chunk.embedding())))
                .sorted(Comparator.comparingDouble(ScoredChunk::score).reversed())
                .limit(topK)
                .toList();
    }

    @Override
    public int size() {
        return chunksBySource.values().stream().mapToInt(List::size).sum();
    }

    private static boolean isSameContent(List<ContentChunk> current, String projectId,
                                         ChunkMetadata metadata, String contentHash) {
        if (current == null || current.isEmpty()) {
            return false;
        }
        ContentChunk first = current.get(0);
        return contentHash.equals(first.contentHash())
                && projectId.equals(first.projectId())
                && metadata.entityType() == first.entityType()
                && Objects.equals(metadata.characterName(), first.characterName());
    }

    /**
     * Computes cosine similarity between two vectors.
     *
     * @return Similarity score between -1 and 1 (1 = identical direction)
     */
    private double cosineSimilarity(List<Double> a, List<Double> b) {
        if (a.size() != b.size()) {
            throw new IndexBackendException("Embedding dimensions differ: " + a.size() + " vs " + b.size());
        }

        double dotProduct = 0.0;
        double normA = 0.0;
        double normB = 0.0;

        for (int i = 0; i < a.size(); i++) {
            dotProduct += a.get(i) * b.get(i);
            normA += a.get(i) * a.get(i);
            normB += b.get(i) * b.get(i);
        }

        if (normA == 0 || normB == 0) {
            return 0.0;
        }

        return dotProduct / (Math.sqrt(normA) * Math.sqrt(normB));
    }
}
