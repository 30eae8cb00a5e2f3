package com.adlanda.codexai.repository;

import com.adlanda.codexai.exception.IndexBackendException;
import com.adlanda.codexai.model.ChunkMetadata;
import com.adlanda.codexai.model.ContentChunk;
import com.adlanda.codexai.model.EntityType;
import com.adlanda.codexai.model.ScoredChunk;
import com.adlanda.codexai.service.ContentHashService;
import com.adlanda.codexai.service.TextChunker;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.document.Document;
import org.springframework.ai.vectorstore.VectorStore;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.*;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * PostgreSQL-based vector index using the PGVector extension.
 *
 * Wraps Spring AI's VectorStore for embedding and storage. Deletes by metadata and
 * similarity search go through JDBC, since VectorStore has no delete-by-metadata and only
 * searches by query text. Replacing a document's chunks runs in one transaction.
 */
public class PgVectorIndexStore implements VectorIndexStore {

    private static final Logger log = LoggerFactory.getLogger(PgVectorIndexStore.class);

    static final String PROJECT_ID = "projectId";
    static final String SOURCE_PATH = "sourcePath";
    static final String ENTITY_TYPE = "entityType";
    static final String CHARACTER_NAME = "characterName";
    static final String CHUNK_INDEX = "chunkIndex";
    static final String CONTENT_HASH = "contentHash";

    private final VectorStore vectorStore;
    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final TextChunker chunker;
    private final ContentHashService hashService;
    private final ObjectMapper objectMapper;
    private final String tableName;

    public PgVectorIndexStore(VectorStore vectorStore, JdbcTemplate jdbcTemplate,
                              TransactionTemplate transactionTemplate, TextChunker chunker,
                              ContentHashService hashService, ObjectMapper objectMapper, String tableName) {
        this.vectorStore = vectorStore;
        this.objectMapper = objectMapper;
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.chunker = chunker;
        this.hashService = hashService;
        this.tableName = tableName;
    }

    @Override
    public int upsert(String sourcePath, String projectId, ChunkMetadata metadata, String text) {
        List<String> pieces = chunker.chunk(text);
        String contentHash = pieces.isEmpty() ? "" : hashService.computeHash(text);

        List<Document> documents = new ArrayList<>(pieces.size());
        for (int i = 0; i < pieces.size(); i++) {
            ContentChunk chunk = ContentChunk.withoutEmbedding(
                    hashService.chunkId(sourcePath, i, contentHash),
                    projectId, sourcePath, metadata, i, pieces.get(i), contentHash);
            documents.add(toDocument(chunk));
        }

        return backend("upsert of " + sourcePath, () -> transactionTemplate.execute(status -> {
            int removed = deleteRows(sourcePath);
            if (!documents.isEmpty()) {
                vectorStore.add(documents);
            }
            log.debug("Replaced {} rows with {} chunks for {}", removed, documents.size(), sourcePath);
            return documents.size();
        }));
    }

    @Override
    public boolean delete(String sourcePath) {
        return backend("delete of " + sourcePath, () -> deleteRows(sourcePath)) > 0;
    }

    @Override
    public int deleteProject(String projectId) {
        return backend("delete of project " + projectId, () -> transactionTemplate.execute(status -> {
            Integer documents = jdbcTemplate.queryForObject(
                    "SELECT COUNT(DISTINCT metadata->>'" + SOURCE_PATH + "') FROM " + tableName
                            + " WHERE metadata->>'" + PROJECT_ID + "' = ?",
                    Integer.class, projectId);
            int rows = jdbcTemplate.update(
                    "DELETE FROM " + tableName + " WHERE metadata->>'" + PROJECT_ID + "' = ?", projectId);
            log.info("Deleted {} rows ({} documents) of project {}", rows, documents, projectId);
            return documents == null ? 0 : documents;
        }));
    }

    /**
     * Ranks the project's rows by cosine distance to the query embedding.
     */
    @Override
    public List<ScoredChunk> query(String projectId, List<Double> queryEmbedding, int topK,
                                   Set<String> excludePaths) {
        if (topK <= 0) {
            return List.of();
        }
        List<Object> args = new ArrayList<>();
        args.add(toVectorLiteral(queryEmbedding));
        args.add(projectId);

        StringBuilder sql = new StringBuilder("SELECT id, content, metadata, embedding <=> ?::vector AS distance FROM ")
                .append(tableName)
                .append(" WHERE metadata->>'").append(PROJECT_ID).append("' = ?");
        if (!excludePaths.isEmpty()) {
            sql.append(" AND metadata->>'").append(SOURCE_PATH).append("' NOT IN (")
                    .append(String.join(", ", Collections.nCopies(excludePaths.size(), "?")))
                    .append(")");
            args.addAll(new TreeSet<>(excludePaths));
        }
        sql.append(" ORDER BY distance LIMIT ?");
        args.add(topK);

        String statement = sql.toString();
        return backend("query of project " + projectId, () -> jdbcTemplate.query(statement,
                (rs, rowNum) -> toScoredChunk(rs.getString("id"), rs.getString("content"),
                        readMetadata(rs.getString("metadata")), 1.0 - rs.getDouble("distance")),
                args.toArray()));
    }

    @Override
    public int size() {
        Integer count = backend("count", () ->
                jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + tableName, Integer.class));
        return count == null ? 0 : count;
    }

    private int deleteRows(String sourcePath) {
        return jdbcTemplate.update(
                "DELETE FROM " + tableName + " WHERE metadata->>'" + SOURCE_PATH + "' = ?", sourcePath);
    }

    private <T> T backend(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (IndexBackendException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new IndexBackendException("PGVector " + operation + " failed: " + e.getMessage(), e);
        }
    }

    /**
     * Converts a ContentChunk to a Spring AI Document.
     */
    private Document toDocument(ContentChunk chunk) {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put(PROJECT_ID, chunk.projectId());
        metadata.put(SOURCE_PATH, chunk.sourcePath());
        metadata.put(ENTITY_TYPE, chunk.entityType().name());
        metadata.put(CHUNK_INDEX, chunk.chunkIndex());
        metadata.put(CONTENT_HASH, chunk.contentHash());
        if (chunk.characterName() != null) {
            metadata.put(CHARACTER_NAME, chunk.characterName());
        }
        return new Document(chunk.id(), chunk.text(), metadata);
    }

    /**
     * Converts a result row back to a ScoredChunk.
     */
    private ScoredChunk toScoredChunk(String id, String text, Map<String, Object> metadata, double score) {
        Object chunkIndex = metadata.getOrDefault(CHUNK_INDEX, 0);

        ContentChunk chunk = new ContentChunk(
                id,
                String.valueOf(metadata.get(PROJECT_ID)),
                String.valueOf(metadata.getOrDefault(SOURCE_PATH, "unknown")),
                EntityType.valueOf(String.valueOf(metadata.getOrDefault(ENTITY_TYPE, EntityType.SCENE.name()))),
                (String) metadata.get(CHARACTER_NAME),
                chunkIndex instanceof Number n ? n.intValue() : Integer.parseInt(String.valueOf(chunkIndex)),
                text,
                (String) metadata.getOrDefault(CONTENT_HASH, ""),
                null  // Embedding not needed for results
        );
        return new ScoredChunk(chunk, score);
    }

    private Map<String, Object> readMetadata(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {});
        } catch (JsonProcessingException e) {
            throw new IndexBackendException("Unreadable chunk metadata: " + e.getOriginalMessage(), e);
        }
    }

    private static String toVectorLiteral(List<Double> embedding) {
        return embedding.stream()
                .map(String::valueOf)
                .collect(Collectors.joining(",", "[", "]"));
    }
}
