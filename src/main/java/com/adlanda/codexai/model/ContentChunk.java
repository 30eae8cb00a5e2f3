package com.adlanda.codexai.model;

import java.util.List;

/**
 * A chunk of project content, along with its embedding vector.
 *
 * @param id            Deterministic identifier (derived from source path, index and content hash)
 * @param projectId     Project the chunk belongs to
 * @param sourcePath    Source path of the document ({@code <projectId>/<relative path>})
 * @param entityType    Kind of document the chunk came from
 * @param characterName Character name for character profiles, otherwise null
 * @param chunkIndex    Index of this chunk within the source document
 * @param text          The text content of the chunk
 * @param contentHash   SHA-256 hash of the whole source document
 * @param embedding     Vector representation of the text
 */
public record ContentChunk(
        String id,
        String projectId,
        String sourcePath,
        EntityType entityType,
        String characterName,
        int chunkIndex,
        String text,
        String contentHash,
        List<Double> embedding
) {
    /**
     * Creates a chunk without an embedding (before embedding is generated).
     */
    public static ContentChunk withoutEmbedding(String id, String projectId, String sourcePath,
                                                ChunkMetadata metadata, int chunkIndex,
                                                String text, String contentHash) {
        return new ContentChunk(id, projectId, sourcePath, metadata.entityType(), metadata.characterName(),
                chunkIndex, text, contentHash, null);
    }

    /**
     * Creates a new chunk with the given embedding.
     */
    public ContentChunk withEmbedding(List<Double> embedding) {
        return new ContentChunk(id, projectId, sourcePath, entityType, characterName, chunkIndex, text,
                contentHash, embedding);
    }

    public boolean hasEmbedding() {
        return embedding != null && !embedding.isEmpty();
    }
}
