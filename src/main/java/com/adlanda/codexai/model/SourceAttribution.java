package com.adlanda.codexai.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A retrieved chunk returned alongside an answer.
 *
 * @param id       Chunk id
 * @param text     The text content of the chunk
 * @param score    Cosine similarity score (higher is more similar)
 * @param metadata project_id, file_path, entity type and, for characters, character_name
 */
public record SourceAttribution(
        String id,
        String text,
        double score,
        Map<String, Object> metadata
) {
    public static SourceAttribution from(ScoredChunk scored) {
        ContentChunk chunk = scored.chunk();
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("project_id", chunk.projectId());
        metadata.put("file_path", chunk.sourcePath());
        metadata.put("entity_type", chunk.entityType().name());
        if (chunk.characterName() != null) {
            metadata.put("character_name", chunk.characterName());
        }
        return new SourceAttribution(chunk.id(), chunk.text(), scored.score(), Map.copyOf(metadata));
    }

    public String sourcePath() {
        return (String) metadata.get("file_path");
    }

    public String characterName() {
        return (String) metadata.get("character_name");
    }
}
