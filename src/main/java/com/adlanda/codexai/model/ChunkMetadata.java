package com.adlanda.codexai.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Metadata attached to every chunk of a document.
 *
 * @param entityType    Kind of document
 * @param characterName Character name, only set for character profiles
 */
public record ChunkMetadata(EntityType entityType, String characterName) {

    public static ChunkMetadata of(EntityType entityType) {
        return new ChunkMetadata(entityType, null);
    }

    public static ChunkMetadata character(String characterName) {
        return new ChunkMetadata(EntityType.CHARACTER, characterName);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("entityType", entityType.name());
        if (characterName != null) {
            map.put("characterName", characterName);
        }
        return map;
    }
}
