package com.adlanda.codexai.service;

import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.UUID;

/**
 * Computes content hashes and the deterministic chunk ids derived from them.
 *
 * Used for change detection in incremental indexing: content with the same hash
 * hasn't changed and can be skipped.
 */
@Service
public class ContentHashService {

    /**
     * Computes the SHA-256 hash of a string content.
     *
     * @param content The string content to hash
     * @return Hexadecimal string representation of the hash (64 characters)
     */
    public String computeHash(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hashBytes = digest.digest(content.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hashBytes);
        } catch (NoSuchAlgorithmException e) {
            // SHA-256 is always available in standard JVMs
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }

    /**
     * Name-based UUID for a chunk, stable for the same path, position and content.
     */
    public String chunkId(String sourcePath, int chunkIndex, String contentHash) {
        String key = sourcePath + "#" + chunkIndex + ":" + contentHash;
        return UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8)).toString();
    }
}
