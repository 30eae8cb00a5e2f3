package com.adlanda.codexai.service;

import com.adlanda.codexai.config.IndexProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits document text into paragraph-aligned chunks.
 *
 * Paragraphs (separated by blank lines) are packed into a chunk until the
 * estimated token count would exceed the configured maximum.
 */
@Component
public class TextChunker {

    private final IndexProperties properties;

    public TextChunker(IndexProperties properties) {
        this.properties = properties;
    }

    public List<String> chunk(String content) {
        List<String> chunks = new ArrayList<>();
        if (content == null || content.isBlank()) {
            return chunks;
        }

        String[] paragraphs = content.replace("\r\n", "\n").split("\n\\s*\n+");
        int maxTokens = Math.max(1, properties.getMaxTokens());
        StringBuilder currentChunk = new StringBuilder();

        for (String paragraph : paragraphs) {
            String trimmed = paragraph.trim();
            if (trimmed.isEmpty()) {
                continue;
            }

            // Rough token estimate: ~4 characters per token
            int estimatedTokens = (currentChunk.length() + trimmed.length()) / 4;

            if (estimatedTokens > maxTokens && currentChunk.length() > 0) {
                chunks.add(currentChunk.toString().trim());
                currentChunk = new StringBuilder();
            }

            if (currentChunk.length() > 0) {
                currentChunk.append("\n\n");
            }
            currentChunk.append(trimmed);
        }

        if (currentChunk.length() > 0) {
            chunks.add(currentChunk.toString().trim());
        }
        return chunks;
    }
}
