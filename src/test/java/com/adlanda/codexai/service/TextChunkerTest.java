package com.adlanda.codexai.service;

import com.adlanda.codexai.config.IndexProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TextChunkerTest {

    private IndexProperties properties;
    private TextChunker chunker;

    @BeforeEach
    void setUp() {
        properties = new IndexProperties();
        chunker = new TextChunker(properties);
    }

    @Test
    void chunk_smallParagraphs_packedIntoOneChunk() {
        String content = """
            First paragraph.

            Second paragraph.

            Third paragraph.
            """;

        List<String> chunks = chunker.chunk(content);

        assertThat(chunks).containsExactly("First paragraph.\n\nSecond paragraph.\n\nThird paragraph.");
    }

    @Test
    void chunk_largeContent_splitsOnParagraphs() {
        properties.setMaxTokens(20);
        StringBuilder content = new StringBuilder();
        for (int i = 0; i < 10; i++) {
            content.append("This is paragraph number ").append(i).append(" with some more text.\n\n");
        }

        List<String> chunks = chunker.chunk(content.toString());

        assertThat(chunks).hasSizeGreaterThan(1);
        assertThat(chunks).allMatch(chunk -> chunk.startsWith("This is paragraph number"));
        assertThat(String.join(" ", chunks)).contains("number 0").contains("number 9");
    }

    @Test
    void chunk_windowsLineEndings_areSplit() {
        properties.setMaxTokens(1);

        List<String> chunks = chunker.chunk("One.\r\n\r\nTwo.");

        assertThat(chunks).containsExactly("One.", "Two.");
    }

    @Test
    void chunk_emptyContent_returnsEmptyList() {
        assertThat(chunker.chunk("")).isEmpty();
        assertThat(chunker.chunk(null)).isEmpty();
    }

    @Test
    void chunk_onlyWhitespace_returnsEmptyList() {
        assertThat(chunker.chunk("   \n\n   ")).isEmpty();
    }
}
