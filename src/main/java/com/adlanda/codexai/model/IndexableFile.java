package com.adlanda.codexai.model;

/**
 * A project document the index should hold.
 *
 * @param relativePath Path relative to the project directory, forward slashes
 * @param metadata     Chunk metadata for the document
 */
public record IndexableFile(String relativePath, ChunkMetadata metadata) {}
