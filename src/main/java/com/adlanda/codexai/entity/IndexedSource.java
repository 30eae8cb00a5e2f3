package com.adlanda.codexai.entity;

import jakarta.persistence.*;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * JPA entity tracking indexed project documents.
 *
 * Used for incremental indexing - records the content hash each document had when
 * it was last indexed, and how many chunks it produced.
 */
@Entity
@Table(name = "indexed_sources", indexes = @Index(name = "idx_indexed_sources_project", columnList = "project_id"))
public class IndexedSource {

    @Id
    @Column(name = "id")
    private UUID id;

    @Column(name = "project_id", nullable = false, length = 200)
    private String projectId;

    @Column(name = "source_path", unique = true, nullable = false, length = 500)
    private String sourcePath;

    @Column(name = "content_hash", nullable = false, length = 64)
    private String contentHash;

    @Column(name = "chunk_count")
    private Integer chunkCount;

    @Column(name = "indexed_at")
    private LocalDateTime indexedAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    // Default constructor for JPA
    public IndexedSource() {
        this.id = UUID.randomUUID();
        this.indexedAt = LocalDateTime.now();
        this.updatedAt = LocalDateTime.now();
    }

    public IndexedSource(String projectId, String sourcePath, String contentHash, Integer chunkCount) {
        this();
        this.projectId = projectId;
        this.sourcePath = sourcePath;
        this.contentHash = contentHash;
        this.chunkCount = chunkCount;
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = LocalDateTime.now();
    }

    public UUID getId() {
        return id;
    }

    public String getProjectId() {
        return projectId;
    }

    public String getSourcePath() {
        return sourcePath;
    }

    public String getContentHash() {
        return contentHash;
    }

    public void setContentHash(String contentHash) {
        this.contentHash = contentHash;
    }

    public Integer getChunkCount() {
        return chunkCount;
    }

    public void setChunkCount(Integer chunkCount) {
        this.chunkCount = chunkCount;
    }

    public LocalDateTime getIndexedAt() {
        return indexedAt;
    }

    public LocalDateTime getUpdatedAt() {
        return updatedAt;
    }

    @Override
    public String toString() {
        return "IndexedSource{" +
                "projectId='" + projectId + '\'' +
                ", sourcePath='" + sourcePath + '\'' +
                ", contentHash='" + contentHash + '\'' +
                ", chunkCount=" + chunkCount +
                ", updatedAt=" + updatedAt +
                '}';
    }
}
