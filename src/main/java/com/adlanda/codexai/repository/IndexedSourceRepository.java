package com.adlanda.codexai.repository;

import com.adlanda.codexai.entity.IndexedSource;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Ledger of indexed project documents.
 *
 * Supports incremental indexing by remembering each document's content hash.
 */
@Repository
public interface IndexedSourceRepository extends JpaRepository<IndexedSource, UUID> {

    Optional<IndexedSource> findBySourcePath(String sourcePath);

    /**
     * If this returns true, the document hasn't changed since it was indexed and can be skipped.
     */
    boolean existsBySourcePathAndContentHash(String sourcePath, String contentHash);

    List<IndexedSource> findByProjectIdOrderBySourcePath(String projectId);

    @Query("SELECT COALESCE(SUM(s.chunkCount), 0) FROM IndexedSource s WHERE s.projectId = :projectId")
    long sumChunkCountByProjectId(String projectId);

    @Transactional
    @Modifying
    @Query("DELETE FROM IndexedSource s WHERE s.sourcePath = :sourcePath")
    int deleteBySourcePath(String sourcePath);

    @Transactional
    @Modifying
    @Query("DELETE FROM IndexedSource s WHERE s.projectId = :projectId")
    int deleteByProjectId(String projectId);
}
