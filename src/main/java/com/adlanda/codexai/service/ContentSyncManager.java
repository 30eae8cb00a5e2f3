package com.adlanda.codexai.service;

import com.adlanda.codexai.config.IndexProperties;
import com.adlanda.codexai.content.ContentChangedEvent;
import com.adlanda.codexai.content.ContentStore;
import com.adlanda.codexai.content.SourcePaths;
import com.adlanda.codexai.entity.IndexedSource;
import com.adlanda.codexai.exception.CodexException;
import com.adlanda.codexai.exception.IndexBackendException;
import com.adlanda.codexai.exception.NotFoundException;
import com.adlanda.codexai.health.IndexHealthIndicator;
import com.adlanda.codexai.model.IndexStats;
import com.adlanda.codexai.model.IndexableFile;
import com.adlanda.codexai.model.RebuildResult;
import com.adlanda.codexai.repository.IndexedSourceRepository;
import com.adlanda.codexai.repository.VectorIndexStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Keeps the vector index in step with project content.
 *
 * Every index write for a project runs under that project's write lock. The ledger
 * remembers the content hash of each indexed document so unchanged documents are
 * skipped when incremental indexing is enabled.
 */
@Service
public class ContentSyncManager {

    private static final Logger log = LoggerFactory.getLogger(ContentSyncManager.class);

    /**
     * What happened to a single document during a sync step.
     */
    public enum SyncOutcome {
        INDEXED,
        UNCHANGED,
        MISSING,
        NOT_INDEXABLE
    }

    private final ContentStore contentStore;
    private final VectorIndexStore indexStore;
    private final IndexedSourceRepository sourceRepository;
    private final ContentHashService hashService;
    private final ProjectLockRegistry locks;
    private final IndexProperties properties;
    private final IndexHealthIndicator healthIndicator;

    public ContentSyncManager(ContentStore contentStore,
                              VectorIndexStore indexStore,
                              IndexedSourceRepository sourceRepository,
                              ContentHashService hashService,
                              ProjectLockRegistry locks,
                              IndexProperties properties,
                              IndexHealthIndicator healthIndicator) {
        this.contentStore = contentStore;
        this.indexStore = indexStore;
        this.sourceRepository = sourceRepository;
        this.hashService = hashService;
        this.locks = locks;
        this.properties = properties;
        this.healthIndicator = healthIndicator;
    }

    @EventListener
    public void onContentChanged(ContentChangedEvent event) {
        log.debug("Content {} for {}/{}", event.changeType(), event.projectId(), event.relativePath());
        try {
            switch (event.changeType()) {
                case CREATED, UPDATED -> indexFile(event.projectId(), event.relativePath());
                case DELETED -> removeFile(event.projectId(), event.relativePath());
            }
        } catch (CodexException e) {
            // The next rebuild picks the document up again
            log.error("Failed to sync {}/{} after {}: {}", event.projectId(), event.relativePath(),
                    event.changeType(), e.getMessage(), e);
        }
    }

    /**
     * Indexes one document of a project, replacing whatever the index held for it.
     * A document that no longer exists is removed from the index instead.
     */
    public SyncOutcome indexFile(String projectId, String relativePath) {
        Optional<IndexableFile> file = contentStore.describe(projectId, relativePath);
        if (file.isEmpty()) {
            log.debug("Ignoring non-indexable path {}/{}", projectId, relativePath);
            return SyncOutcome.NOT_INDEXABLE;
        }
        return locks.withWriteLock(projectId, () -> {
            SyncOutcome outcome = processFile(projectId, file.get(), properties.isIncremental());
            if (outcome == SyncOutcome.MISSING) {
                removeUnlocked(SourcePaths.of(projectId, relativePath));
            }
            return outcome;
        });
    }

    /**
     * Removes one document from the index. Removing an unindexed document is a no-op.
     *
     * @return true if the index held chunks for the document
     */
    public boolean removeFile(String projectId, String relativePath) {
        String sourcePath = SourcePaths.of(projectId, relativePath);
        return locks.withWriteLock(projectId, () -> removeUnlocked(sourcePath));
    }

    /**
     * Drops every chunk of the project and indexes all of its documents again.
     *
     * Documents that vanish or keep failing are skipped with a warning; a failure to
     * clear the project's chunks ends the rebuild with {@code success=false}.
     *
     * @throws NotFoundException if the project does not exist
     */
    public RebuildResult rebuild(String projectId) {
        if (!contentStore.projectExists(projectId)) {
            throw NotFoundException.project(projectId);
        }
        log.info("Rebuilding index for project {}", projectId);
        long startTime = System.currentTimeMillis();

        RebuildResult result = locks.withWriteLock(projectId, () -> {
            List<IndexableFile> files = contentStore.listIndexable(projectId);

            int deleted;
            try {
                deleted = indexStore.deleteProject(projectId);
                ledger("clear of project " + projectId, () -> sourceRepository.deleteByProjectId(projectId));
            } catch (IndexBackendException e) {
                log.error("Rebuild of project {} failed while clearing the index: {}", projectId, e.getMessage(), e);
                return new RebuildResult(false, "Failed to clear index: " + e.getMessage(), 0, 0, 0);
            }

            int indexed = 0;
            int skipped = 0;
            for (IndexableFile file : files) {
                if (indexWithRetry(projectId, file)) {
                    indexed++;
                } else {
                    skipped++;
                }
            }

            String message = "Rebuilt index for project " + projectId + ": " + indexed + " indexed, "
                    + deleted + " deleted" + (skipped > 0 ? ", " + skipped + " skipped" : "");
            return new RebuildResult(true, message, deleted, indexed, skipped);
        });

        if (result.success()) {
            log.info("{} in {}ms", result.message(), System.currentTimeMillis() - startTime);
            healthIndicator.markHealthy(projectId, result);
        } else {
            healthIndicator.markUnhealthy(projectId, result.message());
        }
        return result;
    }

    /**
     * Ledger statistics for a project.
     *
     * @throws NotFoundException if the project does not exist
     */
    public IndexStats stats(String projectId) {
        if (!contentStore.projectExists(projectId)) {
            throw NotFoundException.project(projectId);
        }
        return ledger("stats of project " + projectId, () -> {
            List<IndexStats.IndexedDocument> sources = sourceRepository.findByProjectIdOrderBySourcePath(projectId)
                    .stream()
                    .map(source -> new IndexStats.IndexedDocument(source.getSourcePath(), source.getContentHash(),
                            source.getChunkCount() == null ? 0 : source.getChunkCount(), source.getIndexedAt()))
                    .toList();
            return new IndexStats(projectId, sources.size(), sourceRepository.sumChunkCountByProjectId(projectId),
                    sources);
        });
    }

    private boolean indexWithRetry(String projectId, IndexableFile file) {
        String sourcePath = SourcePaths.of(projectId, file.relativePath());
        for (int attempt = 1; attempt <= 2; attempt++) {
            try {
                SyncOutcome outcome = processFile(projectId, file, false);
                if (outcome == SyncOutcome.MISSING) {
                    log.warn("Skipping {}: file vanished before it could be indexed", sourcePath);
                    return false;
                }
                return true;
            } catch (IndexBackendException e) {
                if (attempt == 1) {
                    log.warn("Indexing {} failed, retrying once: {}", sourcePath, e.getMessage());
                } else {
                    log.warn("Skipping {} after retry: {}", sourcePath, e.getMessage());
                }
            }
        }
        return false;
    }

    /**
     * Reads, hashes and upserts one document. Caller holds the project's write lock.
     */
    private SyncOutcome processFile(String projectId, IndexableFile file, boolean skipUnchanged) {
        String sourcePath = SourcePaths.of(projectId, file.relativePath());
        Optional<String> content = contentStore.read(projectId, file.relativePath());
        if (content.isEmpty()) {
            return SyncOutcome.MISSING;
        }

        String contentHash = hashService.computeHash(content.get());
        if (skipUnchanged && ledger("lookup of " + sourcePath,
                () -> sourceRepository.existsBySourcePathAndContentHash(sourcePath, contentHash))) {
            log.debug("Skipping unchanged document: {}", sourcePath);
            return SyncOutcome.UNCHANGED;
        }

        int chunkCount = indexStore.upsert(sourcePath, projectId, file.metadata(), content.get());

        ledger("update of " + sourcePath, () -> {
            IndexedSource source = sourceRepository.findBySourcePath(sourcePath)
                    .orElseGet(() -> new IndexedSource(projectId, sourcePath, contentHash, chunkCount));
            source.setContentHash(contentHash);
            source.setChunkCount(chunkCount);
            return sourceRepository.save(source);
        });

        log.info("Indexed {} chunks from {}", chunkCount, sourcePath);
        return SyncOutcome.INDEXED;
    }

    private boolean removeUnlocked(String sourcePath) {
        boolean removed = indexStore.delete(sourcePath);
        ledger("delete of " + sourcePath, () -> sourceRepository.deleteBySourcePath(sourcePath));
        if (removed) {
            log.info("Removed {} from the index", sourcePath);
        }
        return removed;
    }

    private static <T> T ledger(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new IndexBackendException("Index ledger " + operation + " failed: " + e.getMessage(), e);
        }
    }
}
