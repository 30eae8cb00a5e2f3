package com.adlanda.codexai.service;

import com.adlanda.codexai.config.IndexProperties;
import com.adlanda.codexai.content.ContentChangedEvent;
import com.adlanda.codexai.content.ContentStore;
import com.adlanda.codexai.entity.IndexedSource;
import com.adlanda.codexai.exception.IndexBackendException;
import com.adlanda.codexai.exception.NotFoundException;
import com.adlanda.codexai.exception.ParseException;
import com.adlanda.codexai.health.IndexHealthIndicator;
import com.adlanda.codexai.model.ChunkMetadata;
import com.adlanda.codexai.model.EntityType;
import com.adlanda.codexai.model.IndexableFile;
import com.adlanda.codexai.model.RebuildResult;
import com.adlanda.codexai.repository.IndexedSourceRepository;
import com.adlanda.codexai.repository.VectorIndexStore;
import com.adlanda.codexai.service.ContentSyncManager.SyncOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Status;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ContentSyncManager.
 * Tests rebuild accounting, retries, vanished files and incremental skipping.
 */
@ExtendWith(MockitoExtension.class)
class ContentSyncManagerTest {

    private static final IndexableFile PLAN = new IndexableFile("plan.md", ChunkMetadata.of(EntityType.PLAN));
    private static final IndexableFile SYNOPSIS = new IndexableFile("synopsis.md", ChunkMetadata.of(EntityType.SYNOPSIS));
    private static final IndexableFile SCENE = new IndexableFile("chapters/c1/s1.md", ChunkMetadata.of(EntityType.SCENE));

    @Mock
    private ContentStore contentStore;

    @Mock
    private VectorIndexStore indexStore;

    @Mock
    private IndexedSourceRepository sourceRepository;

    private ContentHashService hashService;
    private ProjectLockRegistry locks;
    private IndexProperties properties;
    private IndexHealthIndicator healthIndicator;
    private ContentSyncManager syncManager;

    @BeforeEach
    void setUp() {
        hashService = new ContentHashService();
        locks = new ProjectLockRegistry();
        properties = new IndexProperties();
        healthIndicator = new IndexHealthIndicator();
        syncManager = new ContentSyncManager(contentStore, indexStore, sourceRepository, hashService,
                locks, properties, healthIndicator);
    }

    @Test
    void rebuild_emptyIndex_indexesEveryFile() {
        givenProject(PLAN, SYNOPSIS, SCENE);
        when(indexStore.deleteProject("p1")).thenReturn(0);
        when(indexStore.upsert(anyString(), eq("p1"), any(), anyString())).thenReturn(1);

        RebuildResult result = syncManager.rebuild("p1");

        assertThat(result.success()).isTrue();
        assertThat(result.documentsDeleted()).isZero();
        assertThat(result.documentsIndexed()).isEqualTo(3);
        assertThat(result.documentsSkipped()).isZero();
        verify(indexStore).upsert("p1/plan.md", "p1", PLAN.metadata(), "text of plan.md");
        verify(indexStore).upsert("p1/chapters/c1/s1.md", "p1", SCENE.metadata(), "text of chapters/c1/s1.md");
        verify(sourceRepository).deleteByProjectId("p1");
        assertThat(healthIndicator.health().getStatus()).isEqualTo(Status.UP);
    }

    @Test
    void rebuild_reportsDeletedDocuments() {
        givenProject(PLAN);
        when(indexStore.deleteProject("p1")).thenReturn(5);

        RebuildResult result = syncManager.rebuild("p1");

        assertThat(result.documentsDeleted()).isEqualTo(5);
        assertThat(result.documentsIndexed()).isEqualTo(1);
    }

    @Test
    void rebuild_vanishedFile_isSkippedAndRebuildContinues() {
        when(contentStore.projectExists("p1")).thenReturn(true);
        when(contentStore.listIndexable("p1")).thenReturn(List.of(PLAN, SCENE));
        when(contentStore.read("p1", "plan.md")).thenReturn(Optional.empty());
        when(contentStore.read("p1", "chapters/c1/s1.md")).thenReturn(Optional.of("Detective enters room."));

        RebuildResult result = syncManager.rebuild("p1");

        assertThat(result.success()).isTrue();
        assertThat(result.documentsIndexed()).isEqualTo(1);
        assertThat(result.documentsSkipped()).isEqualTo(1);
        verify(indexStore, never()).upsert(eq("p1/plan.md"), any(), any(), any());
    }

    @Test
    void rebuild_transientBackendFault_isRetriedOnce() {
        givenProject(PLAN);
        when(indexStore.upsert(anyString(), anyString(), any(), anyString()))
                .thenThrow(new IndexBackendException("timeout"))
                .thenReturn(1);

        RebuildResult result = syncManager.rebuild("p1");

        assertThat(result.documentsIndexed()).isEqualTo(1);
        assertThat(result.documentsSkipped()).isZero();
        verify(indexStore, times(2)).upsert(anyString(), anyString(), any(), anyString());
    }

    @Test
    void rebuild_persistentBackendFault_skipsFileAfterOneRetry() {
        givenProject(PLAN, SYNOPSIS);
        when(indexStore.upsert(eq("p1/plan.md"), anyString(), any(), anyString()))
                .thenThrow(new IndexBackendException("still down"));
        when(indexStore.upsert(eq("p1/synopsis.md"), anyString(), any(), anyString())).thenReturn(1);

        RebuildResult result = syncManager.rebuild("p1");

        assertThat(result.success()).isTrue();
        assertThat(result.documentsIndexed()).isEqualTo(1);
        assertThat(result.documentsSkipped()).isEqualTo(1);
        verify(indexStore, times(2)).upsert(eq("p1/plan.md"), anyString(), any(), anyString());
    }

    @Test
    void rebuild_missingProject_throwsNotFound() {
        when(contentStore.projectExists("missing")).thenReturn(false);

        assertThatThrownBy(() -> syncManager.rebuild("missing")).isInstanceOf(NotFoundException.class);
        verifyNoInteractions(indexStore);
    }

    @Test
    void rebuild_clearFailure_returnsUnsuccessfulResult() {
        when(contentStore.projectExists("p1")).thenReturn(true);
        when(contentStore.listIndexable("p1")).thenReturn(List.of(PLAN));
        when(indexStore.deleteProject("p1")).thenThrow(new IndexBackendException("database down"));

        RebuildResult result = syncManager.rebuild("p1");

        assertThat(result.success()).isFalse();
        assertThat(result.message()).contains("database down");
        verify(indexStore, never()).upsert(any(), any(), any(), any());
        assertThat(healthIndicator.health().getStatus()).isEqualTo(Status.DOWN);
    }

    @Test
    void rebuild_holdsProjectWriteLockWhileIndexing() {
        givenProject(PLAN);
        when(indexStore.upsert(anyString(), anyString(), any(), anyString())).thenAnswer(invocation -> {
            assertThat(locks.isWriteLocked("p1")).isTrue();
            return 1;
        });

        syncManager.rebuild("p1");

        assertThat(locks.isWriteLocked("p1")).isFalse();
    }

    @Test
    void indexFile_unchangedContent_skipsUpsert() {
        when(contentStore.describe("p1", "plan.md")).thenReturn(Optional.of(PLAN));
        when(contentStore.read("p1", "plan.md")).thenReturn(Optional.of("Write mystery"));
        when(sourceRepository.existsBySourcePathAndContentHash("p1/plan.md", hashService.computeHash("Write mystery")))
                .thenReturn(true);

        SyncOutcome outcome = syncManager.indexFile("p1", "plan.md");

        assertThat(outcome).isEqualTo(SyncOutcome.UNCHANGED);
        verify(indexStore, never()).upsert(any(), any(), any(), any());
    }

    @Test
    void indexFile_changedContent_upsertsAndUpdatesLedger() {
        IndexedSource existing = new IndexedSource("p1", "p1/plan.md", "old-hash", 2);
        when(contentStore.describe("p1", "plan.md")).thenReturn(Optional.of(PLAN));
        when(contentStore.read("p1", "plan.md")).thenReturn(Optional.of("Write thriller"));
        when(sourceRepository.existsBySourcePathAndContentHash(eq("p1/plan.md"), anyString())).thenReturn(false);
        when(sourceRepository.findBySourcePath("p1/plan.md")).thenReturn(Optional.of(existing));
        when(indexStore.upsert("p1/plan.md", "p1", PLAN.metadata(), "Write thriller")).thenReturn(1);

        SyncOutcome outcome = syncManager.indexFile("p1", "plan.md");

        assertThat(outcome).isEqualTo(SyncOutcome.INDEXED);
        ArgumentCaptor<IndexedSource> captor = ArgumentCaptor.forClass(IndexedSource.class);
        verify(sourceRepository).save(captor.capture());
        assertThat(captor.getValue().getContentHash()).isEqualTo(hashService.computeHash("Write thriller"));
        assertThat(captor.getValue().getChunkCount()).isEqualTo(1);
    }

    @Test
    void indexFile_nonIncremental_alwaysUpserts() {
        properties.setIncremental(false);
        when(contentStore.describe("p1", "plan.md")).thenReturn(Optional.of(PLAN));
        when(contentStore.read("p1", "plan.md")).thenReturn(Optional.of("Write mystery"));

        syncManager.indexFile("p1", "plan.md");

        verify(sourceRepository, never()).existsBySourcePathAndContentHash(any(), any());
        verify(indexStore).upsert("p1/plan.md", "p1", PLAN.metadata(), "Write mystery");
    }

    @Test
    void indexFile_missingFile_removesItFromIndex() {
        when(contentStore.describe("p1", "plan.md")).thenReturn(Optional.of(PLAN));
        when(contentStore.read("p1", "plan.md")).thenReturn(Optional.empty());

        SyncOutcome outcome = syncManager.indexFile("p1", "plan.md");

        assertThat(outcome).isEqualTo(SyncOutcome.MISSING);
        verify(indexStore).delete("p1/plan.md");
        verify(sourceRepository).deleteBySourcePath("p1/plan.md");
    }

    @Test
    void indexFile_nonIndexablePath_isIgnored() {
        when(contentStore.describe("p1", "notes.txt")).thenReturn(Optional.empty());

        assertThat(syncManager.indexFile("p1", "notes.txt")).isEqualTo(SyncOutcome.NOT_INDEXABLE);
        verifyNoInteractions(indexStore);
    }

    @Test
    void onContentChanged_updated_indexesFile() {
        when(contentStore.describe("p1", "chapters/c1/s1.md")).thenReturn(Optional.of(SCENE));
        when(contentStore.read("p1", "chapters/c1/s1.md")).thenReturn(Optional.of("Detective enters room."));

        syncManager.onContentChanged(ContentChangedEvent.updated("p1", "chapters/c1/s1.md"));

        verify(indexStore).upsert("p1/chapters/c1/s1.md", "p1", SCENE.metadata(), "Detective enters room.");
    }

    @Test
    void onContentChanged_deleted_removesPath() {
        when(indexStore.delete("p1/chapters/c1/s1.md")).thenReturn(true);

        syncManager.onContentChanged(ContentChangedEvent.deleted("p1", "chapters/c1/s1.md"));

        verify(indexStore).delete("p1/chapters/c1/s1.md");
        verify(sourceRepository).deleteBySourcePath("p1/chapters/c1/s1.md");
    }

    @Test
    void onContentChanged_backendFailure_doesNotPropagate() {
        when(indexStore.delete(anyString())).thenThrow(new IndexBackendException("down"));

        syncManager.onContentChanged(ContentChangedEvent.deleted("p1", "plan.md"));

        verify(indexStore).delete("p1/plan.md");
    }

    @Test
    void onContentChanged_unreadableFile_doesNotPropagate() {
        when(contentStore.describe("p1", "world.md"))
                .thenReturn(Optional.of(new IndexableFile("world.md", ChunkMetadata.of(EntityType.WORLD))));
        when(contentStore.read("p1", "world.md"))
                .thenThrow(new IndexBackendException("Content store read of p1/world.md failed: denied"));

        syncManager.onContentChanged(ContentChangedEvent.updated("p1", "world.md"));

        verify(indexStore, never()).upsert(anyString(), anyString(), any(), anyString());
    }

    @Test
    void onContentChanged_anyCodexFailure_doesNotPropagate() {
        when(contentStore.describe("p1", "plan.md")).thenReturn(Optional.of(PLAN));
        when(contentStore.read("p1", "plan.md")).thenThrow(new ParseException("unexpected"));

        syncManager.onContentChanged(ContentChangedEvent.updated("p1", "plan.md"));

        verifyNoInteractions(indexStore);
    }

    @Test
    void rebuild_unreadableFile_isSkippedAndRebuildContinues() {
        when(contentStore.projectExists("p1")).thenReturn(true);
        when(contentStore.listIndexable("p1")).thenReturn(List.of(PLAN, SYNOPSIS));
        when(contentStore.read("p1", "plan.md"))
                .thenThrow(new IndexBackendException("Content store read of p1/plan.md failed: denied"));
        when(contentStore.read("p1", "synopsis.md")).thenReturn(Optional.of("A theft."));

        RebuildResult result = syncManager.rebuild("p1");

        assertThat(result.success()).isTrue();
        assertThat(result.documentsIndexed()).isEqualTo(1);
        assertThat(result.documentsSkipped()).isEqualTo(1);
        verify(contentStore, times(2)).read("p1", "plan.md");
    }

    @Test
    void removeFile_pathWithParentSegment_removesCanonicalSourcePath() {
        when(indexStore.delete("p1/plan.md")).thenReturn(true);

        assertThat(syncManager.removeFile("p1", "chapters/../plan.md")).isTrue();

        verify(sourceRepository).deleteBySourcePath("p1/plan.md");
    }

    @Test
    void removeFile_absentPath_isNoOp() {
        assertThat(syncManager.removeFile("p1", "chapters/c1/gone.md")).isFalse();
    }

    private void givenProject(IndexableFile... files) {
        when(contentStore.projectExists("p1")).thenReturn(true);
        when(contentStore.listIndexable("p1")).thenReturn(List.of(files));
        for (IndexableFile file : files) {
            when(contentStore.read("p1", file.relativePath())).thenReturn(Optional.of("text of " + file.relativePath()));
        }
    }
}
