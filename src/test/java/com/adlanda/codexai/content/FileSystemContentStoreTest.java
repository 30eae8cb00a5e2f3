package com.adlanda.codexai.content;

import com.adlanda.codexai.ProjectFixtures;
import com.adlanda.codexai.config.ContentProperties;
import com.adlanda.codexai.exception.IndexBackendException;
import com.adlanda.codexai.model.EntityType;
import com.adlanda.codexai.model.IndexableFile;
import com.adlanda.codexai.model.SceneEntry;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Unit tests for FileSystemContentStore.
 * Tests the project layout, scene ordering and path safety.
 */
class FileSystemContentStoreTest {

    @TempDir
    Path tempDir;

    private FileSystemContentStore store;

    @BeforeEach
    void setUp() {
        ContentProperties properties = new ContentProperties();
        properties.setBaseDir(tempDir.toString());
        store = new FileSystemContentStore(properties, new ObjectMapper());

        ProjectFixtures.project(tempDir, "p1")
                .file("plan.md", "Write mystery")
                .file("synopsis.md", "A detective solves a theft")
                .file("notes.txt", "not indexed")
                .file("project_meta.json", """
                    {"characters": {"char-1": {"name": "Inspector Lane"}}}
                    """)
                .file("characters/char-1.md", "Sharp-eyed and patient.")
                .file("chapters/c1/chapter_meta.json", """
                    {"scenes": {"s-b": {"title": "Second", "order": 2}, "s-a": {"title": "First", "order": 1}}}
                    """)
                .file("chapters/c1/s-a.md", "Detective enters room.")
                .file("chapters/c1/s-b.md", "A glove on the floor.");
    }

    @Test
    void projectExists_and_chapterExists() {
        assertThat(store.projectExists("p1")).isTrue();
        assertThat(store.projectExists("missing")).isFalse();
        assertThat(store.chapterExists("p1", "c1")).isTrue();
        assertThat(store.chapterExists("p1", "c9")).isFalse();
        assertThat(store.chapterExists("missing", "c1")).isFalse();
    }

    @Test
    void read_existingFile_returnsContent() {
        assertThat(store.read("p1", "plan.md")).contains("Write mystery");
    }

    @Test
    void read_missingFile_returnsEmpty() {
        assertThat(store.read("p1", "world.md")).isEmpty();
    }

    @Test
    void read_invalidUtf8_replacesMalformedBytes() {
        byte[] latin1 = "Caf\u00e9 noir".getBytes(StandardCharsets.ISO_8859_1);
        ProjectFixtures.project(tempDir, "p1").bytes("world.md", latin1);

        assertThat(store.read("p1", "world.md")).hasValueSatisfying(text -> {
            assertThat(text).startsWith("Caf").endsWith(" noir");
            assertThat(text).contains("\uFFFD");
        });
    }

    @Test
    void read_unreadableFile_throwsIndexBackendException() throws Exception {
        Path file = tempDir.resolve("p1").resolve("world.md");
        Files.writeString(file, "text");
        // Permissions do not apply to every user or file system
        assumeTrue(file.toFile().setReadable(false) && !Files.isReadable(file));

        assertThatThrownBy(() -> store.read("p1", "world.md"))
                .isInstanceOf(IndexBackendException.class)
                .hasMessageContaining("p1/world.md");
    }

    @Test
    void read_pathOutsideProject_returnsEmpty() {
        ProjectFixtures.project(tempDir, "other").file("plan.md", "secret");

        assertThat(store.read("p1", "../other/plan.md")).isEmpty();
        assertThat(store.read("../other", "plan.md")).isEmpty();
    }

    @Test
    void listIndexable_returnsBlocksScenesAndCharacters() {
        List<IndexableFile> files = store.listIndexable("p1");

        assertThat(files).extracting(IndexableFile::relativePath).containsExactly(
                "plan.md", "synopsis.md", "chapters/c1/s-a.md", "chapters/c1/s-b.md", "characters/char-1.md");
        IndexableFile character = files.get(4);
        assertThat(character.metadata().entityType()).isEqualTo(EntityType.CHARACTER);
        assertThat(character.metadata().characterName()).isEqualTo("Inspector Lane");
    }

    @Test
    void listIndexable_missingProject_returnsEmpty() {
        assertThat(store.listIndexable("missing")).isEmpty();
    }

    @Test
    void describe_classifiesPaths() {
        assertThat(store.describe("p1", "synopsis.md")).get()
                .extracting(file -> file.metadata().entityType()).isEqualTo(EntityType.SYNOPSIS);
        assertThat(store.describe("p1", "chapters/c1/s-a.md")).get()
                .extracting(file -> file.metadata().entityType()).isEqualTo(EntityType.SCENE);
        assertThat(store.describe("p1", "notes.txt")).isEmpty();
        assertThat(store.describe("p1", "chapters/c1/chapter_meta.json")).isEmpty();
    }

    @Test
    void describe_parentSegments_resolveToCanonicalPath() {
        assertThat(store.describe("p1", "chapters/../plan.md")).get()
                .satisfies(file -> {
                    assertThat(file.relativePath()).isEqualTo("plan.md");
                    assertThat(file.metadata().entityType()).isEqualTo(EntityType.PLAN);
                });
        assertThat(store.describe("p1", "chapters/c1/../../characters/char-1.md")).get()
                .extracting(IndexableFile::relativePath).isEqualTo("characters/char-1.md");
        assertThat(store.describe("p1", "../plan.md")).isEmpty();
        assertThat(store.read("p1", "chapters/../plan.md")).contains("Write mystery");
    }

    @Test
    void listScenes_ordersByMetadataOrder() {
        List<SceneEntry> scenes = store.listScenes("p1", "c1");

        assertThat(scenes).extracting(SceneEntry::id).containsExactly("s-a", "s-b");
        assertThat(scenes.get(0).title()).isEqualTo("First");
        assertThat(scenes.get(0).relativePath()).isEqualTo("chapters/c1/s-a.md");
    }

    @Test
    void listScenes_withoutMetadata_usesFileNameOrder() {
        ProjectFixtures.project(tempDir, "p2")
                .file("chapters/c1/02-later.md", "Later.")
                .file("chapters/c1/01-early.md", "Early.");

        assertThat(store.listScenes("p2", "c1")).extracting(SceneEntry::id).containsExactly("01-early", "02-later");
    }

    @Test
    void listCharacters_usesNamesFromProjectMetadata() {
        assertThat(store.listCharacters("p1"))
                .singleElement()
                .satisfies(character -> {
                    assertThat(character.id()).isEqualTo("char-1");
                    assertThat(character.name()).isEqualTo("Inspector Lane");
                });
    }

    @Test
    void listProjects_returnsProjectDirectories() {
        ProjectFixtures.project(tempDir, "p0");

        assertThat(store.listProjects()).containsExactly("p0", "p1");
    }
}
