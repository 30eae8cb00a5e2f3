package com.adlanda.codexai.content;

import com.adlanda.codexai.model.CharacterEntry;
import com.adlanda.codexai.model.IndexableFile;
import com.adlanda.codexai.model.SceneEntry;

import java.util.List;
import java.util.Optional;

/**
 * Read access to per-project documents (plans, synopses, scenes, characters).
 *
 * Paths are relative to the project directory and use forward slashes.
 */
public interface ContentStore {

    boolean projectExists(String projectId);

    boolean chapterExists(String projectId, String chapterId);

    /**
     * Reads a project document.
     *
     * @return the text, or empty if the file does not exist
     * @throws com.adlanda.codexai.exception.IndexBackendException if the file exists but cannot be read
     */
    Optional<String> read(String projectId, String relativePath);

    /**
     * Lists every document of the project that belongs in the index.
     */
    List<IndexableFile> listIndexable(String projectId);

    /**
     * Classifies a single path, empty if the path is not indexable.
     */
    Optional<IndexableFile> describe(String projectId, String relativePath);

    List<String> listProjects();

    /**
     * Scenes of a chapter ordered by their scene order.
     */
    List<SceneEntry> listScenes(String projectId, String chapterId);

    List<CharacterEntry> listCharacters(String projectId);
}
