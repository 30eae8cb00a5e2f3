package com.adlanda.codexai.service;

import com.adlanda.codexai.content.ContentStore;
import com.adlanda.codexai.content.SourcePaths;
import com.adlanda.codexai.exception.NotFoundException;
import com.adlanda.codexai.model.CharacterEntry;
import com.adlanda.codexai.model.LoadedContext;
import com.adlanda.codexai.model.SceneEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Loads the explicit context placed into a prompt.
 *
 * Missing or blank documents are left out; only the paths of documents that made it
 * into the context end up in {@link LoadedContext#filterPaths()}.
 */
@Service
public class ContextAssembler {

    private static final Logger log = LoggerFactory.getLogger(ContextAssembler.class);

    static final String PLAN_PATH = "plan.md";
    static final String SYNOPSIS_PATH = "synopsis.md";

    private final ContentStore contentStore;

    public ContextAssembler(ContentStore contentStore) {
        this.contentStore = contentStore;
    }

    /**
     * Project-level context: plan and synopsis.
     *
     * @throws NotFoundException if the project does not exist
     */
    public LoadedContext load(String projectId) {
        return load(projectId, null, 0, null);
    }

    /**
     * Chapter-level context: plan, synopsis, the last {@code previousSceneCount} scenes of
     * the chapter and the profiles of characters named in those scenes or in {@code focusText}.
     *
     * <p>A missing chapter simply contributes no scenes; callers that require the chapter
     * check {@link ContentStore#chapterExists} themselves.</p>
     *
     * @throws NotFoundException if the project does not exist
     */
    public LoadedContext load(String projectId, String chapterId, int previousSceneCount, String focusText) {
        if (!contentStore.projectExists(projectId)) {
            throw NotFoundException.project(projectId);
        }
        Set<String> filterPaths = new LinkedHashSet<>();

        String plan = readIncluded(projectId, PLAN_PATH, filterPaths).orElse("");
        String synopsis = readIncluded(projectId, SYNOPSIS_PATH, filterPaths).orElse("");

        List<String> previousScenes = new ArrayList<>();
        List<String> characterProfiles = new ArrayList<>();

        if (chapterId != null) {
            for (SceneEntry scene : lastScenes(projectId, chapterId, previousSceneCount)) {
                readIncluded(projectId, scene.relativePath(), filterPaths).ifPresent(previousScenes::add);
            }

            String mentionText = String.join("\n", previousScenes) + "\n" + (focusText == null ? "" : focusText);
            for (CharacterEntry character : contentStore.listCharacters(projectId)) {
                if (!mentions(mentionText, character.name())) {
                    continue;
                }
                readIncluded(projectId, character.relativePath(), filterPaths)
                        .ifPresent(profile -> characterProfiles.add(character.name() + ":\n" + profile));
            }
        }

        log.debug("Loaded context for project {} (chapter {}): {} scenes, {} characters, {} filter paths",
                projectId, chapterId, previousScenes.size(), characterProfiles.size(), filterPaths.size());
        return new LoadedContext(plan, synopsis, previousScenes, characterProfiles, filterPaths);
    }

    private List<SceneEntry> lastScenes(String projectId, String chapterId, int count) {
        if (count <= 0) {
            return List.of();
        }
        List<SceneEntry> scenes = contentStore.listScenes(projectId, chapterId);
        return scenes.subList(Math.max(0, scenes.size() - count), scenes.size());
    }

    /**
     * Reads a document and records its source path when it has content.
     */
    private Optional<String> readIncluded(String projectId, String relativePath, Set<String> filterPaths) {
        Optional<String> text = contentStore.read(projectId, relativePath)
                .map(String::trim)
                .filter(content -> !content.isEmpty());
        text.ifPresent(content -> filterPaths.add(SourcePaths.of(projectId, relativePath)));
        return text;
    }

    static boolean mentions(String text, String name) {
        if (name == null || name.isBlank()) {
            return false;
        }
        Pattern pattern = Pattern.compile("(?<![\\p{L}\\p{N}])" + Pattern.quote(name.trim()) + "(?![\\p{L}\\p{N}])",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        return pattern.matcher(text).find();
    }
}
