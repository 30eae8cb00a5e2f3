package com.adlanda.codexai.model;

import java.util.List;
import java.util.Set;

/**
 * Explicit context placed into a prompt, plus the source paths it came from.
 *
 * <p>{@code filterPaths} holds exactly the source paths whose full text is part of this
 * context; retrieval for the same request must exclude them.</p>
 */
public record LoadedContext(
        String projectPlan,
        String projectSynopsis,
        List<String> previousScenes,
        List<String> characterProfiles,
        Set<String> filterPaths
) {
    public LoadedContext {
        projectPlan = projectPlan == null ? "" : projectPlan;
        projectSynopsis = projectSynopsis == null ? "" : projectSynopsis;
        previousScenes = List.copyOf(previousScenes);
        characterProfiles = List.copyOf(characterProfiles);
        filterPaths = Set.copyOf(filterPaths);
    }
}
