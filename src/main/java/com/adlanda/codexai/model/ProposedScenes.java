package com.adlanda.codexai.model;

import java.util.List;

/**
 * Scenes proposed by a chapter split, in chapter order.
 */
public record ProposedScenes(List<ProposedScene> scenes) implements GenerationResult {
    public ProposedScenes {
        scenes = List.copyOf(scenes);
    }
}
