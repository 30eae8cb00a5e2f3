package com.adlanda.codexai.model;

import java.util.List;

/**
 * Answer to a project query.
 *
 * @param text    The model's answer
 * @param sources Retrieved chunks used to build the prompt, with their scores
 */
public record Answer(String text, List<SourceAttribution> sources) implements GenerationResult {
    public Answer {
        sources = List.copyOf(sources);
    }
}
