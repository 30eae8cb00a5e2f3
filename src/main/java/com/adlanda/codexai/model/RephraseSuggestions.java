package com.adlanda.codexai.model;

import java.util.List;

/**
 * Alternative phrasings, in the order the model gave them.
 */
public record RephraseSuggestions(List<String> suggestions) implements GenerationResult {
    public RephraseSuggestions {
        suggestions = List.copyOf(suggestions);
    }
}
