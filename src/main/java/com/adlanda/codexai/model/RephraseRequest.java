package com.adlanda.codexai.model;

import jakarta.validation.constraints.NotNull;

/**
 * Request for alternative phrasings of a text selection.
 */
public record RephraseRequest(
        @NotNull(message = "Selected text is required")
        String selectedText,

        String contextBefore,

        String contextAfter
) implements GenerationRequest {}
