package com.adlanda.codexai.model;

import jakarta.validation.constraints.NotBlank;

/**
 * Question about a project.
 */
public record QueryRequest(
        @NotBlank(message = "Query text is required")
        String text
) implements GenerationRequest {}
