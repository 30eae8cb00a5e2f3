package com.adlanda.codexai.model;

/**
 * A character of a project as listed in the project metadata.
 */
public record CharacterEntry(String id, String name, String relativePath) {}
