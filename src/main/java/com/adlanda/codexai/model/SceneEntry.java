package com.adlanda.codexai.model;

/**
 * A scene of a chapter as listed in the chapter metadata.
 */
public record SceneEntry(String id, String title, int order, String relativePath) {}
