package com.adlanda.codexai.model;

/**
 * One scene proposed by a chapter split.
 */
public record ProposedScene(String title, String content) {}
