package com.adlanda.codexai.model;

/**
 * Kind of project document a chunk was indexed from.
 */
public enum EntityType {
    PLAN,
    SYNOPSIS,
    WORLD,
    SCENE,
    CHARACTER
}
