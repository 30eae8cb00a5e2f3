package com.adlanda.codexai.exception;

public enum ResourceKind {
    PROJECT,
    CHAPTER,
    FILE
}
