package com.adlanda.codexai.exception;

/**
 * Base class of every failure the core reports to its callers.
 */
public abstract class CodexException extends RuntimeException {

    protected CodexException(String message) {
        super(message);
    }

    protected CodexException(String message, Throwable cause) {
        super(message, cause);
    }
}
