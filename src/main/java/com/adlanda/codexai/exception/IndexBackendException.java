package com.adlanda.codexai.exception;

/**
 * Embedding or vector store fault.
 */
public class IndexBackendException extends CodexException {

    public IndexBackendException(String message) {
        super(message);
    }

    public IndexBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
