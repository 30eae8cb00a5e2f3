package com.adlanda.codexai.exception;

/**
 * Language model call failed, returned nothing usable, or signalled failure in its reply.
 */
public class GenerationException extends CodexException {

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
