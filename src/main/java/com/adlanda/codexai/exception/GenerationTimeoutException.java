package com.adlanda.codexai.exception;

import java.time.Duration;

/**
 * Language model did not answer within the configured timeout.
 */
public class GenerationTimeoutException extends GenerationException {

    private final Duration timeout;

    public GenerationTimeoutException(String operation, Duration timeout, Throwable cause) {
        super("Language model call for " + operation + " timed out after " + timeout.toSeconds() + "s", cause);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
