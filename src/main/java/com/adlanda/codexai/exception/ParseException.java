package com.adlanda.codexai.exception;

/**
 * A structured result could not be extracted from the model reply.
 */
public class ParseException extends CodexException {

    public ParseException(String message) {
        super(message);
    }
}
