package com.eainde.nlg.exception;

/**
 * Base of the unchecked failures raised by the generation pipeline.
 */
public class NlgException extends RuntimeException {

    public NlgException(String message) {
        super(message);
    }

    public NlgException(String message, Throwable cause) {
        super(message, cause);
    }
}
