package com.eainde.nlg.exception;

/**
 * No registered template can express a planned message. This is a gap in the template set and is
 * never recovered from.
 */
public class NoTemplateForMessageException extends NlgException {

    public NoTemplateForMessageException(String message) {
        super(message);
    }
}
