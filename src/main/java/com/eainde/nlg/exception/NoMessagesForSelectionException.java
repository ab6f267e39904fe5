package com.eainde.nlg.exception;

/** Fact extraction produced nothing for the requested location. */
public class NoMessagesForSelectionException extends NlgException {

    public NoMessagesForSelectionException(String message) {
        super(message);
    }
}
