package com.eainde.nlg.exception;

public class TemplateReadingException extends NlgException {

    public TemplateReadingException(String message) {
        super(message);
    }

    public TemplateReadingException(String message, Throwable cause) {
        super(message, cause);
    }
}
