package com.eainde.nlg.exception;

public class SurfaceRealizationException extends NlgException {

    public SurfaceRealizationException(String message) {
        super(message);
    }
}
