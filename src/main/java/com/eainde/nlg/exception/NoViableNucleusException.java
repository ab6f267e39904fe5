package com.eainde.nlg.exception;

/** The document planner could not pick even a single nucleus. */
public class NoViableNucleusException extends NlgException {

    public NoViableNucleusException(String message) {
        super(message);
    }
}
