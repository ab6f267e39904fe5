package com.eainde.nlg.model;

/** Fixed template text. Template reading splits literals on whitespace, one word per component. */
public record Literal(String value) implements TemplateComponent {

    public static final String SLOT_TYPE = "Literal";

    @Override
    public String slotType() {
        return SLOT_TYPE;
    }

    @Override
    public Literal copy() {
        return new Literal(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
