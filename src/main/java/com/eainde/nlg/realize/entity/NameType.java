package com.eainde.nlg.realize.entity;

/**
 * Which form of a name to use: the full name on first mention, a short name when returning to an
 * entity mentioned earlier, a pronoun right after the same entity.
 */
public enum NameType {
    FULL("full"),
    SHORT("short"),
    PRONOUN("pronoun");

    private final String attribute;

    NameType(String attribute) {
        this.attribute = attribute;
    }

    /** Value of the {@code name_type} slot attribute. */
    public String attribute() {
        return attribute;
    }
}
