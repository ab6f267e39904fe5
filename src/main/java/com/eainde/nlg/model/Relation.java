package com.eainde.nlg.model;

/** How the children of a {@link DocumentPlanNode} relate to each other. */
public enum Relation {
    ELABORATION,
    EXEMPLIFICATION,
    CONTRAST,
    SEQUENCE,
    LIST
}
