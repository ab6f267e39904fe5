package com.eainde.nlg.model;

import java.io.Serializable;

/** A piece of a template: either a {@link Literal} or a {@link Slot}. */
public interface TemplateComponent extends Serializable {

    /** Field name behind the component, {@code "Literal"} for plain literals. */
    String slotType();

    /** Current display text. */
    String value();

    TemplateComponent copy();
}
