package com.eainde.nlg.realize.morphology;

import com.eainde.nlg.model.Slot;

/**
 * Inflects the text of a slot according to its attributes, usually {@code case}.
 */
@FunctionalInterface
public interface MorphologyCapability {

    /** @return the inflected text, or the slot text unchanged */
    String realize(Slot slot);
}
