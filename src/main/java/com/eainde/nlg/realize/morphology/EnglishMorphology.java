package com.eainde.nlg.realize.morphology;

import com.eainde.nlg.model.Slot;

/**
 * Possessive "'s" for the genitive. Other cases are left alone.
 */
public class EnglishMorphology implements MorphologyCapability {

    @Override
    public String realize(Slot slot) {
        String text = slot.value();
        if (!"genitive".equals(slot.attribute(Slot.CASE)) || text.isEmpty()) {
            return text;
        }
        return text.endsWith("s") ? text + "'" : text + "'s";
    }
}
