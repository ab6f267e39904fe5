package com.eainde.nlg.realize.morphology;

import com.eainde.nlg.model.Slot;

/**
 * Locative only: "Hrvatska" becomes "Hrvatskoj", "Njemačka" "Njemačkoj", "Cipar" "Ciparu".
 */
public class CroatianMorphology implements MorphologyCapability {

    private static final String VOWELS = "aeiou";

    @Override
    public String realize(Slot slot) {
        String text = slot.value();
        if (!"locative".equals(slot.attribute(Slot.CASE)) || text.length() < 2) {
            return text;
        }
        char last = text.charAt(text.length() - 1);
        if (VOWELS.indexOf(last) < 0) {
            return text + "u";
        }
        String stem = text.substring(0, text.length() - 1);
        return text.charAt(text.length() - 2) == 'j' ? stem + "i" : stem + "oj";
    }
}
