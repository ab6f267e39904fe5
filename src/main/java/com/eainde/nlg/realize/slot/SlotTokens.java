package com.eainde.nlg.realize.slot;

import com.eainde.nlg.model.Slot;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Splits a realization into one slot per whitespace separated token.
 *
 * <p>Every token keeps the fact of the original slot, so later realizers still know where it came
 * from. Attributes survive only on the token indices listed in {@code attachAttributesTo}, or on
 * every token when that is null.</p>
 */
public final class SlotTokens {

    private SlotTokens() {
    }

    public static List<Slot> split(Slot slot, String realization, Collection<Integer> attachAttributesTo,
                                   Map<Integer, Map<String, Object>> addAttributes) {
        List<Slot> tokens = new ArrayList<>();
        String[] words = realization.strip().split("\\s+");
        for (int idx = 0; idx < words.length; idx++) {
            if (words[idx].isEmpty()) {
                continue;
            }
            Slot token = slot.copy(true);
            if (attachAttributesTo != null && !attachAttributesTo.contains(idx)) {
                token.setAttributes(Map.of());
            }
            token.getAttributes().putAll(addAttributes.getOrDefault(idx, Map.of()));
            token.resolve(words[idx]);
            tokens.add(token);
        }
        return tokens;
    }

    public static List<Slot> split(Slot slot, String realization, Collection<Integer> attachAttributesTo) {
        return split(slot, realization, attachAttributesTo, Map.of());
    }
}
