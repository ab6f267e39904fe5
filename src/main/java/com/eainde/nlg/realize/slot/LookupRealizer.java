package com.eainde.nlg.realize.slot;

import com.eainde.nlg.model.Slot;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

/**
 * Replaces a slot whose whole text is a dictionary key, e.g. {@code cp-hi01} with
 * {@code 'food and non-alcoholic beverages'}.
 */
@Slf4j
public class LookupRealizer implements SlotRealizerComponent {

    private final List<String> languages;
    private final Map<String, String> dictionary;
    private final Set<Integer> attachAttributesTo;

    public LookupRealizer(String language, Map<String, String> dictionary) {
        this(List.of(language), dictionary, Set.of());
    }

    public LookupRealizer(List<String> languages, Map<String, String> dictionary, Set<Integer> attachAttributesTo) {
        this.languages = List.copyOf(languages);
        this.dictionary = Map.copyOf(dictionary);
        this.attachAttributesTo = Set.copyOf(attachAttributesTo);
    }

    @Override
    public List<String> supportedLanguages() {
        return languages;
    }

    @Override
    public Optional<List<Slot>> realize(Slot slot, Random random) {
        String realization = dictionary.get(slot.value());
        if (realization == null) {
            return Optional.empty();
        }
        log.trace("Lookup {} -> {}", slot.value(), realization);
        return Optional.of(SlotTokens.split(slot, realization, attachAttributesTo));
    }
}
