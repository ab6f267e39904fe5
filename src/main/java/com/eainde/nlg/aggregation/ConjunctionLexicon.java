package com.eainde.nlg.aggregation;

import com.eainde.nlg.resource.Languages;
import com.eainde.nlg.resource.LexiconLoader;
import com.fasterxml.jackson.core.type.TypeReference;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * Conjunctions per language, e.g. {@code default_combiner} ("and") and {@code inverse_combiner} ("but").
 */
@Component
public class ConjunctionLexicon {

    public static final String DEFAULT_COMBINER = "default_combiner";
    public static final String INVERSE_COMBINER = "inverse_combiner";

    private static final String LOCATION = "lexicon/conjunctions.json";

    private final Map<String, Map<String, String>> conjunctions;

    @Autowired
    public ConjunctionLexicon(LexiconLoader loader) {
        this(loader.readJson(LOCATION, new TypeReference<Map<String, Map<String, String>>>() {
        }));
    }

    public ConjunctionLexicon(Map<String, Map<String, String>> conjunctions) {
        this.conjunctions = Map.copyOf(conjunctions);
    }

    /** Looks the key up for the language, then for its base language. */
    public Optional<String> get(String language, String key) {
        Map<String, String> words = conjunctions.get(language);
        if (words == null) {
            words = conjunctions.get(Languages.base(language));
        }
        return words == null ? Optional.empty() : Optional.ofNullable(words.get(key));
    }
}
