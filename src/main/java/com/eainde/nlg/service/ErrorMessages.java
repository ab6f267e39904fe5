package com.eainde.nlg.service;

import com.eainde.nlg.resource.Languages;
import com.eainde.nlg.resource.LexiconLoader;
import com.fasterxml.jackson.core.type.TypeReference;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Texts shown instead of an article body when generation fails.
 */
@Component
public class ErrorMessages {

    public static final String NO_MESSAGES_FOR_SELECTION = "no-messages-for-selection";
    public static final String GENERAL_ERROR = "general-error";
    public static final String NO_TEMPLATE = "no-template";

    static final String FALLBACK = "Something went wrong. Please try again later";

    private final Map<String, Map<String, String>> messages;

    @Autowired
    public ErrorMessages(LexiconLoader loader) {
        this(loader.readJson("lexicon/errors.json", new TypeReference<Map<String, Map<String, String>>>() {
        }));
    }

    public ErrorMessages(Map<String, Map<String, String>> messages) {
        this.messages = Map.copyOf(messages);
    }

    public String get(String language, String key) {
        return messages.getOrDefault(Languages.base(language), Map.of()).getOrDefault(key, FALLBACK);
    }
}
