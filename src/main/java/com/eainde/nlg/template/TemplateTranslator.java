package com.eainde.nlg.template;

import com.eainde.nlg.model.Template;

import java.util.Optional;

/**
 * Produces a template for a language nobody has written templates for.
 */
public interface TemplateTranslator {

    /** Translator used when no translation model is configured. */
    TemplateTranslator NONE = (template, sourceLanguage, targetLanguage) -> Optional.empty();

    /**
     * @return the translated template with the same slots and rules, or empty if the translation
     * could not be used
     */
    Optional<Template> translate(Template template, String sourceLanguage, String targetLanguage);
}
