package com.eainde.nlg.template;

import com.eainde.nlg.model.Template;
import com.eainde.nlg.resource.DatasetResource;
import com.eainde.nlg.resource.Languages;
import com.eainde.nlg.resource.LexiconLoader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Templates of every dataset, by language ({@code en}, {@code en-head}, ...).
 *
 * <p>Templates read from the resources are fixed at startup. A language without templates gets
 * machine translations of the English ones on first use, if a translator is configured.</p>
 */
@Slf4j
@Component
public class TemplateRepository {

    static final String SOURCE_LANGUAGE = "en";

    private final Map<String, List<Template>> written = new ConcurrentHashMap<>();
    private final Map<String, List<Template>> translated = new ConcurrentHashMap<>();
    private final TemplateTranslator translator;

    @Autowired
    public TemplateRepository(List<DatasetResource> resources, LexiconLoader loader, TemplateTranslator translator) {
        this.translator = translator;
        for (DatasetResource resource : resources) {
            TemplateReader reader = new TemplateReader();
            Map<String, List<Template>> templates = reader.read(loader.readText(resource.templateLocation()));
            templates.forEach(this::add);
            log.info("Read templates of {} for languages {}", resource.dataset(), templates.keySet());
        }
    }

    public TemplateRepository(Map<String, List<Template>> templates, TemplateTranslator translator) {
        this.translator = translator;
        templates.forEach(this::add);
    }

    private void add(String language, List<Template> templates) {
        written.computeIfAbsent(language, l -> new ArrayList<>()).addAll(templates);
    }

    // ===== Public API =====

    /**
     * Blueprint templates for a language. Callers must {@link Template#copy()} before filling.
     *
     * @return the templates, possibly translated, or an empty list
     */
    public List<Template> getTemplates(String language) {
        List<Template> templates = written.get(language);
        if (templates != null) {
            return Collections.unmodifiableList(templates);
        }
        return translated.computeIfAbsent(language, this::translate);
    }

    /** Base languages templates were written for. */
    public Set<String> languages() {
        Set<String> languages = new TreeSet<>();
        written.keySet().forEach(language -> languages.add(Languages.base(language)));
        return languages;
    }

    // ===== Internals =====

    private List<Template> translate(String language) {
        String source = Languages.isHeadline(language) ? Languages.headline(SOURCE_LANGUAGE) : SOURCE_LANGUAGE;
        List<Template> originals = written.getOrDefault(source, List.of());
        if (originals.isEmpty() || translator == TemplateTranslator.NONE) {
            log.warn("No templates for language {}", language);
            return List.of();
        }
        log.info("Translating {} templates from {} to {}", originals.size(), source, language);
        List<Template> result = new ArrayList<>();
        for (Template template : originals) {
            Optional<Template> translation = translator.translate(template, source, Languages.base(language));
            translation.ifPresent(result::add);
        }
        log.info("{} of {} templates translated to {}", result.size(), originals.size(), language);
        return List.copyOf(result);
    }
}
