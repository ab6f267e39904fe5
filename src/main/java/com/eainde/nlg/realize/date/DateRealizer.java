package com.eainde.nlg.realize.date;

import com.eainde.nlg.model.DocumentPlanNode;
import com.eainde.nlg.model.Message;
import com.eainde.nlg.model.Slot;
import com.eainde.nlg.model.TemplateComponent;
import com.eainde.nlg.realize.slot.SlotTokens;
import com.eainde.nlg.resource.Languages;
import com.eainde.nlg.resource.LexiconLoader;
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns {@code [TIME:month:2020M03]} and {@code [TIME:year:2020]} slots into words.
 *
 * <p>A time equal to the previously realized one becomes a reference ("the same year"). A month in
 * the same year as the previous time drops the year.</p>
 */
@Slf4j
@Component
public class DateRealizer {

    private static final String LOCATION = "lexicon/dates.json";
    private static final Pattern TIME = Pattern.compile("^\\[TIME:([^:\\]]*):([^\\]]*)]$");
    private static final Pattern MONTH = Pattern.compile("^(\\d+)M(\\d+)$");
    private static final Pattern YEAR = Pattern.compile("^(\\d+)$");

    private final Map<String, DateVocabulary> vocabularies;

    @Autowired
    public DateRealizer(LexiconLoader loader) {
        this(loader.readJson(LOCATION, new TypeReference<Map<String, DateVocabulary>>() {
        }));
    }

    public DateRealizer(Map<String, DateVocabulary> vocabularies) {
        this.vocabularies = Map.copyOf(vocabularies);
    }

    // ===== Public API =====

    public void realize(DocumentPlanNode plan, String language, Random random) {
        String base = Languages.base(language);
        DateVocabulary vocabulary = vocabularies.get(base);
        if (vocabulary == null) {
            log.warn("No date vocabulary for language {}, leaving dates unrealized", base);
            return;
        }
        String previous = null;
        for (Message message : plan.messages()) {
            previous = realize(message.getComponents(), vocabulary, previous, random);
        }
    }

    private String realize(List<TemplateComponent> components, DateVocabulary vocabulary, String previous,
                           Random random) {
        List<TemplateComponent> rewritten = new ArrayList<>();
        for (TemplateComponent component : components) {
            if (!(component instanceof Slot slot)) {
                rewritten.add(component);
                continue;
            }
            String original = slot.value();
            Matcher time = TIME.matcher(original);
            if (!time.matches()) {
                rewritten.add(slot);
                continue;
            }
            String type = time.group(1);
            String timestamp = time.group(2);
            List<String> options;
            try {
                options = switch (type) {
                    case "month" -> realizeMonth(original, timestamp, previous, vocabulary);
                    case "year" -> realizeYear(original, timestamp, previous, vocabulary);
                    default -> null;
                };
            } catch (IllegalArgumentException e) {
                log.error("Could not realize time {}: {}", original, e.getMessage());
                options = null;
            }
            if (options == null || options.isEmpty()) {
                log.error("Visited time slot {} but could not realize it", original);
                rewritten.add(slot);
                continue;
            }
            String realization = options.get(random.nextInt(options.size()));
            rewritten.addAll(SlotTokens.split(slot, realization, vocabulary.attachAttributes().get(type)));
            log.debug("Realized {} as '{}'", original, realization);
            previous = original;
        }
        components.clear();
        components.addAll(rewritten);
        return previous;
    }

    private List<String> realizeMonth(String value, String timestamp, String previous, DateVocabulary vocabulary) {
        Matcher month = MONTH.matcher(timestamp);
        if (!month.matches()) {
            throw new IllegalArgumentException("Malformed month " + timestamp);
        }
        String year = month.group(1);
        String monthName = vocabulary.month(month.group(2));
        if (previous == null) {
            return List.of(DateVocabulary.fill(vocabulary.monthYearExpression(), monthName, year));
        }
        if (value.equals(previous)) {
            return vocabulary.monthReferenceOptions();
        }
        if (year.equals(yearOf(previous))) {
            return List.of(DateVocabulary.fill(vocabulary.monthExpression(), monthName, year));
        }
        return List.of(DateVocabulary.fill(vocabulary.monthYearExpression(), monthName, year));
    }

    private List<String> realizeYear(String value, String timestamp, String previous, DateVocabulary vocabulary) {
        if (value.equals(previous)) {
            return vocabulary.yearReferenceOptions();
        }
        if (!YEAR.matcher(timestamp).matches()) {
            throw new IllegalArgumentException("Malformed year " + timestamp);
        }
        return List.of(DateVocabulary.fill(vocabulary.yearExpression(), null, timestamp));
    }

    /** Year of a previously realized time value, or null. */
    static String yearOf(String timeValue) {
        Matcher time = TIME.matcher(timeValue);
        if (!time.matches()) {
            return null;
        }
        Matcher month = MONTH.matcher(time.group(2));
        if (month.matches()) {
            return month.group(1);
        }
        return YEAR.matcher(time.group(2)).matches() ? time.group(2) : null;
    }
}
