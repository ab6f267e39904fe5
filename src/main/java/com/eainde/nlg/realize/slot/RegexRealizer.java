package com.eainde.nlg.realize.slot;

import com.eainde.nlg.model.Slot;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites slots whose whole text matches a pattern, formatting the captured groups into one of
 * several alternative realizations.
 *
 * <h3>Usage:</h3>
 * <pre>
 * RegexRealizer change = RegexRealizer.builder()
 *         .language("en")
 *         .pattern("^cphi:([^:]*):([^:]*):(rt12?)$")
 *         .template("{2} of the {0} for the category {1}")
 *         .build();
 * </pre>
 *
 * <p>Templates use {@code {}} for the next group and {@code {n}} for the n-th (0-based) group.
 * Groups that did not participate in the match format as the empty string.</p>
 */
@Slf4j
public class RegexRealizer implements SlotRealizerComponent {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{(\\d*)}");

    private final List<String> languages;
    private final Pattern pattern;
    private final List<String> templates;
    private final Predicate<List<String>> groupRequirement;
    private final Predicate<Slot> slotRequirement;
    private final Set<Integer> attachAttributesTo;
    private final Map<Integer, Map<String, Object>> addAttributes;

    private RegexRealizer(Builder builder) {
        if (builder.languages.isEmpty()) {
            throw new IllegalArgumentException("At least one language is required");
        }
        if (builder.pattern == null) {
            throw new IllegalArgumentException("A pattern is required");
        }
        if (builder.templates.isEmpty()) {
            throw new IllegalArgumentException("At least one template is required");
        }
        this.languages = List.copyOf(builder.languages);
        this.pattern = builder.pattern;
        this.templates = List.copyOf(builder.templates);
        this.groupRequirement = builder.groupRequirement;
        this.slotRequirement = builder.slotRequirement;
        this.attachAttributesTo = Set.copyOf(builder.attachAttributesTo);
        this.addAttributes = Map.copyOf(builder.addAttributes);
    }

    public static Builder builder() {
        return new Builder();
    }

    // ===== Public API =====

    @Override
    public List<String> supportedLanguages() {
        return languages;
    }

    @Override
    public Optional<List<Slot>> realize(Slot slot, Random random) {
        Matcher match = pattern.matcher(slot.value());
        if (!match.matches()) {
            return Optional.empty();
        }
        List<String> groups = new ArrayList<>();
        for (int i = 1; i <= match.groupCount(); i++) {
            groups.add(match.group(i));
        }
        if (!groupRequirement.test(groups) || !slotRequirement.test(slot)) {
            return Optional.empty();
        }

        String template = templates.get(random.nextInt(templates.size()));
        String realization = format(template, groups);
        log.trace("Realized {} with '{}' as '{}'", slot.value(), template, realization);
        return Optional.of(SlotTokens.split(slot, realization, attachAttributesTo, addAttributes));
    }

    static String format(String template, List<String> groups) {
        Matcher placeholder = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder();
        int next = 0;
        while (placeholder.find()) {
            int index = placeholder.group(1).isEmpty() ? next++ : Integer.parseInt(placeholder.group(1));
            if (index >= groups.size()) {
                throw new IllegalArgumentException("Template '" + template + "' refers to group " + index
                        + " but the pattern only captures " + groups.size());
            }
            String group = groups.get(index);
            placeholder.appendReplacement(out, Matcher.quoteReplacement(group == null ? "" : group));
        }
        placeholder.appendTail(out);
        return out.toString();
    }

    // ===== Builder =====

    public static class Builder {
        private final List<String> languages = new ArrayList<>();
        private Pattern pattern;
        private final List<String> templates = new ArrayList<>();
        private Predicate<List<String>> groupRequirement = groups -> true;
        private Predicate<Slot> slotRequirement = slot -> true;
        private final Set<Integer> attachAttributesTo = new HashSet<>();
        private final Map<Integer, Map<String, Object>> addAttributes = new HashMap<>();

        public Builder language(String language) {
            this.languages.add(language);
            return this;
        }

        /** Whole-string pattern; its groups feed the template placeholders. */
        public Builder pattern(String regex) {
            this.pattern = Pattern.compile(regex);
            return this;
        }

        /** Adds an alternative. One is picked at random per realization. */
        public Builder template(String template) {
            this.templates.add(template);
            return this;
        }

        public Builder groupRequirement(Predicate<List<String>> groupRequirement) {
            this.groupRequirement = groupRequirement;
            return this;
        }

        public Builder slotRequirement(Predicate<Slot> slotRequirement) {
            this.slotRequirement = slotRequirement;
            return this;
        }

        /** Token indices that keep the attributes of the original slot (case, ...). */
        public Builder attachAttributesTo(Integer... indices) {
            this.attachAttributesTo.addAll(List.of(indices));
            return this;
        }

        public Builder addAttribute(int index, String name, Object value) {
            this.addAttributes.computeIfAbsent(index, k -> new HashMap<>()).put(name, value);
            return this;
        }

        public RegexRealizer build() {
            return new RegexRealizer(this);
        }
    }
}
