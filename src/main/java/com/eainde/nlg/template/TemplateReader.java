package com.eainde.nlg.template;

import com.eainde.nlg.exception.TemplateReadingException;
import com.eainde.nlg.model.Fact;
import com.eainde.nlg.model.LhsExpr;
import com.eainde.nlg.model.Literal;
import com.eainde.nlg.model.Matcher;
import com.eainde.nlg.model.Rule;
import com.eainde.nlg.model.Slot;
import com.eainde.nlg.model.SlotSource;
import com.eainde.nlg.model.Template;
import com.eainde.nlg.model.TemplateComponent;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Parses the multilingual template text format.
 *
 * <pre>
 * # comment
 * $ {big}: cphi:hicp2015, cphi:rt12
 *
 * en: [in {time},] in {location}, the {value_type} was {value} {unit}
 * en-head: in {location}, the {value_type} was {value} {unit}
 * | value_type = cphi:.*, value_type != .*:rank.*
 * |* location = 1.location, timestamp != 1.timestamp
 * </pre>
 *
 * <p>Blocks are separated by blank lines and indented lines continue the previous one. A line
 * prefixed with {@code <lang>: } sets the language of that template and of the following ones; a
 * block holding only {@code <lang>:} switches the default language. Every {@code |} line is one
 * rule, in order, and {@code |*} marks a rule that may bind a fact an earlier rule already bound.
 * Blocks without rule lines are ignored. Square brackets mark optional parts, expanded into every
 * combination. Slots are written {@code {field[, attr=value][, flag]}}, optionally prefixed with the
 * 1-based rule number ({@code {2.value}}), or as a quoted literal ({@code {"EU", case=gen}}).</p>
 *
 * <p>A reader keeps the {@code $} value groups it has seen, so instances are not shared between
 * threads.</p>
 */
@Slf4j
public class TemplateReader {

    static final String RULE_PREFIX = "|";
    static final String REUSE_RULE_PREFIX = "|*";

    private static final List<String> TEMPLATE_FIELDS = List.of(
            Fact.LOCATION_TYPE, Fact.LOCATION, Fact.TIMESTAMP, Fact.TIMESTAMP_TYPE, Fact.VALUE_TYPE, Fact.VALUE,
            SlotSource.TimeSource.FIELD_NAME, SlotSource.UnitSource.FIELD_NAME);

    private static final List<String> OPERATORS = List.of(">=", "<=", "!=", "=", ">", "<", "in");

    private static final Pattern FIELD_NAME = Pattern.compile("[^ |=<>!]+");
    private static final Pattern REFERENCE = Pattern.compile("^(\\d+)\\.([a-z_]+)$");
    private static final Pattern LANGUAGE_PREFIX = Pattern.compile("^(\\S*):\\s(.*)$");
    private static final Pattern MULTI_SPACE = Pattern.compile("\\s+");

    private static final Map<String, String> CASE_NAMES = caseNames();

    private final Map<String, Set<String>> valueGroups = new HashMap<>();

    // ===== Public API =====

    public Map<String, List<Template>> read(String text) {
        return read(text, null);
    }

    /**
     * @param initialLanguage language of templates written before any language prefix
     * @return templates per lower-case language id, in file order
     * @throws TemplateReadingException on malformed input
     */
    public Map<String, List<Template>> read(String text, String initialLanguage) {
        Map<String, List<Template>> templates = new LinkedHashMap<>();
        List<String> allLines = text.lines().toList();

        for (String line : allLines) {
            if (line.startsWith("$")) {
                readValueGroup(line);
            }
        }

        List<String> lines = allLines.stream()
                .filter(line -> !(line.startsWith("#") || line.startsWith("$")))
                .toList();

        String currentLanguage = initialLanguage;
        for (List<String> block : blankLineSplit(lines)) {
            BlockResult result = readBlock(block, currentLanguage);
            currentLanguage = result.language();
            result.templates().forEach((language, list) ->
                    templates.computeIfAbsent(language, k -> new ArrayList<>()).addAll(list));
        }
        return templates;
    }

    // ===== Blocks =====

    private record BlockResult(Map<String, List<Template>> templates, String language) {
    }

    private BlockResult readBlock(List<String> rawLines, String currentLanguage) {
        List<String> lines = groupIndentedLines(rawLines);

        String joined = String.join("", lines).strip();
        int colon = joined.indexOf(':');
        if (colon >= 0 && colon == joined.length() - 1) {
            return new BlockResult(Map.of(), joined.substring(0, colon).toLowerCase(Locale.ROOT));
        }

        if (lines.stream().noneMatch(line -> line.startsWith(RULE_PREFIX))) {
            log.warn("No rule lines in template block, ignoring it: {}", lines);
            return new BlockResult(Map.of(), currentLanguage);
        }

        List<List<Matcher>> ruleMatchers = new ArrayList<>();
        List<Boolean> reuse = new ArrayList<>();
        for (String line : lines) {
            if (line.startsWith(REUSE_RULE_PREFIX)) {
                ruleMatchers.add(parseMatchers(line.substring(REUSE_RULE_PREFIX.length()).strip()));
                reuse.add(true);
            } else if (line.startsWith(RULE_PREFIX)) {
                ruleMatchers.add(parseMatchers(line.substring(RULE_PREFIX.length()).strip()));
                reuse.add(false);
            }
        }

        Map<String, List<Template>> templates = new LinkedHashMap<>();
        for (String line : lines) {
            if (line.startsWith(RULE_PREFIX)) {
                continue;
            }
            String templateLine = line;
            java.util.regex.Matcher languageMatch = LANGUAGE_PREFIX.matcher(line);
            if (languageMatch.matches()) {
                String language = languageMatch.group(1).toLowerCase(Locale.ROOT);
                templateLine = languageMatch.group(2);
                if (!language.isEmpty()) {
                    currentLanguage = language;
                }
            }
            if (currentLanguage == null) {
                throw new TemplateReadingException("No language given for template: " + line);
            }
            for (String expanded : expandAlternatives(templateLine)) {
                templates.computeIfAbsent(currentLanguage, k -> new ArrayList<>())
                        .add(parseTemplate(expanded, ruleMatchers, reuse));
            }
        }
        return new BlockResult(templates, currentLanguage);
    }

    private Template parseTemplate(String line, List<List<Matcher>> ruleMatchers, List<Boolean> reuse) {
        List<TemplateComponent> components = new ArrayList<>();
        List<List<Integer>> ruleToSlot = new ArrayList<>();
        ruleMatchers.forEach(r -> ruleToSlot.add(new ArrayList<>()));

        String rest = line.strip();
        while (!rest.isBlank()) {
            int open = rest.indexOf('{');
            String literalPart = open < 0 ? rest : rest.substring(0, open);
            for (String word : literalPart.split("\\s+")) {
                if (!word.isEmpty()) {
                    components.add(new Literal(word));
                }
            }
            if (open < 0) {
                break;
            }
            int close = rest.indexOf('}', open);
            if (close < 0) {
                throw new TemplateReadingException("Closing brace missing in " + line);
            }
            String substitution = rest.substring(open + 1, close);
            rest = rest.substring(close + 1);

            List<String> parts = Arrays.stream(substitution.split(",")).map(String::strip).toList();
            String head = parts.get(0);
            if (head.isEmpty()) {
                throw new TemplateReadingException("Empty substitution in " + line);
            }

            SlotSource source;
            Integer ruleRef = null;
            char first = head.charAt(0);
            if (first == '"' || first == '\'') {
                if (head.length() < 2 || head.charAt(head.length() - 1) != first) {
                    throw new TemplateReadingException("Closing quote missing in " + line);
                }
                source = new SlotSource.LiteralSource(head.substring(1, head.length() - 1));
            } else {
                String fieldName = head;
                ruleRef = 0;
                int dot = head.indexOf('.');
                if (dot >= 0) {
                    try {
                        ruleRef = Integer.parseInt(head.substring(0, dot)) - 1;
                    } catch (NumberFormatException e) {
                        throw new TemplateReadingException("Invalid rule reference in {" + substitution + "}", e);
                    }
                    if (ruleRef < 0) {
                        throw new TemplateReadingException(
                                "Rule references use 1-based numbering. Found reference to rule 0: did you mean 1?");
                    }
                    fieldName = head.substring(dot + 1);
                }
                if (!TEMPLATE_FIELDS.contains(fieldName)) {
                    throw new TemplateReadingException(
                            "Unknown fact field '" + fieldName + "' used in substitution {" + substitution + "}");
                }
                if (ruleRef >= ruleMatchers.size()) {
                    throw new TemplateReadingException("Substitution {" + substitution + "} refers to rule "
                            + (ruleRef + 1) + ", but the template only has " + ruleMatchers.size() + " rules");
                }
                source = switch (fieldName) {
                    case SlotSource.TimeSource.FIELD_NAME -> new SlotSource.TimeSource();
                    case SlotSource.UnitSource.FIELD_NAME -> new SlotSource.UnitSource();
                    default -> new SlotSource.FactFieldSource(fieldName);
                };
            }

            Map<String, Object> attributes = new LinkedHashMap<>();
            for (String part : parts.subList(1, parts.size())) {
                int eq = part.indexOf('=');
                if (eq >= 0) {
                    String name = part.substring(0, eq).strip();
                    String value = part.substring(eq + 1).strip();
                    attributes.put(name, Slot.CASE.equals(name) ? canonicalCase(value) : value);
                } else if (!part.isEmpty()) {
                    attributes.put(part, Boolean.TRUE);
                }
            }

            if (ruleRef != null) {
                ruleToSlot.get(ruleRef).add(components.size());
            }
            components.add(new Slot(source, attributes, null));
        }

        List<Rule> rules = new ArrayList<>();
        for (int i = 0; i < ruleMatchers.size(); i++) {
            rules.add(new Rule(ruleMatchers.get(i), ruleToSlot.get(i), reuse.get(i)));
        }
        return new Template(components, rules);
    }

    // ===== Rules =====

    List<Matcher> parseMatchers(String line) {
        List<Matcher> matchers = new ArrayList<>();
        String rest = line.strip();
        while (!rest.isBlank()) {
            java.util.regex.Matcher fieldMatch = FIELD_NAME.matcher(rest);
            if (!fieldMatch.lookingAt()) {
                throw new TemplateReadingException("Matcher must begin with a field name, could not parse: " + rest);
            }
            String fieldName = fieldMatch.group();
            rest = rest.substring(fieldMatch.end()).strip();

            String operator = null;
            for (String candidate : OPERATORS) {
                if (rest.startsWith(candidate)) {
                    operator = candidate;
                    break;
                }
            }
            if (operator == null) {
                throw new TemplateReadingException("Unrecognised operator at start of '" + rest
                        + "'. Should be one of " + String.join(", ", OPERATORS));
            }
            rest = rest.substring(operator.length()).strip();

            int comma = rest.indexOf(',');
            String value = (comma < 0 ? rest : rest.substring(0, comma)).strip();
            rest = comma < 0 ? "" : rest.substring(comma + 1).strip();
            if (value.isEmpty()) {
                throw new TemplateReadingException("Missing value part of constraint in: " + line);
            }

            if (!Fact.isField(fieldName)) {
                // "hicp2015 > 100" is shorthand for "value_type = hicp2015, value > 100"
                matchers.add(new Matcher(new LhsExpr.FactField(Fact.VALUE_TYPE), Matcher.Operator.EQ, fieldName));
                fieldName = Fact.VALUE;
            }

            Object rhs = Fact.VALUE_TYPE.equals(fieldName) || Fact.LOCATION_TYPE.equals(fieldName)
                    ? value
                    : parseValue(value);
            if (rhs instanceof String text && valueGroups.containsKey(text)) {
                rhs = valueGroups.get(text);
            }
            try {
                matchers.add(new Matcher(new LhsExpr.FactField(fieldName), operator, rhs));
            } catch (IllegalArgumentException e) {
                throw new TemplateReadingException("Invalid constraint '" + fieldName + " " + operator + " "
                        + value + "' in: " + line, e);
            }
        }
        return matchers;
    }

    /** References, fact fields, booleans and numbers. Anything else is a string, quotes removed. */
    static Object parseValue(String value) {
        java.util.regex.Matcher reference = REFERENCE.matcher(value);
        if (reference.matches() && Fact.isField(reference.group(2))) {
            int index = Integer.parseInt(reference.group(1)) - 1;
            if (index < 0) {
                throw new TemplateReadingException("Rule references use 1-based numbering: " + value);
            }
            return new LhsExpr.ReferentialExpr(index, reference.group(2));
        }
        if (Fact.isField(value)) {
            return new LhsExpr.FactField(value);
        }
        if ("True".equals(value)) {
            return Boolean.TRUE;
        }
        if ("False".equals(value)) {
            return Boolean.FALSE;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException notInt) {
            try {
                return Double.parseDouble(value);
            } catch (NumberFormatException notDouble) {
                if (value.length() >= 2 && (value.charAt(0) == '"' || value.charAt(0) == '\'')
                        && value.charAt(value.length() - 1) == value.charAt(0)) {
                    return value.substring(1, value.length() - 1);
                }
                return value;
            }
        }
    }

    private void readValueGroup(String line) {
        String definition = line.substring(1);
        int colon = definition.indexOf(':');
        if (colon < 0) {
            throw new TemplateReadingException("Invalid value group definition: " + line);
        }
        String name = definition.substring(0, colon).strip();
        if (name.length() < 2 || name.charAt(0) != '{' || name.charAt(name.length() - 1) != '}') {
            throw new TemplateReadingException("Invalid group name '" + name
                    + "' for use in template definitions. Group names need to be within curly brackets");
        }
        Set<String> values = new LinkedHashSet<>();
        for (String value : definition.substring(colon + 1).split(",")) {
            values.add(value.strip());
        }
        valueGroups.put(name, Set.copyOf(values));
    }

    // ===== Lines =====

    static List<List<String>> blankLineSplit(List<String> lines) {
        List<List<String>> blocks = new ArrayList<>();
        List<String> block = new ArrayList<>();
        for (String line : lines) {
            if (line.isBlank()) {
                if (!block.isEmpty()) {
                    blocks.add(block);
                    block = new ArrayList<>();
                }
            } else {
                block.add(line);
            }
        }
        if (!block.isEmpty()) {
            blocks.add(block);
        }
        return blocks;
    }

    static List<String> groupIndentedLines(List<String> lines) {
        List<String> grouped = new ArrayList<>();
        StringBuilder current = new StringBuilder(lines.get(0).strip());
        for (String line : lines.subList(1, lines.size())) {
            if (Character.isWhitespace(line.charAt(0))) {
                current.append(' ').append(line.strip());
            } else {
                grouped.add(current.toString());
                current = new StringBuilder(line.strip());
            }
        }
        grouped.add(current.toString());
        return grouped;
    }

    /** {@code "a [b] c"} becomes {@code ["a b c", "a c"]}. Brackets do not nest. */
    static List<String> expandAlternatives(String line) {
        List<String> alternatives = new ArrayList<>(List.of(""));
        String rest = line;
        while (!rest.isEmpty()) {
            int open = rest.indexOf('[');
            String before = open < 0 ? rest : rest.substring(0, open);
            alternatives = append(alternatives, List.of(before));
            if (open < 0) {
                break;
            }
            int close = rest.indexOf(']', open);
            if (close < 0) {
                throw new TemplateReadingException("Unmatched square bracket in template line: " + line);
            }
            alternatives = append(alternatives, List.of(rest.substring(open + 1, close), ""));
            rest = rest.substring(close + 1);
        }
        return alternatives.stream()
                .map(alternative -> MULTI_SPACE.matcher(alternative.strip()).replaceAll(" "))
                .toList();
    }

    private static List<String> append(List<String> prefixes, List<String> suffixes) {
        List<String> combined = new ArrayList<>();
        for (String prefix : prefixes) {
            for (String suffix : suffixes) {
                combined.add(prefix + suffix);
            }
        }
        return combined;
    }

    // ===== Cases =====

    static String canonicalCase(String name) {
        String canonical = CASE_NAMES.get(name.toLowerCase(Locale.ROOT));
        if (canonical == null) {
            log.info("Unknown case name '{}', keeping it as given", name);
            return name;
        }
        return canonical;
    }

    private static Map<String, String> caseNames() {
        Map<String, List<String>> alternatives = new LinkedHashMap<>();
        alternatives.put("nominative", List.of("nominatiivi", "nom"));
        alternatives.put("genitive", List.of("genitiivi", "gen"));
        alternatives.put("partitive", List.of("partitiivi", "par"));
        alternatives.put("accusative", List.of("akkusatiivi", "acc"));
        alternatives.put("inessive", List.of("inessiivi", "ine", "ssa"));
        alternatives.put("elative", List.of("elatiivi", "ela", "sta"));
        alternatives.put("illative", List.of("illatiivi", "ill"));
        alternatives.put("adessive", List.of("adessiivi", "ade", "lla"));
        alternatives.put("ablative", List.of("ablatiivi", "abl", "lta"));
        alternatives.put("allative", List.of("allatiivi", "all", "lle"));
        alternatives.put("essive", List.of("essiivi", "ess"));
        alternatives.put("translative", List.of("translatiivi", "tra"));
        alternatives.put("locative", List.of("lokativ", "loc"));

        Map<String, String> names = new HashMap<>();
        alternatives.forEach((canonical, alts) -> {
            names.put(canonical, canonical);
            alts.forEach(alt -> names.put(alt, canonical));
        });
        return Map.copyOf(names);
    }
}
