package com.eainde.nlg.realize.date;

import java.util.List;
import java.util.Map;

/**
 * Date words of one language.
 *
 * @param months              month names keyed {@code 01} to {@code 12}
 * @param attachAttributes    per timestamp type, the token indices that keep the slot attributes;
 *                            types missing here keep them on every token
 */
public record DateVocabulary(
        Map<String, String> months,
        List<String> monthReferenceOptions,
        List<String> yearReferenceOptions,
        String monthExpression,
        String monthYearExpression,
        String yearExpression,
        Map<String, List<Integer>> attachAttributes
) {

    public DateVocabulary {
        attachAttributes = attachAttributes == null ? Map.of() : attachAttributes;
    }

    String month(String number) {
        String name = months.get(number);
        if (name == null) {
            throw new IllegalArgumentException("No month named " + number);
        }
        return name;
    }

    static String fill(String expression, String month, String year) {
        return expression.replace("{month}", month == null ? "" : month).replace("{year}", year == null ? "" : year);
    }
}
