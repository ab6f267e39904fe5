package com.eainde.nlg.realize.number;

import java.util.Map;

/**
 * Writes small integers out in words. Numbers without a word are kept as digits.
 */
@FunctionalInterface
public interface CardinalCapability {

    String cardinal(String number);

    static CardinalCapability dictionary(Map<String, String> words) {
        Map<String, String> copy = Map.copyOf(words);
        return number -> copy.getOrDefault(number, number);
    }

    static CardinalCapability english() {
        return dictionary(Map.of("1", "one", "2", "two", "3", "three", "4", "four", "5", "five",
                "6", "six", "7", "seven", "8", "eight", "9", "nine", "10", "ten"));
    }

    static CardinalCapability finnish() {
        return dictionary(Map.of("1", "yksi", "2", "kaksi", "3", "kolme", "4", "neljä", "5", "viisi",
                "6", "kuusi", "7", "seitsemän", "8", "kahdeksan", "9", "yhdeksän", "10", "kymmenen"));
    }

    static CardinalCapability german() {
        return dictionary(Map.ofEntries(
                Map.entry("1", "eins"), Map.entry("2", "zwei"), Map.entry("3", "drei"), Map.entry("4", "vier"),
                Map.entry("5", "fünf"), Map.entry("6", "sechs"), Map.entry("7", "sieben"), Map.entry("8", "acht"),
                Map.entry("9", "neun"), Map.entry("10", "zehn"), Map.entry("11", "elf"), Map.entry("12", "zwölf")));
    }
}
