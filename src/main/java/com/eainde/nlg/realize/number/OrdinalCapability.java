package com.eainde.nlg.realize.number;

import java.util.Map;

/**
 * Writes an integer as an ordinal in one language.
 */
@FunctionalInterface
public interface OrdinalCapability {

    String ordinal(String number);

    /** English. "1" becomes empty, so "the 1 highest" reads "the highest". */
    static OrdinalCapability english() {
        Map<String, String> small = Map.ofEntries(
                Map.entry("2", "second"), Map.entry("3", "third"), Map.entry("4", "fourth"),
                Map.entry("5", "fifth"), Map.entry("6", "sixth"), Map.entry("7", "seventh"),
                Map.entry("8", "eighth"), Map.entry("9", "ninth"), Map.entry("10", "tenth"),
                Map.entry("11", "eleventh"), Map.entry("12", "twelfth"));
        return number -> {
            if ("1".equals(number)) {
                return "";
            }
            return small.getOrDefault(number, number + englishSuffix(number));
        };
    }

    static String englishSuffix(String number) {
        if (number.isEmpty()) {
            return "th";
        }
        String lastTwo = number.length() >= 2 ? number.substring(number.length() - 2) : number;
        if (lastTwo.equals("11") || lastTwo.equals("12") || lastTwo.equals("13")) {
            return "th";
        }
        return switch (number.charAt(number.length() - 1)) {
            case '1' -> "st";
            case '2' -> "nd";
            case '3' -> "rd";
            default -> "th";
        };
    }

    static OrdinalCapability finnish() {
        Map<String, String> small = Map.of(
                "1", "ensimmäinen", "2", "toinen", "3", "kolmas", "4", "neljäs", "5", "viides",
                "6", "kuudes", "7", "seitsemäs", "8", "kahdeksas", "9", "yhdeksäs", "10", "kymmenes");
        return number -> small.getOrDefault(number, number + ".");
    }

    static OrdinalCapability croatian() {
        return number -> number + ".";
    }
}
