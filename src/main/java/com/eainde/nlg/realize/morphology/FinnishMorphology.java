package com.eainde.nlg.realize.morphology;

import com.eainde.nlg.model.Slot;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.regex.Pattern;

/**
 * Suffix-based genitive and inessive. Vowel harmony picks between -ssa and -ssä. Stems that change
 * when inflected are listed explicitly.
 */
@Slf4j
public class FinnishMorphology implements MorphologyCapability {

    private static final String VOWELS = "aeiouyäö";
    private static final Pattern BACK_VOWEL = Pattern.compile("[aou]");
    private static final Pattern NOT_A_WORD = Pattern.compile(".*[\\d.,'].*");
    // already carries a locative or essive ending: "vuonna", "Suomessa"
    private static final Pattern INFLECTED = Pattern.compile(".*(ss[aä]|nn[aä])$");

    private static final Map<String, String> STEMS = Map.of(
            "Suomi", "Suome",
            "Kypros", "Kyprokse");

    @Override
    public String realize(Slot slot) {
        Object grammaticalCase = slot.attribute(Slot.CASE);
        String text = slot.value();
        if (grammaticalCase == null || text.isEmpty() || NOT_A_WORD.matcher(text).matches()
                || INFLECTED.matcher(text).matches()) {
            return text;
        }
        return switch (String.valueOf(grammaticalCase)) {
            case "genitive" -> stem(text) + "n";
            case "inessive" -> stem(text) + (BACK_VOWEL.matcher(text.toLowerCase()).find() ? "ssa" : "ssä");
            default -> {
                log.debug("No Finnish rule for case {}, keeping '{}'", grammaticalCase, text);
                yield text;
            }
        };
    }

    private static String stem(String word) {
        String stem = STEMS.get(word);
        if (stem != null) {
            return stem;
        }
        char last = Character.toLowerCase(word.charAt(word.length() - 1));
        return VOWELS.indexOf(last) >= 0 ? word : word + "i";
    }
}
