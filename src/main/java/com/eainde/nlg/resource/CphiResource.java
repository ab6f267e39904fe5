package com.eainde.nlg.resource;

import com.eainde.nlg.model.Slot;
import com.eainde.nlg.realize.slot.LookupRealizer;
import com.eainde.nlg.realize.slot.RegexRealizer;
import com.eainde.nlg.realize.slot.SlotRealizerComponent;
import com.fasterxml.jackson.core.type.TypeReference;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Harmonised consumer price index. Value types look like {@code cphi:hicp2015:cp-hi01[:rt12][:rank]}.
 */
@Component
public class CphiResource implements DatasetResource {

    public static final String DATASET = "cphi";

    private static final String MAYBE_RANK_OR_COMP = ":?(rank|rank_reverse|comp_eu|comp_us)?";
    private static final String CATEGORIES = "lexicon/cphi-categories.json";

    private record Phrasing(String raw, String change, String percentagePoints, String points) {
    }

    private static final Map<String, Phrasing> PHRASINGS = Map.of(
            "en", new Phrasing("{} for the category {}", "{2} of the {0} for the category {1}",
                    "percentage points", "points"),
            "fi", new Phrasing("{} kategoriassa {}", "{2} kuluttajahintaindeksissä {1}",
                    "prosenttiyksikköä", "yksikköä"),
            "hr", new Phrasing("{} je za cijenovnu kategoriju {}", "{2} indeksa potrošačkih cijena {1}",
                    "postotnih bodova", "bodova"));

    private final Map<String, Map<String, String>> categories;

    public CphiResource(LexiconLoader loader) {
        this.categories = loader.readJson(CATEGORIES, new TypeReference<>() {
        });
    }

    @Override
    public String dataset() {
        return DATASET;
    }

    @Override
    public Set<String> languages() {
        return PHRASINGS.keySet();
    }

    @Override
    public String templateLocation() {
        return "templates/cphi.txt";
    }

    @Override
    public List<SlotRealizerComponent> slotRealizers() {
        List<SlotRealizerComponent> realizers = new ArrayList<>();
        for (String language : List.of("en", "fi", "hr")) {
            Phrasing phrasing = PHRASINGS.get(language);
            realizers.add(RegexRealizer.builder()
                    .language(language)
                    .pattern("^cphi:([^:]*)$")
                    .template("{}")
                    .build());
            realizers.add(RegexRealizer.builder()
                    .language(language)
                    .pattern("^cphi:([^:]*):([^:]*)" + MAYBE_RANK_OR_COMP + "$")
                    .template(phrasing.raw())
                    .build());
            realizers.add(RegexRealizer.builder()
                    .language(language)
                    .pattern("^cphi:([^:]*):([^:]*):(rt12?)" + MAYBE_RANK_OR_COMP + "$")
                    .template(phrasing.change())
                    .build());
            realizers.add(new LookupRealizer(language, categories.getOrDefault(language, Map.of())));
            realizers.add(RegexRealizer.builder()
                    .language(language)
                    .pattern("^\\[UNIT:cphi:.*\\]$")
                    .template(phrasing.percentagePoints())
                    .slotRequirement(isGrowthRate())
                    .build());
            realizers.add(RegexRealizer.builder()
                    .language(language)
                    .pattern("^\\[UNIT:cphi:.*\\]$")
                    .template(phrasing.points())
                    .slotRequirement(isGrowthRate().negate())
                    .build());
        }
        return realizers;
    }

    /** Growth rates are measured in percentage points, index values in points. */
    static Predicate<Slot> isGrowthRate() {
        return slot -> {
            if (slot.getFact() == null) {
                return false;
            }
            List<String> segments = Arrays.asList(slot.getFact().valueType().split(":"));
            return segments.contains("rt1") || segments.contains("rt12");
        };
    }
}
