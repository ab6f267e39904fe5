package com.eainde.nlg.resource;

import com.eainde.nlg.realize.slot.LookupRealizer;
import com.eainde.nlg.realize.slot.RegexRealizer;
import com.eainde.nlg.realize.slot.SlotRealizerComponent;
import com.fasterxml.jackson.core.type.TypeReference;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Health care expenditure. Value types look like {@code health:cost:hc1:mio-eur[:comp_eu]}, the
 * third segment naming the function of care and the fourth the unit.
 */
@Component
public class HealthCostResource implements DatasetResource {

    public static final String DATASET = "health_cost";

    private static final String MAYBE_RANK_OR_COMP = ":?(rank|rank_reverse|comp_eu|comp_us)?";
    private static final String LEXICON = "lexicon/health-cost.json";

    record Lexicon(Map<String, Map<String, String>> partials, Map<String, Map<String, String>> units) {
    }

    private final Lexicon lexicon;

    public HealthCostResource(LexiconLoader loader) {
        this.lexicon = loader.readJson(LEXICON, new TypeReference<>() {
        });
    }

    @Override
    public String dataset() {
        return DATASET;
    }

    @Override
    public Set<String> languages() {
        return lexicon.partials().keySet();
    }

    @Override
    public String templateLocation() {
        return "templates/health_cost.txt";
    }

    @Override
    public List<SlotRealizerComponent> slotRealizers() {
        List<SlotRealizerComponent> realizers = new ArrayList<>();
        for (String language : lexicon.partials().keySet()) {
            realizers.add(RegexRealizer.builder()
                    .language(language)
                    .pattern("^health:cost:([^:]*):?.*" + MAYBE_RANK_OR_COMP + "$")
                    .template("{}")
                    .build());
            // [UNIT:health:cost:hc1:mio-eur:rank] -> [UNIT:health:cost:mio-eur]
            realizers.add(RegexRealizer.builder()
                    .language(language)
                    .pattern("^\\[UNIT:health:cost:[^:]*:([^:]*):?.*\\]$")
                    .template("[UNIT:health:cost:{}]")
                    .build());
            realizers.add(new LookupRealizer(language, lexicon.units().getOrDefault(language, Map.of())));
            realizers.add(new LookupRealizer(language, lexicon.partials().getOrDefault(language, Map.of())));
        }
        return realizers;
    }
}
