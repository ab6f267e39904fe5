package com.eainde.nlg.realize.number;

import com.eainde.nlg.model.DocumentPlanNode;
import com.eainde.nlg.model.Message;
import com.eainde.nlg.model.Slot;
import com.eainde.nlg.model.TemplateComponent;
import com.eainde.nlg.resource.Languages;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Writes numbers of slots flagged {@code ord} as ordinals ({@code {value, ord}}) and of slots
 * flagged {@code car} as words.
 */
@Slf4j
@Component
public class NumberRealizer {

    public static final String ORDINAL = "ord";
    public static final String CARDINAL = "car";

    private final Map<String, OrdinalCapability> ordinals = new HashMap<>();
    private final Map<String, CardinalCapability> cardinals = new HashMap<>();

    public NumberRealizer() {
        ordinals.put("en", OrdinalCapability.english());
        ordinals.put("fi", OrdinalCapability.finnish());
        ordinals.put("hr", OrdinalCapability.croatian());
        cardinals.put("en", CardinalCapability.english());
        cardinals.put("fi", CardinalCapability.finnish());
        cardinals.put("de", CardinalCapability.german());
    }

    public void realize(DocumentPlanNode plan, String language) {
        String base = Languages.base(language);
        for (Message message : plan.messages()) {
            for (TemplateComponent component : message.getComponents()) {
                if (component instanceof Slot slot) {
                    realizeSlot(slot, base);
                }
            }
        }
    }

    private void realizeSlot(Slot slot, String language) {
        if (slot.hasFlag(ORDINAL)) {
            OrdinalCapability capability = ordinals.get(language);
            if (capability == null) {
                log.error("Wanted to realize '{}' as an ordinal but there is no ordinal realizer for {}",
                        slot.value(), language);
                return;
            }
            slot.resolve(capability.ordinal(slot.value()));
        } else if (slot.hasFlag(CARDINAL)) {
            CardinalCapability capability = cardinals.get(language);
            if (capability == null) {
                log.error("Wanted to realize '{}' as a cardinal but there is no cardinal realizer for {}",
                        slot.value(), language);
                return;
            }
            slot.resolve(capability.cardinal(slot.value()));
        }
    }
}
