package com.eainde.nlg.realize.morphology;

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
 * Applies the morphology of the article language to every slot.
 */
@Slf4j
@Component
public class MorphologicalRealizer {

    private final Map<String, MorphologyCapability> capabilities = new HashMap<>();

    public MorphologicalRealizer() {
        capabilities.put("en", new EnglishMorphology());
        capabilities.put("fi", new FinnishMorphology());
        capabilities.put("hr", new CroatianMorphology());
    }

    public void realize(DocumentPlanNode plan, String language) {
        String base = Languages.base(language);
        MorphologyCapability capability = capabilities.get(base);
        if (capability == null) {
            log.warn("No morphological realizer for language {}", base);
            return;
        }
        for (Message message : plan.messages()) {
            for (TemplateComponent component : message.getComponents()) {
                if (component instanceof Slot slot) {
                    String inflected = capability.realize(slot);
                    if (!inflected.equals(slot.value())) {
                        log.trace("Inflected '{}' as '{}'", slot.value(), inflected);
                        slot.resolve(inflected);
                    }
                }
            }
        }
    }
}
