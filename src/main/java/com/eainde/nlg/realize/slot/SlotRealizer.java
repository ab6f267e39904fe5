package com.eainde.nlg.realize.slot;

import com.eainde.nlg.model.DocumentPlanNode;
import com.eainde.nlg.model.Message;
import com.eainde.nlg.model.Slot;
import com.eainde.nlg.model.Template;
import com.eainde.nlg.model.TemplateComponent;
import com.eainde.nlg.resource.DatasetResource;
import com.eainde.nlg.resource.Languages;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

/**
 * Rewrites the slots of every selected template until no realizer changes anything.
 *
 * <p>Realizers registered for the language are tried in registration order, then those registered
 * for every language, and number formatting last. The first one that applies replaces the slot,
 * possibly by several token slots that are themselves candidates in the next pass.</p>
 */
@Slf4j
@Component
public class SlotRealizer {

    static final int MAX_PASSES = 50;

    private final Map<String, List<SlotRealizerComponent>> byLanguage = new LinkedHashMap<>();
    private final List<SlotRealizerComponent> anyLanguage = new ArrayList<>();
    private final SlotRealizerComponent numbers = new NumberFormatRealizer();

    public SlotRealizer(List<DatasetResource> resources) {
        resources.forEach(resource -> resource.slotRealizers().forEach(this::register));
        log.info("Registered slot realizers for languages {}", byLanguage.keySet());
    }

    public static SlotRealizer of(List<SlotRealizerComponent> components) {
        SlotRealizer realizer = new SlotRealizer(List.of());
        components.forEach(realizer::register);
        return realizer;
    }

    private void register(SlotRealizerComponent component) {
        for (String language : component.supportedLanguages()) {
            if (SlotRealizerComponent.ANY_LANGUAGE.equals(language)) {
                anyLanguage.add(component);
            } else {
                byLanguage.computeIfAbsent(language, k -> new ArrayList<>()).add(component);
            }
        }
    }

    // ===== Public API =====

    public void realize(DocumentPlanNode plan, String language, Random random) {
        List<SlotRealizerComponent> components = componentsFor(Languages.base(language));
        for (Message message : plan.messages()) {
            Template template = message.getTemplate();
            if (template != null) {
                realize(template, components, random);
            }
        }
    }

    List<SlotRealizerComponent> componentsFor(String language) {
        List<SlotRealizerComponent> components = new ArrayList<>(byLanguage.getOrDefault(language, List.of()));
        components.addAll(anyLanguage);
        components.add(numbers);
        return components;
    }

    private void realize(Template template, List<SlotRealizerComponent> components, Random random) {
        List<TemplateComponent> current = template.getComponents();
        for (int pass = 0; pass < MAX_PASSES; pass++) {
            boolean modified = false;
            List<TemplateComponent> rewritten = new ArrayList<>();
            for (TemplateComponent component : current) {
                if (!(component instanceof Slot slot)) {
                    rewritten.add(component);
                    continue;
                }
                Optional<List<Slot>> replacement = realizeSlot(slot, components, random);
                if (replacement.isPresent()) {
                    List<Slot> slots = replacement.get();
                    rewritten.addAll(slots);
                    modified |= !(slots.size() == 1 && slots.get(0).value().equals(slot.value()));
                } else {
                    rewritten.add(slot);
                }
            }
            current.clear();
            current.addAll(rewritten);
            if (!modified) {
                return;
            }
        }
        log.warn("Slot realization of {} did not settle after {} passes", template, MAX_PASSES);
    }

    private Optional<List<Slot>> realizeSlot(Slot slot, List<SlotRealizerComponent> components, Random random) {
        for (SlotRealizerComponent component : components) {
            Optional<List<Slot>> result = component.realize(slot, random);
            if (result.isPresent()) {
                return result;
            }
        }
        return Optional.empty();
    }
}
