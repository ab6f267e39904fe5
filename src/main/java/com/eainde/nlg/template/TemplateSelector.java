package com.eainde.nlg.template;

import com.eainde.nlg.exception.NoTemplateForMessageException;
import com.eainde.nlg.model.DocumentPlanNode;
import com.eainde.nlg.model.Fact;
import com.eainde.nlg.model.Message;
import com.eainde.nlg.model.PlanNode;
import com.eainde.nlg.model.SlotSource;
import com.eainde.nlg.model.Template;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.function.Predicate;

/**
 * Binds a filled template to every message of a document plan.
 *
 * <p>Among the templates that can express a message, those that fit the previous message best are
 * preferred. Time and location are mentioned unless they repeat the previous message, and the value
 * type is mentioned unless it barely changes within a paragraph. A filter that would leave no
 * candidates is skipped.</p>
 */
@Slf4j
@Component
public class TemplateSelector {

    private static final String COMPARISON_MARKER = ":comp_";

    /**
     * Selects templates for every message in {@code plan}, in order.
     *
     * @param allMessages pool rules beyond the first are matched against (core and expanded)
     * @throws NoTemplateForMessageException if some message has no applicable template
     */
    public void selectTemplates(DocumentPlanNode plan, List<Message> allMessages, List<Template> templates,
                                Random random) {
        TemplateApplicabilityCache cache = new TemplateApplicabilityCache();
        select(plan, allMessages, templates, random, cache, null);
        log.debug("Template selection done, {} applicability checks cached, {} hits", cache.size(), cache.hits());
    }

    private Message select(DocumentPlanNode node, List<Message> allMessages, List<Template> templates,
                           Random random, TemplateApplicabilityCache cache, Message previous) {
        List<PlanNode> children = node.getChildren();
        for (int i = 0; i < children.size(); i++) {
            PlanNode child = children.get(i);
            previous = switch (child.kind()) {
                case BRANCH -> select(child.asBranch(), allMessages, templates, random, cache, previous);
                case LEAF -> {
                    Message message = child.asLeaf();
                    selectFor(message, allMessages, templates, random, cache, previous, i == 0);
                    yield message;
                }
            };
        }
        return previous;
    }

    private void selectFor(Message message, List<Message> allMessages, List<Template> templates, Random random,
                           TemplateApplicabilityCache cache, Message previous, boolean firstInParagraph) {
        List<Template> candidates = new ArrayList<>();
        for (Template template : templates) {
            if (!cache.check(template, message, allMessages).isEmpty()) {
                candidates.add(template);
            }
        }
        if (candidates.isEmpty()) {
            throw new NoTemplateForMessageException("No template could express " + message.getMainFact());
        }

        Fact current = message.getMainFact();
        Fact before = previous == null ? null : previous.getMainFact();

        boolean sameTime = before != null
                && Objects.equals(current.timestamp(), before.timestamp())
                && Objects.equals(current.timestampType(), before.timestampType());
        candidates = filterUnlessEmpty(candidates, hasSlot(SlotSource.TimeSource.FIELD_NAME), !sameTime, "time");

        boolean sameLocation = before != null
                && Objects.equals(current.location(), before.location())
                && Objects.equals(current.locationType(), before.locationType());
        candidates = filterUnlessEmpty(candidates, hasSlot(Fact.LOCATION), !sameLocation, "location");

        boolean omitValueType = before != null && !firstInParagraph
                && substantiallySimilar(current.valueType(), before.valueType());
        candidates = filterUnlessEmpty(candidates, hasSlot(Fact.VALUE_TYPE), !omitValueType, "value_type");

        Collections.shuffle(candidates, random);
        Template template = candidates.get(0).copy();
        List<Fact> used = template.fill(message, allMessages);
        if (used.isEmpty()) {
            log.error("Filling {} for {} bound no facts, using an empty template", template, message.getMainFact());
            message.setTemplate(Template.defaultTemplate(""));
            return;
        }
        message.setTemplate(template);
        message.setFacts(used);
        log.trace("Selected {} for {}", template, message.getMainFact());
    }

    private static Predicate<Template> hasSlot(String slotType) {
        return template -> template.hasSlotOfType(slotType);
    }

    private static List<Template> filterUnlessEmpty(List<Template> candidates, Predicate<Template> hasSlot,
                                                    boolean required, String field) {
        List<Template> filtered = candidates.stream()
                .filter(required ? hasSlot : hasSlot.negate())
                .toList();
        if (filtered.isEmpty()) {
            log.debug("No template {} a {} slot, keeping all {} candidates",
                    required ? "has" : "omits", field, candidates.size());
            return candidates;
        }
        return new ArrayList<>(filtered);
    }

    /** Equal once comparison suffixes such as {@code :comp_eu} are ignored. */
    static boolean substantiallySimilar(String valueType, String other) {
        return Objects.equals(stripComparison(valueType), stripComparison(other));
    }

    private static String stripComparison(String valueType) {
        if (valueType == null) {
            return null;
        }
        int index = valueType.indexOf(COMPARISON_MARKER);
        return index < 0 ? valueType : valueType.substring(0, index);
    }
}
