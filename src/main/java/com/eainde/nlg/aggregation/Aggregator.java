package com.eainde.nlg.aggregation;

import com.eainde.nlg.model.DocumentPlanNode;
import com.eainde.nlg.model.Fact;
import com.eainde.nlg.model.Literal;
import com.eainde.nlg.model.Message;
import com.eainde.nlg.model.PlanNode;
import com.eainde.nlg.model.Slot;
import com.eainde.nlg.model.SlotSource;
import com.eainde.nlg.model.Template;
import com.eainde.nlg.model.TemplateComponent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Merges adjacent messages of a paragraph that open with the same words.
 *
 * <p>"In 2020, in Finland, the index was 102 points" and "In 2020, in Finland, the growth rate was 1.2
 * percentage points" become one sentence sharing the prefix and joined by a conjunction. A merged
 * message is never merged again.</p>
 *
 * <p>Templates without a time slot refer implicitly to the last mentioned time. Such a message is
 * put first when merged with an explicitly timed one, and is never appended after one.</p>
 */
@Slf4j
@Component
public class Aggregator {

    private static final String NO_CASE = "no-case";

    private final ConjunctionLexicon conjunctions;

    public Aggregator(ConjunctionLexicon conjunctions) {
        this.conjunctions = conjunctions;
    }

    // ===== Public API =====

    /**
     * Aggregates in place and returns {@code plan}.
     *
     * @throws UnsupportedOperationException for LIST and ELABORATION nodes
     */
    public DocumentPlanNode aggregate(DocumentPlanNode plan, String language) {
        if (log.isDebugEnabled()) {
            log.debug("Aggregating plan\n{}", plan.toTreeString());
        }
        aggregateNode(plan, language);
        return plan;
    }

    private void aggregateNode(DocumentPlanNode node, String language) {
        switch (node.getRelation()) {
            case ELABORATION, LIST -> throw new UnsupportedOperationException(
                    "Aggregation of " + node.getRelation() + " nodes is not supported");
            default -> aggregateSequence(node, language);
        }
    }

    private void aggregateSequence(DocumentPlanNode node, String language) {
        List<PlanNode> aggregated = new ArrayList<>();
        for (PlanNode child : node.getChildren()) {
            if (child.kind() == PlanNode.Kind.BRANCH) {
                aggregateNode(child.asBranch(), language);
                aggregated.add(child);
                continue;
            }
            Message current = child.asLeaf();
            PlanNode last = aggregated.isEmpty() ? null : aggregated.get(aggregated.size() - 1);
            if (last == null || last.kind() != PlanNode.Kind.LEAF) {
                aggregated.add(current);
                continue;
            }
            Message previous = last.asLeaf();
            if (previous.isPreventAggregation() || current.isPreventAggregation()) {
                log.debug("Aggregation prevented for {}", current);
                aggregated.add(current);
            } else if (!samePrefix(previous, current)) {
                aggregated.add(current);
            } else if (!hasImplicitTime(previous) && hasImplicitTime(current)) {
                log.debug("Swapping {} in front of {} for a clearer time reference", current, previous);
                aggregated.set(aggregated.size() - 1, combine(current, previous, language));
            } else if (hasImplicitTime(previous) && !hasImplicitTime(current)) {
                log.debug("Incompatible time expressions, not combining {} and {}", previous, current);
                aggregated.add(current);
            } else {
                aggregated.set(aggregated.size() - 1, combine(previous, current, language));
            }
        }
        node.getChildren().clear();
        node.getChildren().addAll(aggregated);
    }

    boolean samePrefix(Message first, Message second) {
        List<TemplateComponent> a = first.getComponents();
        List<TemplateComponent> b = second.getComponents();
        if (a.isEmpty() || b.isEmpty()) {
            return false;
        }
        return Objects.equals(a.get(0).value(), b.get(0).value());
    }

    private static boolean hasImplicitTime(Message message) {
        return message.getTemplate() == null || !message.getTemplate().hasSlotOfType(SlotSource.TimeSource.FIELD_NAME);
    }

    Message combine(Message first, Message second, String language) {
        List<TemplateComponent> combined = new ArrayList<>(first.getComponents());
        List<TemplateComponent> other = second.getComponents();

        int idx = 0;
        for (; idx < other.size(); idx++) {
            if (idx >= combined.size() || !areSame(combined.get(idx), other.get(idx))) {
                break;
            }
        }
        if (idx == other.size() && idx > 0) {
            // fully shared: the last component still closes the second clause
            idx = other.size() - 1;
        }

        String key = first.getPolarity() != second.getPolarity()
                ? ConjunctionLexicon.INVERSE_COMBINER
                : ConjunctionLexicon.DEFAULT_COMBINER;
        String conjunction = conjunctions.get(language, key).orElseGet(() -> {
            log.warn("No '{}' conjunction for language {}", key, language);
            return "MISSING-" + key.toUpperCase();
        });
        combined.add(new Literal(conjunction));
        combined.addAll(other.subList(idx, other.size()));

        List<Fact> facts = new ArrayList<>(first.getFacts());
        for (Fact fact : second.getFacts()) {
            if (!facts.contains(fact)) {
                facts.add(fact);
            }
        }
        Message merged = new Message(facts, first.getImportanceCoefficient(), first.getPolarity());
        merged.setScore(first.getScore());
        merged.setTemplate(new Template(combined, List.of()));
        merged.setPreventAggregation(true);
        log.debug("Combined into {}", merged);
        return merged;
    }

    static boolean areSame(TemplateComponent a, TemplateComponent b) {
        if (!Objects.equals(a.value(), b.value())) {
            return false;
        }
        if (a instanceof Slot first && b instanceof Slot second && first.getFact() != null && second.getFact() != null) {
            // equal numbers may still describe different sets of things
            if (Fact.VALUE.equals(first.slotType())) {
                return false;
            }
            if (Fact.isField(first.slotType()) && Fact.isField(second.slotType())
                    && !Objects.equals(first.getFact().field(first.slotType()),
                    second.getFact().field(second.slotType()))) {
                return false;
            }
        }
        return caseOf(a).equals(caseOf(b));
    }

    private static String caseOf(TemplateComponent component) {
        if (component instanceof Slot slot) {
            Object value = slot.attribute(Slot.CASE);
            return value == null ? "" : String.valueOf(value);
        }
        return NO_CASE;
    }
}
