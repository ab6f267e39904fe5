package com.eainde.nlg.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Components plus the rules that decide which facts the template can express.
 *
 * <p>Templates held by the repository are blueprints. Selection works on a {@link #copy()}, which
 * shares the rules but owns fresh, unbound components.</p>
 *
 * <p>A fact counts as used by identity: two facts with equal fields are still different facts.</p>
 */
public class Template implements Serializable {

    private final List<TemplateComponent> components;
    private final List<Rule> rules;
    private List<Fact> facts = new ArrayList<>();

    public Template(List<? extends TemplateComponent> components, List<Rule> rules) {
        this.components = new ArrayList<>(components);
        this.rules = List.copyOf(rules);
    }

    /** Canned text without rules, used when filling fails. */
    public static Template defaultTemplate(String cannedText) {
        return new Template(List.of(new Literal(cannedText)), List.of());
    }

    /** Live component list. Aggregation and slot realization rewrite it in place. */
    public List<TemplateComponent> getComponents() {
        return components;
    }

    public List<Rule> getRules() {
        return rules;
    }

    /** Facts bound by the last {@link #fill}. */
    public List<Fact> getFacts() {
        return facts;
    }

    public List<Slot> slots() {
        List<Slot> slots = new ArrayList<>();
        for (TemplateComponent component : components) {
            if (component instanceof Slot slot) {
                slots.add(slot);
            }
        }
        return slots;
    }

    public boolean hasSlotOfType(String slotType) {
        return components.stream().anyMatch(c -> c instanceof Slot && slotType.equals(c.slotType()));
    }

    /**
     * Checks whether the template can express {@code primary} with support from {@code pool}.
     * Does not touch any slot.
     *
     * @return the facts the rules would bind, in rule order, or an empty list if a rule cannot be met
     */
    public List<Fact> check(Message primary, List<Message> pool) {
        return bind(primary, pool, false);
    }

    /**
     * Like {@link #check} but binds the slots of every rule to the fact that satisfied it.
     */
    public List<Fact> fill(Message primary, List<Message> pool) {
        return bind(primary, pool, true);
    }

    private List<Fact> bind(Message primary, List<Message> pool, boolean fillSlots) {
        if (rules.isEmpty()) {
            return List.of();
        }
        Fact primaryFact = primary.getMainFact();
        List<Fact> used = new ArrayList<>();
        Set<Fact> usedIdentities = Collections.newSetFromMap(new IdentityHashMap<>());

        Rule first = rules.get(0);
        if (!first.matches(primaryFact, used)) {
            return List.of();
        }
        if (fillSlots) {
            bindSlots(first, primaryFact);
        }
        used.add(primaryFact);
        usedIdentities.add(primaryFact);

        for (Rule rule : rules.subList(1, rules.size())) {
            Fact match = null;
            for (Message candidate : pool) {
                Fact fact = candidate.getMainFact();
                if (!rule.reuseAllowed() && usedIdentities.contains(fact)) {
                    continue;
                }
                if (rule.matches(fact, used)) {
                    match = fact;
                    break;
                }
            }
            if (match == null) {
                return List.of();
            }
            if (fillSlots) {
                bindSlots(rule, match);
            }
            if (usedIdentities.add(match)) {
                used.add(match);
            }
        }

        if (fillSlots) {
            this.facts = used;
        }
        return used;
    }

    private void bindSlots(Rule rule, Fact fact) {
        for (int index : rule.slotIndices()) {
            if (components.get(index) instanceof Slot slot) {
                slot.setFact(fact);
            }
        }
    }

    public Template copy() {
        List<TemplateComponent> copies = components.stream()
                .map(TemplateComponent::copy)
                .collect(Collectors.toList());
        return new Template(copies, rules);
    }

    /** Space-joined components, for logs. */
    public String display() {
        return components.stream().map(String::valueOf).collect(Collectors.joining(" "));
    }

    @Override
    public String toString() {
        return "<Template: " + display() + ">";
    }
}
