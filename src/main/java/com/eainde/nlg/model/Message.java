package com.eainde.nlg.model;

import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Leaf of the document plan: one or more facts plus the newsworthiness data computed for them.
 *
 * <p>Messages compare by identity. The planner removes them from pools by identity and the
 * template applicability cache keys on it.</p>
 */
public class Message implements PlanNode {

    private List<Fact> facts;

    /** Scales the score, so less relevant messages only get in when they outweigh the penalty. */
    @Getter @Setter
    private double importanceCoefficient;

    @Getter @Setter
    private double score;

    /** Sign of the described change: -1, 0 or 1. */
    @Getter @Setter
    private double polarity;

    @Getter @Setter
    private boolean preventAggregation;

    @Getter @Setter
    private Template template;

    public Message(Fact fact) {
        this(List.of(fact), 1.0, 0.0);
    }

    public Message(List<Fact> facts, double importanceCoefficient, double polarity) {
        setFacts(facts);
        this.importanceCoefficient = importanceCoefficient;
        this.polarity = polarity;
    }

    @Override
    public Kind kind() {
        return Kind.LEAF;
    }

    @Override
    public Message asLeaf() {
        return this;
    }

    public List<Fact> getFacts() {
        return Collections.unmodifiableList(facts);
    }

    public void setFacts(List<Fact> facts) {
        if (facts == null || facts.isEmpty()) {
            throw new IllegalArgumentException("A message needs at least one fact");
        }
        this.facts = new ArrayList<>(facts);
    }

    public Fact getMainFact() {
        return facts.get(0);
    }

    /** Components of the bound template, or an empty list before template selection. */
    public List<TemplateComponent> getComponents() {
        return template == null ? List.of() : template.getComponents();
    }

    @Override
    public String toString() {
        return "<Message: " + (template != null ? template.display() : getMainFact()) + " score=" + score + ">";
    }
}
