package com.eainde.nlg.model;

import java.io.Serializable;
import java.util.List;

/**
 * One fact requirement of a template.
 *
 * @param matchers     constraints the fact must satisfy
 * @param slotIndices  component indices of the slots filled from the matching fact
 * @param reuseAllowed whether a fact already bound by an earlier rule may satisfy this one
 */
public record Rule(List<Matcher> matchers, List<Integer> slotIndices, boolean reuseAllowed) implements Serializable {

    public Rule {
        matchers = List.copyOf(matchers);
        slotIndices = List.copyOf(slotIndices);
    }

    public Rule(List<Matcher> matchers, List<Integer> slotIndices) {
        this(matchers, slotIndices, false);
    }

    public boolean matches(Fact fact, List<Fact> usedFacts) {
        for (Matcher matcher : matchers) {
            if (!matcher.test(fact, usedFacts)) {
                return false;
            }
        }
        return true;
    }
}
