package com.eainde.nlg.model;

import java.io.Serializable;
import java.util.List;

/**
 * Left-hand side of a matcher (or a referenced right-hand side): the value a rule compares.
 */
public interface LhsExpr extends Serializable {

    /**
     * @param fact      candidate fact being tested
     * @param usedFacts facts already bound by earlier rules of the same template
     * @return the projected value, or {@code null} when it cannot be resolved
     */
    Object evaluate(Fact fact, List<Fact> usedFacts);

    /** {@code value_type}: a field of the candidate fact. */
    record FactField(String fieldName) implements LhsExpr {
        public FactField {
            if (!Fact.isField(fieldName)) {
                throw new IllegalArgumentException("Unknown fact field: " + fieldName);
            }
        }

        @Override
        public Object evaluate(Fact fact, List<Fact> usedFacts) {
            return fact.field(fieldName);
        }

        @Override
        public String toString() {
            return "fact." + fieldName;
        }
    }

    /** {@code 0.location}: a field of the n-th fact already bound by this template. */
    record ReferentialExpr(int referenceIndex, String fieldName) implements LhsExpr {
        public ReferentialExpr {
            if (referenceIndex < 0) {
                throw new IllegalArgumentException("Negative reference index: " + referenceIndex);
            }
            if (!Fact.isField(fieldName)) {
                throw new IllegalArgumentException("Unknown fact field: " + fieldName);
            }
        }

        @Override
        public Object evaluate(Fact fact, List<Fact> usedFacts) {
            if (referenceIndex >= usedFacts.size()) {
                return null;
            }
            return usedFacts.get(referenceIndex).field(fieldName);
        }

        @Override
        public String toString() {
            return "all[" + referenceIndex + "]." + fieldName;
        }
    }
}
