package com.eainde.nlg.model;

import java.io.Serializable;

/**
 * Resolution state of a slot: still reading from its source, or fixed to rendered text.
 */
public interface SlotValue extends Serializable {

    String render(Fact fact);

    boolean isResolved();

    record Unresolved(SlotSource source) implements SlotValue {
        @Override
        public String render(Fact fact) {
            if (source.needsFact() && fact == null) {
                throw new IllegalStateException("Slot " + source + " is not bound to a fact");
            }
            return source.valueOf(fact);
        }

        @Override
        public boolean isResolved() {
            return false;
        }
    }

    record Resolved(String text) implements SlotValue {
        @Override
        public String render(Fact fact) {
            return text;
        }

        @Override
        public boolean isResolved() {
            return true;
        }
    }
}
