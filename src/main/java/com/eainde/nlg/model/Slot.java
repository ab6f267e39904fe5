package com.eainde.nlg.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Template placeholder bound to a fact field and rendered into text by the realizers.
 *
 * <p>The slot type always reports the original source field, even after the value has been
 * resolved to text.</p>
 */
public class Slot implements TemplateComponent {

    public static final String CASE = "case";

    private final SlotSource source;
    private Map<String, Object> attributes;
    private Fact fact;
    private SlotValue state;

    public Slot(SlotSource source) {
        this(source, new LinkedHashMap<>(), null);
    }

    public Slot(SlotSource source, Map<String, Object> attributes, Fact fact) {
        this(source, attributes, fact, new SlotValue.Unresolved(source));
    }

    private Slot(SlotSource source, Map<String, Object> attributes, Fact fact, SlotValue state) {
        this.source = source;
        this.attributes = new LinkedHashMap<>(attributes);
        this.fact = fact;
        this.state = state;
    }

    @Override
    public String slotType() {
        return source.fieldName();
    }

    @Override
    public String value() {
        return state.render(fact);
    }

    public SlotSource getSource() {
        return source;
    }

    public SlotValue getState() {
        return state;
    }

    public boolean isResolved() {
        return state.isResolved();
    }

    /** Fixes the display text of this slot. */
    public void resolve(String text) {
        this.state = new SlotValue.Resolved(text);
    }

    public Fact getFact() {
        return fact;
    }

    public void setFact(Fact fact) {
        this.fact = fact;
    }

    /** Live attribute map (case, ord, abs, name_type, ...). */
    public Map<String, Object> getAttributes() {
        return attributes;
    }

    public void setAttributes(Map<String, Object> attributes) {
        this.attributes = new LinkedHashMap<>(attributes);
    }

    public Object attribute(String name) {
        return attributes.get(name);
    }

    /** Truthiness of an attribute the way template flags are written: {@code {value, abs}}. */
    public boolean hasFlag(String name) {
        Object value = attributes.get(name);
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean flag) {
            return flag;
        }
        return !String.valueOf(value).isEmpty();
    }

    /** Copy without the bound fact. The resolution state is carried over. */
    @Override
    public Slot copy() {
        return copy(false);
    }

    public Slot copy(boolean includeFact) {
        return new Slot(source, attributes, includeFact ? fact : null, state);
    }

    @Override
    public String toString() {
        String value;
        try {
            value = value();
        } catch (IllegalStateException unbound) {
            value = source.toString();
        }
        String attrs = attributes.entrySet().stream()
                .map(e -> ", " + e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining());
        return "Slot(" + value + attrs + ")";
    }
}
