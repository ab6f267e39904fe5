package com.eainde.nlg.model;

import java.io.Serializable;

/**
 * Where a slot takes its display value from when it is still unresolved.
 */
public interface SlotSource extends Serializable {

    String fieldName();

    /** Whether {@link #valueOf(Fact)} needs a bound fact. */
    default boolean needsFact() {
        return true;
    }

    String valueOf(Fact fact);

    /** Projection of a plain fact field, e.g. {@code {value_type}}. */
    record FactFieldSource(String fieldName) implements SlotSource {
        public FactFieldSource {
            if (!Fact.isField(fieldName)) {
                throw new IllegalArgumentException("Unknown fact field: " + fieldName);
            }
        }

        @Override
        public String valueOf(Fact fact) {
            Object value = fact.field(fieldName);
            return value == null ? "" : String.valueOf(value);
        }

        @Override
        public String toString() {
            return "fact." + fieldName;
        }
    }

    /** Quoted literal inside braces, e.g. {@code {"EU", case=gen}}. */
    record LiteralSource(String text) implements SlotSource {
        public static final String FIELD_NAME = "literal";

        @Override
        public String fieldName() {
            return FIELD_NAME;
        }

        @Override
        public boolean needsFact() {
            return false;
        }

        @Override
        public String valueOf(Fact fact) {
            return text;
        }

        @Override
        public String toString() {
            return '"' + text + '"';
        }
    }

    /** {@code {time}}: renders {@code [TIME:<timestamp_type>:<timestamp>]} for the date realizer. */
    record TimeSource() implements SlotSource {
        public static final String FIELD_NAME = "time";

        @Override
        public String fieldName() {
            return FIELD_NAME;
        }

        @Override
        public String valueOf(Fact fact) {
            return "[TIME:" + fact.timestampType() + ":" + fact.timestamp() + "]";
        }

        @Override
        public String toString() {
            return "fact.time";
        }
    }

    /** {@code {unit}}: renders {@code [UNIT:<value_type>]} for the unit realizers. */
    record UnitSource() implements SlotSource {
        public static final String FIELD_NAME = "unit";

        @Override
        public String fieldName() {
            return FIELD_NAME;
        }

        @Override
        public String valueOf(Fact fact) {
            return "[UNIT:" + fact.valueType() + "]";
        }

        @Override
        public String toString() {
            return "fact.unit";
        }
    }
}
