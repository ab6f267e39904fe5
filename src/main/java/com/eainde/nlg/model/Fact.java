package com.eainde.nlg.model;

import java.io.Serializable;
import java.util.List;

/**
 * One observed statistic, e.g. the harmonized consumer price index of Finland in 2020.
 *
 * <p>Facts are created during extraction and never mutated. Templates and matchers address the
 * fields by their snake_case names ({@code value_type}, {@code timestamp_type}, ...), see
 * {@link #field(String)}.</p>
 */
public record Fact(
        String location,
        String locationType,
        double value,
        String valueType,
        String agent,
        String agentType,
        String timestamp,
        String timestampType,
        Double outlierness
) implements Serializable {

    public static final String LOCATION = "location";
    public static final String LOCATION_TYPE = "location_type";
    public static final String VALUE = "value";
    public static final String VALUE_TYPE = "value_type";
    public static final String AGENT = "agent";
    public static final String AGENT_TYPE = "agent_type";
    public static final String TIMESTAMP = "timestamp";
    public static final String TIMESTAMP_TYPE = "timestamp_type";
    public static final String OUTLIERNESS = "outlierness";

    public static final List<String> FIELDS = List.of(
            LOCATION, LOCATION_TYPE, VALUE, VALUE_TYPE, AGENT, AGENT_TYPE, TIMESTAMP, TIMESTAMP_TYPE, OUTLIERNESS);

    public static boolean isField(String fieldName) {
        return FIELDS.contains(fieldName);
    }

    /**
     * Projects a field by its template name. The value is returned as a {@link Double} so that
     * matchers can compare it numerically.
     *
     * @throws IllegalArgumentException for names that are not fact fields
     */
    public Object field(String fieldName) {
        return switch (fieldName) {
            case LOCATION -> location;
            case LOCATION_TYPE -> locationType;
            case VALUE -> value;
            case VALUE_TYPE -> valueType;
            case AGENT -> agent;
            case AGENT_TYPE -> agentType;
            case TIMESTAMP -> timestamp;
            case TIMESTAMP_TYPE -> timestampType;
            case OUTLIERNESS -> outlierness;
            default -> throw new IllegalArgumentException("Unknown fact field: " + fieldName);
        };
    }

    @Override
    public String toString() {
        return "Fact(" + location + ", " + valueType + "=" + value + " @ " + timestampType + ":" + timestamp + ")";
    }
}
