package com.eainde.nlg.data;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * One row of a dataset: the location and time columns plus any number of value columns named by
 * value type ({@code cphi:hicp2015:cp-hi00}) and their {@code :outlierness} sidecars.
 */
public final class DataRow {

    public static final String LOCATION = "location";
    public static final String LOCATION_TYPE = "location_type";
    public static final String TIMESTAMP = "timestamp";
    public static final String TIMESTAMP_TYPE = "timestamp_type";
    public static final String AGENT = "agent";
    public static final String AGENT_TYPE = "agent_type";

    public static final Set<String> KEY_COLUMNS =
            Set.of(LOCATION, LOCATION_TYPE, TIMESTAMP, TIMESTAMP_TYPE, AGENT, AGENT_TYPE);

    private final Map<String, Object> columns;

    public DataRow(Map<String, Object> columns) {
        this.columns = new LinkedHashMap<>(columns);
    }

    public Set<String> columnNames() {
        return columns.keySet();
    }

    public Object get(String column) {
        return columns.get(column);
    }

    public String getString(String column) {
        Object value = columns.get(column);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number && number.doubleValue() == Math.rint(number.doubleValue())) {
            return Long.toString(number.longValue());
        }
        return String.valueOf(value);
    }

    public String location() {
        return getString(LOCATION);
    }

    public String locationType() {
        return getString(LOCATION_TYPE);
    }

    /** {@code 2020} for yearly rows, {@code 2020M03} for monthly ones. */
    public String timestamp() {
        return getString(TIMESTAMP);
    }

    public String timestampType() {
        return getString(TIMESTAMP_TYPE);
    }

    /**
     * @return the numeric value of a column, or null when it is missing, empty or not a number
     */
    public Double getNumber(String column) {
        Double number = getDouble(column);
        return number == null || Double.isNaN(number) ? null : number;
    }

    /** Like {@link #getNumber(String)} but keeps NaN, which outlierness columns use for "undefined". */
    public Double getDouble(String column) {
        Object value = columns.get(column);
        double number;
        if (value instanceof Number n) {
            number = n.doubleValue();
        } else if (value instanceof String text && !text.isBlank()) {
            try {
                number = Double.parseDouble(text.strip());
            } catch (NumberFormatException e) {
                return null;
            }
        } else {
            return null;
        }
        return number;
    }

    @Override
    public String toString() {
        return "DataRow" + columns;
    }
}
