package com.eainde.nlg.data;

import com.eainde.nlg.exception.NlgException;
import com.eainde.nlg.exception.NoMessagesForSelectionException;
import com.eainde.nlg.model.Fact;
import com.eainde.nlg.model.Message;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Turns dataset rows into one message per value column.
 *
 * <p>Old rows are skipped: monthly statistics are kept for the current and previous year, yearly
 * statistics for the last three years, relative to the reference clock.</p>
 */
@Slf4j
@Component
public class MessageGenerator {

    public static final String ALL_LOCATIONS = "all";

    static final String OUTLIERNESS_SUFFIX = ":outlierness";
    static final String GROUPED_BY_TIME_OUTLIERNESS_SUFFIX = ":grouped_by_time:outlierness";

    private final DatasetRegistry datasets;
    private final Clock clock;

    public MessageGenerator(DatasetRegistry datasets, Clock clock) {
        this.datasets = datasets;
        this.clock = clock;
    }

    public ExtractedMessages generate(String dataset, String location) {
        return generate(dataset, location, Set.of());
    }

    /**
     * @param location      location id, or {@code all} to make every row core
     * @param ignoredColumns value columns to leave out
     * @throws NoMessagesForSelectionException if nothing is known about the location
     */
    public ExtractedMessages generate(String dataset, String location, Collection<String> ignoredColumns) {
        log.info("Generating messages with location={}, dataset={}", location, dataset);
        DatasetSource source = datasets.get(dataset)
                .orElseThrow(() -> new NlgException("Unknown dataset: " + dataset));

        List<DataRow> coreRows;
        List<DataRow> expandedRows;
        if (ALL_LOCATIONS.equals(location)) {
            coreRows = source.all();
            expandedRows = List.of();
        } else {
            coreRows = source.query(row -> Objects.equals(row.location(), location));
            expandedRows = source.query(row -> !Objects.equals(row.location(), location));
        }

        List<Message> core = new ArrayList<>();
        List<Message> expanded = new ArrayList<>();
        int currentYear = LocalDate.now(clock).getYear();
        coreRows.forEach(row -> toMessages(row, ignoredColumns, currentYear, core));
        expandedRows.forEach(row -> toMessages(row, ignoredColumns, currentYear, expanded));

        log.info("Extracted total {} core messages and {} expanded messages", core.size(), expanded.size());
        if (core.isEmpty()) {
            throw new NoMessagesForSelectionException("No core messages for " + location + " in " + dataset);
        }
        return new ExtractedMessages(core, expanded);
    }

    private void toMessages(DataRow row, Collection<String> ignoredColumns, int currentYear, List<Message> out) {
        String timestamp = row.timestamp();
        String timestampType = row.timestampType();
        if (timestamp == null || tooOld(timestamp, timestampType, currentYear)) {
            return;
        }
        for (String column : row.columnNames()) {
            if (!isValueColumn(column, ignoredColumns)) {
                continue;
            }
            Double value = row.getNumber(column);
            if (value == null) {
                continue;
            }
            Fact fact = new Fact(
                    "[ENTITY:" + row.locationType() + ":" + row.location() + "]",
                    row.locationType(),
                    value,
                    column,
                    row.getString(DataRow.AGENT),
                    row.getString(DataRow.AGENT_TYPE),
                    timestamp,
                    timestampType,
                    outlierness(row, column));
            out.add(new Message(fact));
        }
    }

    static boolean isValueColumn(String column, Collection<String> ignoredColumns) {
        return !DataRow.KEY_COLUMNS.contains(column)
                && !ignoredColumns.contains(column)
                && !column.contains(OUTLIERNESS_SUFFIX);
    }

    static boolean tooOld(String timestamp, String timestampType, int currentYear) {
        try {
            if ("month".equals(timestampType)) {
                return Integer.parseInt(timestamp.split("M")[0]) < currentYear - 1;
            }
            if ("year".equals(timestampType)) {
                return Integer.parseInt(timestamp) < currentYear - 3;
            }
        } catch (NumberFormatException e) {
            log.warn("Skipping row with malformed {} timestamp {}", timestampType, timestamp);
            return true;
        }
        return false;
    }

    /** Falls back to the grouped-by-time score when the plain one is missing or zero. */
    private static Double outlierness(DataRow row, String column) {
        Double outlierness = row.getDouble(column + OUTLIERNESS_SUFFIX);
        if (outlierness == null || outlierness == 0.0) {
            Double grouped = row.getDouble(column + GROUPED_BY_TIME_OUTLIERNESS_SUFFIX);
            if (grouped != null) {
                return grouped;
            }
        }
        return outlierness;
    }
}
