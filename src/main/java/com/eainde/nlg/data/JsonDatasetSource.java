package com.eainde.nlg.data;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Dataset held in memory, read from a JSON array of row objects.
 */
@Slf4j
public class JsonDatasetSource implements DatasetSource {

    private final String name;
    private final List<DataRow> rows;

    public JsonDatasetSource(String name, List<DataRow> rows) {
        this.name = name;
        this.rows = List.copyOf(rows);
    }

    public static JsonDatasetSource read(String name, InputStream in, ObjectMapper objectMapper) throws IOException {
        List<Map<String, Object>> raw = objectMapper.readValue(in, new TypeReference<>() {
        });
        List<DataRow> rows = raw.stream().map(DataRow::new).toList();
        log.info("Loaded dataset {} with {} rows", name, rows.size());
        return new JsonDatasetSource(name, rows);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public List<DataRow> query(Predicate<DataRow> predicate) {
        return rows.stream().filter(predicate).toList();
    }

    @Override
    public List<DataRow> all() {
        return rows;
    }
}
