package com.eainde.nlg.data;

import com.eainde.nlg.config.NlgProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The datasets named in {@code nlg.datasets}, loaded once at startup.
 */
@Slf4j
@Component
public class DatasetRegistry {

    private final Map<String, DatasetSource> sources = new LinkedHashMap<>();

    @Autowired
    public DatasetRegistry(NlgProperties properties, ObjectMapper objectMapper) {
        ResourceLoader loader = new DefaultResourceLoader();
        properties.getDatasets().forEach((name, location) -> {
            Resource resource = loader.getResource(location);
            try (InputStream in = resource.getInputStream()) {
                register(JsonDatasetSource.read(name, in, objectMapper));
            } catch (IOException e) {
                throw new UncheckedIOException("Could not load dataset " + name + " from " + location, e);
            }
        });
    }

    public DatasetRegistry(Collection<? extends DatasetSource> sources) {
        sources.forEach(this::register);
    }

    private void register(DatasetSource source) {
        sources.put(source.name(), source);
    }

    public Optional<DatasetSource> get(String name) {
        return Optional.ofNullable(sources.get(name));
    }

    public Set<String> names() {
        return sources.keySet();
    }
}
