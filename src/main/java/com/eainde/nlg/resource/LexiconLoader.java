package com.eainde.nlg.resource;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Reads classpath JSON lexicons and text resources.
 */
@Slf4j
@Component
public class LexiconLoader {

    private final ObjectMapper objectMapper;

    public LexiconLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public <T> T readJson(String location, TypeReference<T> type) {
        try (InputStream in = new ClassPathResource(location).getInputStream()) {
            T value = objectMapper.readValue(in, type);
            log.debug("Loaded lexicon {}", location);
            return value;
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read lexicon " + location, e);
        }
    }

    public String readText(String location) {
        try (InputStream in = new ClassPathResource(location).getInputStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read resource " + location, e);
        }
    }
}
