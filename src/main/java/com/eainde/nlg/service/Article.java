package com.eainde.nlg.service;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A generated article. The body is HTML, the headline plain text.
 */
public record Article(
        @JsonProperty("headline") String headline,
        @JsonProperty("body") String body
) {
}
