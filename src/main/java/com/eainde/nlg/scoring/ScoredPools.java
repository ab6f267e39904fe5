package com.eainde.nlg.scoring;

import com.eainde.nlg.model.Message;

import java.util.List;

/**
 * Scored and re-sorted message pools.
 *
 * @param core     messages about the requested location, best first
 * @param expanded messages about other locations, best first
 */
public record ScoredPools(List<Message> core, List<Message> expanded) {
}
