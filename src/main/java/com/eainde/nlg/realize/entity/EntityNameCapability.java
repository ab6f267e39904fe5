package com.eainde.nlg.realize.entity;

import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Produces the surface form of an entity for one language, entity type and name type.
 */
@FunctionalInterface
public interface EntityNameCapability {

    String resolve(String entity, Random random);

    /** Dictionary lookup. Unknown ids render as {@code UNKNOWN-ENTITY:<id>}. */
    static EntityNameCapability dictionary(Map<String, String> names) {
        Map<String, String> copy = Map.copyOf(names);
        return (entity, random) -> copy.getOrDefault(entity, "UNKNOWN-ENTITY:" + entity);
    }

    /** One of a fixed set of variants, whatever the entity. */
    static EntityNameCapability variants(List<String> variants) {
        List<String> copy = List.copyOf(variants);
        if (copy.isEmpty()) {
            throw new IllegalArgumentException("At least one variant is required");
        }
        return (entity, random) -> copy.get(random.nextInt(copy.size()));
    }
}
