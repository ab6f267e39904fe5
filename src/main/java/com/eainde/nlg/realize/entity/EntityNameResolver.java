package com.eainde.nlg.realize.entity;

import com.eainde.nlg.model.DocumentPlanNode;
import com.eainde.nlg.model.Message;
import com.eainde.nlg.model.Slot;
import com.eainde.nlg.model.TemplateComponent;
import com.eainde.nlg.resource.Languages;
import com.eainde.nlg.resource.LexiconLoader;
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replaces {@code [ENTITY:<type>:<id>]} slots with names.
 *
 * <p>The first mention of an entity gets its full name. Mentioning the entity again right after
 * itself gives a pronoun, mentioning it again later a short name. Sets the {@code name_type} and
 * {@code entity_type} attributes for the morphology stage.</p>
 */
@Slf4j
@Component
public class EntityNameResolver {

    public static final String NAME_TYPE = "name_type";
    public static final String ENTITY_TYPE = "entity_type";

    private static final String LOCATION = "lexicon/entity-names.json";
    private static final Pattern ENTITY = Pattern.compile("\\[ENTITY:([^:]+):([^\\]]+)]");

    record EntityNames(Map<String, Map<String, Map<String, String>>> names,
                       Map<String, Map<String, List<String>>> pronouns) {
    }

    /** language -> entity type -> name type -> capability */
    private final Map<String, Map<String, Map<NameType, EntityNameCapability>>> capabilities = new HashMap<>();

    @Autowired
    public EntityNameResolver(LexiconLoader loader) {
        EntityNames lexicon = loader.readJson(LOCATION, new TypeReference<>() {
        });
        lexicon.names().forEach((entityType, byLanguage) -> byLanguage.forEach((language, names) -> {
            EntityNameCapability dictionary = EntityNameCapability.dictionary(names);
            for (NameType nameType : NameType.values()) {
                register(language, entityType, nameType, dictionary);
            }
        }));
        if (lexicon.pronouns() != null) {
            lexicon.pronouns().forEach((language, byType) -> byType.forEach((entityType, variants) ->
                    register(language, entityType, NameType.PRONOUN, EntityNameCapability.variants(variants))));
        }
        log.info("Entity name capabilities for languages {}", capabilities.keySet());
    }

    public EntityNameResolver() {
    }

    public final EntityNameResolver register(String language, String entityType, NameType nameType,
                                             EntityNameCapability capability) {
        capabilities.computeIfAbsent(language, k -> new HashMap<>())
                .computeIfAbsent(entityType, k -> new EnumMap<>(NameType.class))
                .put(nameType, capability);
        return this;
    }

    // ===== Public API =====

    public void resolve(DocumentPlanNode plan, String language, Random random) {
        String base = Languages.base(language);
        Map<String, String> previous = new HashMap<>();
        Set<String> encountered = new HashSet<>();
        for (Message message : plan.messages()) {
            for (TemplateComponent component : message.getComponents()) {
                if (component instanceof Slot slot) {
                    resolveSlot(slot, base, random, previous, encountered);
                }
            }
        }
    }

    private void resolveSlot(Slot slot, String language, Random random, Map<String, String> previous,
                             Set<String> encountered) {
        Matcher match = ENTITY.matcher(slot.value());
        if (!match.matches()) {
            return;
        }
        String entityType = match.group(1);
        String entity = match.group(2);

        NameType nameType;
        if (entity.equals(previous.get(entityType))) {
            nameType = NameType.PRONOUN;
        } else if (encountered.contains(entity)) {
            nameType = NameType.SHORT;
        } else {
            nameType = NameType.FULL;
            encountered.add(entity);
        }
        slot.getAttributes().put(NAME_TYPE, nameType.attribute());

        EntityNameCapability capability = capabilities.getOrDefault(language, Map.of())
                .getOrDefault(entityType, Map.of())
                .get(nameType);
        if (capability == null) {
            log.error("No entity name capability for language {}, entity type {} and name type {}",
                    language, entityType, nameType);
        } else {
            String name = capability.resolve(entity, random);
            slot.resolve(name);
            log.debug("Resolved entity {} of type {} as '{}'", entity, entityType, name);
        }
        slot.getAttributes().put(ENTITY_TYPE, entityType);
        previous.put(entityType, entity);
    }
}
