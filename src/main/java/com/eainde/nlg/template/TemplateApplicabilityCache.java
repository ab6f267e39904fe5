package com.eainde.nlg.template;

import com.eainde.nlg.model.Fact;
import com.eainde.nlg.model.Message;
import com.eainde.nlg.model.Template;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Remembers {@link Template#check} results for one selection run.
 *
 * <p>Keys compare messages and templates by identity, so a cache must not outlive the message
 * objects it was filled with. Create a new one per run.</p>
 */
public class TemplateApplicabilityCache {

    private record CacheKey(Message message, Template template) {
        @Override
        public boolean equals(Object o) {
            return o instanceof CacheKey other && other.message == message && other.template == template;
        }

        @Override
        public int hashCode() {
            return 31 * System.identityHashCode(message) + System.identityHashCode(template);
        }
    }

    private final Map<CacheKey, List<Fact>> results = new HashMap<>();
    private int hits;

    public List<Fact> check(Template template, Message message, List<Message> pool) {
        CacheKey key = new CacheKey(message, template);
        List<Fact> cached = results.get(key);
        if (cached != null) {
            hits++;
            return cached;
        }
        List<Fact> used = List.copyOf(template.check(message, pool));
        results.put(key, used);
        return used;
    }

    public int size() {
        return results.size();
    }

    public int hits() {
        return hits;
    }
}
