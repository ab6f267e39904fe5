package com.eainde.nlg.resource;

import com.eainde.nlg.realize.slot.SlotRealizerComponent;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Language assets for one dataset: the template file and the slot realizers that turn its value
 * types and units into words.
 */
public interface DatasetResource {

    String ANY = "any";

    /** Dataset id, e.g. {@code cphi}. */
    String dataset();

    /** Base languages the templates and realizers cover. */
    Set<String> languages();

    /** Classpath location of the template file. */
    String templateLocation();

    List<SlotRealizerComponent> slotRealizers();

    /** {@code any} matches every language or dataset. Head variants count as their base language. */
    default boolean supports(String language, String dataset) {
        String lang = Languages.base(language).toLowerCase(Locale.ROOT);
        String data = dataset.toLowerCase(Locale.ROOT);
        return (ANY.equals(lang) || languages().contains(lang)) && (ANY.equals(data) || dataset().equals(data));
    }
}
