package com.eainde.nlg.realize.slot;

import com.eainde.nlg.model.Slot;

import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * One rewriting step of slot realization.
 */
public interface SlotRealizerComponent {

    /** Registers a component for every language. */
    String ANY_LANGUAGE = "ANY";

    List<String> supportedLanguages();

    /**
     * @return the components replacing {@code slot}, or empty when this realizer does not apply
     */
    Optional<List<Slot>> realize(Slot slot, Random random);
}
