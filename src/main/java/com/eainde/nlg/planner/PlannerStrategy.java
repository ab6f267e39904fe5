package com.eainde.nlg.planner;

import com.eainde.nlg.model.Message;

import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * The policy the {@link DocumentPlanner} runs with, as a plain value of three functions and a
 * threshold. Variants are assembled by {@link PlannerStrategies}.
 *
 * @param name                          variant name, for logs
 * @param nucleusSelector               picks the next paragraph lead
 * @param relativeThreshold             minimum score of the next nucleus given the nuclei chosen so far
 * @param satelliteSelector             picks the supporting messages of a nucleus
 * @param newParagraphAbsoluteThreshold minimum score of any nucleus
 */
public record PlannerStrategy(
        String name,
        NucleusSelector nucleusSelector,
        RelativeThreshold relativeThreshold,
        SatelliteSelector satelliteSelector,
        double newParagraphAbsoluteThreshold
) {

    @FunctionalInterface
    public interface NucleusSelector {
        /**
         * @param available      core messages not placed yet
         * @param selectedNuclei nuclei of the previous paragraphs, in order
         * @return the next nucleus, or empty to end the document
         */
        Optional<Message> select(List<Message> available, List<Message> selectedNuclei, Random random);
    }

    @FunctionalInterface
    public interface RelativeThreshold {
        double threshold(List<Message> selectedNuclei);
    }

    @FunctionalInterface
    public interface SatelliteSelector {
        /**
         * Must not modify the given pools. Returned messages are removed from them by the planner.
         */
        List<Message> select(Message nucleus, List<Message> core, List<Message> expanded, Random random);
    }
}
