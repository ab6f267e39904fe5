package com.eainde.nlg.planner;

/**
 * Tunable limits and thresholds of the document planner.
 *
 * @param maxParagraphs                 upper bound on body paragraphs
 * @param maxSatellites                 satellites per nucleus, at most
 * @param minSatellites                 satellites per nucleus the planner tries to reach ignoring thresholds
 * @param newParagraphAbsoluteThreshold nucleus score below which no new paragraph starts
 * @param satelliteRelativeThreshold    fraction of the nucleus score a satellite candidate should beat
 * @param satelliteAbsoluteThreshold    score a satellite candidate should beat
 * @param nucleusWeight                 weight of the nucleus against the previous satellite when re-scoring
 * @param laterParagraphFactor          fraction of the first nucleus score required from the third paragraph on
 * @param overviewTopicCount            covered topics after which a document without new topics is complete
 */
public record PlannerSettings(
        int maxParagraphs,
        int maxSatellites,
        int minSatellites,
        double newParagraphAbsoluteThreshold,
        double satelliteRelativeThreshold,
        double satelliteAbsoluteThreshold,
        double nucleusWeight,
        double laterParagraphFactor,
        int overviewTopicCount
) {

    public PlannerSettings {
        if (maxParagraphs < 1) {
            throw new IllegalArgumentException("maxParagraphs must be positive");
        }
        if (minSatellites < 0 || maxSatellites < minSatellites) {
            throw new IllegalArgumentException("Need 0 <= minSatellites <= maxSatellites, got "
                    + minSatellites + ".." + maxSatellites);
        }
        if (nucleusWeight <= 0) {
            throw new IllegalArgumentException("nucleusWeight must be positive");
        }
    }

    public static PlannerSettings defaults() {
        return new PlannerSettings(3, 5, 2, 0.5, 0.5, 0.2, 1.0, 0.3, 2);
    }

    public PlannerSettings withNewParagraphAbsoluteThreshold(double threshold) {
        return new PlannerSettings(maxParagraphs, maxSatellites, minSatellites, threshold,
                satelliteRelativeThreshold, satelliteAbsoluteThreshold, nucleusWeight, laterParagraphFactor,
                overviewTopicCount);
    }
}
