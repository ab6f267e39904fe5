package com.eainde.nlg.scoring;

import com.eainde.nlg.model.Fact;
import com.eainde.nlg.model.Message;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Assigns the newsworthiness score of every message.
 *
 * <p>The score is the product of a value type factor, the outlierness of the fact, a recency
 * factor and the importance coefficient of the message. Recency decays with the inverse square of
 * the distance in years from the reference clock. Monthly facts are interpolated between their own
 * year and the year before on a 13 month scale, which keeps a whole year slightly ahead of its
 * December.</p>
 */
@Slf4j
@Component
public class ImportanceScorer {

    static final double START_INCREASE = 10;
    static final double EXP_BASE = 1.1;

    private static final List<String> IGNORED_AGE_GROUPS = List.of(
            "y-lt6", "y6-10", "y6-11", "y11-15", "y12-17", "y-lt16", "y16-24", "y16-64", "y-ge16", "y-lt18");

    private final Clock clock;

    public ImportanceScorer(Clock clock) {
        this.clock = clock;
    }

    // ===== Public API =====

    /**
     * Scores the core and expanded pools. When messages of a previously generated article are
     * given, core messages about the same statistics are boosted and expanded messages about the
     * previously covered locations are damped so that at most one of them repeats.
     */
    public ScoredPools scoreAll(List<Message> core, List<Message> expanded, List<Message> previous) {
        score(core);
        score(expanded);

        if (previous != null && !previous.isEmpty()) {
            boostCohesion(core, previous);
            dampRepetition(expanded, previous);
        }
        return new ScoredPools(sortedByScore(core), sortedByScore(expanded));
    }

    /** Scores in place and returns the messages best first. The sort is stable. */
    public List<Message> score(List<Message> messages) {
        for (Message message : messages) {
            message.setScore(scoreSingle(message));
        }
        return sortedByScore(messages);
    }

    public double scoreSingle(Message message) {
        Fact fact = message.getMainFact();
        String valueType = fact.valueType();

        double outlier = fact.outlierness() == null || fact.outlierness() == 0.0 ? 1.0 : fact.outlierness();
        if (Double.isNaN(outlier)) {
            outlier = 0.0;
        }

        double valueTypeScore = 1.0;
        if (valueType.contains("_trend")) {
            valueTypeScore *= 500;
        }
        if (valueType.contains("_nac")) {
            return 0.0;
        } else if (valueType.contains("_pps")) {
            valueTypeScore *= 10;
        } else if (valueType.contains("_eur")) {
            valueTypeScore *= 40;
        }
        for (String ageGroup : IGNORED_AGE_GROUPS) {
            if (valueType.contains(ageGroup)) {
                return 0.0;
            }
        }
        if (valueType.contains("_t_")) {
            return 0.0;
        }

        double score = valueTypeScore * outlier * timestampScore(fact);

        if (valueType.contains("_rank")) {
            score *= Math.pow(0.7, fact.value() - 1);
        }
        if (valueType.contains("_reverse")) {
            score *= valueType.contains("_change") ? 0.7 : 0.25;
        }
        return score * message.getImportanceCoefficient();
    }

    // ===== Internals =====

    double timestampScore(Fact fact) {
        int nowYear = LocalDate.now(clock).getYear();
        double timestampScore = 20;
        if ("year".equals(fact.timestampType())) {
            int year = Integer.parseInt(fact.timestamp());
            timestampScore *= decay(nowYear, year);
            timestampScore *= 2;
        } else if ("month".equals(fact.timestampType())) {
            String[] parts = fact.timestamp().split("M");
            int year = Integer.parseInt(parts[0]);
            int month = Integer.parseInt(parts[1]);
            double thisYear = decay(nowYear, year);
            double prevYear = decay(nowYear, year - 1);
            double monthEffect = (thisYear - prevYear) / 13 * (13 - month);
            timestampScore *= thisYear - monthEffect;
        }
        return timestampScore;
    }

    /** min(1, 1 / (nowYear + 1 - year)^2), with years at or beyond the reference counting as current. */
    private static double decay(int nowYear, int year) {
        int distance = nowYear + 1 - year;
        if (distance <= 0) {
            return 1.0;
        }
        return Math.min(1.0, 1.0 / ((double) distance * distance));
    }

    private void boostCohesion(List<Message> core, List<Message> previous) {
        Map<String, Double> previousScores = new HashMap<>();
        for (Message message : previous) {
            Fact fact = message.getMainFact();
            previousScores.put(fact.valueType() + "|" + fact.timestamp(), message.getScore());
        }
        for (Message message : core) {
            Fact fact = message.getMainFact();
            double coefficient = previousScores.getOrDefault(fact.valueType() + "|" + fact.timestamp(), 0.0)
                    / START_INCREASE + 1;
            log.debug("Cohesion coefficient {} for {}", coefficient, message);
            message.setScore(message.getScore() * coefficient);
        }
    }

    private void dampRepetition(List<Message> expanded, List<Message> previous) {
        Set<String> previousLocations = new HashSet<>();
        previous.forEach(m -> previousLocations.add(m.getMainFact().location()));

        OptionalDouble maxPrevious = expanded.stream()
                .filter(m -> previousLocations.contains(m.getMainFact().location()))
                .mapToDouble(Message::getScore)
                .max();
        if (maxPrevious.isEmpty()) {
            return;
        }
        double denominator = Math.pow(EXP_BASE, maxPrevious.getAsDouble());
        for (Message message : expanded) {
            if (previousLocations.contains(message.getMainFact().location())) {
                message.setScore(message.getScore() * Math.pow(EXP_BASE, message.getScore()) / denominator);
            }
        }
    }

    private static List<Message> sortedByScore(List<Message> messages) {
        List<Message> sorted = new ArrayList<>(messages);
        sorted.sort(Comparator.comparingDouble(Message::getScore).reversed());
        return sorted;
    }
}
