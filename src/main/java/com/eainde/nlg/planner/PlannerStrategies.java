package com.eainde.nlg.planner;

import com.eainde.nlg.model.Fact;
import com.eainde.nlg.model.Message;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Factory of the planner variants.
 *
 * <ul>
 *   <li>{@code full}: topic and location novelty for nuclei, satellites re-scored against both the
 *   nucleus and the previous satellite, expanded messages allowed.</li>
 *   <li>{@code contextsim}: best nucleus, satellites from the core pool re-scored by topic and context.</li>
 *   <li>{@code earlystop}: best nucleus, best core messages as satellites.</li>
 *   <li>{@code score}: best nucleus, best messages of both pools as satellites.</li>
 *   <li>{@code random}: everything chosen at random.</li>
 * </ul>
 */
@Slf4j
public final class PlannerStrategies {

    public static final String FULL = "full";
    public static final String CONTEXT_SIM = "contextsim";
    public static final String EARLY_STOP = "earlystop";
    public static final String SCORE = "score";
    public static final String RANDOM = "random";

    public static final List<String> VARIANTS = List.of(FULL, CONTEXT_SIM, EARLY_STOP, SCORE, RANDOM);

    private PlannerStrategies() {
    }

    public static PlannerStrategy forVariant(String variant, PlannerSettings settings) {
        Objects.requireNonNull(variant, "variant");
        return switch (variant.toLowerCase(Locale.ROOT)) {
            case FULL -> full(settings);
            case CONTEXT_SIM -> contextSim(settings);
            case EARLY_STOP -> earlyStop(settings);
            case SCORE -> score(settings);
            case RANDOM -> random(settings);
            default -> throw new IllegalArgumentException("Unknown planner variant '" + variant
                    + "'. Must be one of: " + String.join(", ", VARIANTS));
        };
    }

    // ===== Variants =====

    public static PlannerStrategy full(PlannerSettings settings) {
        Rescorer rescorer = (candidates, nucleus, previous) -> {
            Map<Message, Double> versusNucleus = new IdentityHashMap<>();
            for (ScoredMessage scored : strictContext(analysisSimilarity(candidates, nucleus, 3), nucleus)) {
                versusNucleus.put(scored.message(), scored.score());
            }
            double weight = settings.nucleusWeight();
            List<ScoredMessage> averaged = new ArrayList<>();
            for (ScoredMessage scored : strictContext(analysisSimilarity(candidates, previous, 3), previous)) {
                double average = (weight * versusNucleus.get(scored.message()) + scored.score()) / (weight + 1);
                averaged.add(scored.withScore(average));
            }
            return averaged;
        };
        return new PlannerStrategy(
                FULL,
                (available, selected, random) -> novelNucleus(available, selected, settings),
                relativeThreshold(0.0, settings),
                (nucleus, core, expanded, random) -> greedySatellites(nucleus, core, expanded, rescorer, settings),
                settings.newParagraphAbsoluteThreshold());
    }

    public static PlannerStrategy contextSim(PlannerSettings settings) {
        Rescorer rescorer = (candidates, nucleus, previous) -> lenientContext(
                analysisSimilarity(analysisSimilarity(candidates, previous, 0), nucleus, 0), previous);
        return new PlannerStrategy(
                CONTEXT_SIM,
                (available, selected, random) -> bestNucleus(available),
                relativeThreshold(0.1, settings),
                (nucleus, core, expanded, random) -> greedySatellites(nucleus, core, List.of(), rescorer, settings),
                settings.newParagraphAbsoluteThreshold());
    }

    public static PlannerStrategy earlyStop(PlannerSettings settings) {
        return new PlannerStrategy(
                EARLY_STOP,
                (available, selected, random) -> bestNucleus(available),
                relativeThreshold(0.1, settings),
                (nucleus, core, expanded, random) -> topN(core, settings.maxSatellites()),
                settings.newParagraphAbsoluteThreshold());
    }

    public static PlannerStrategy score(PlannerSettings settings) {
        return new PlannerStrategy(
                SCORE,
                (available, selected, random) -> bestNucleus(available),
                selected -> Double.NEGATIVE_INFINITY,
                (nucleus, core, expanded, random) -> {
                    List<Message> pool = new ArrayList<>(core);
                    pool.addAll(expanded);
                    return topN(pool, settings.maxSatellites());
                },
                settings.newParagraphAbsoluteThreshold());
    }

    public static PlannerStrategy random(PlannerSettings settings) {
        return new PlannerStrategy(
                RANDOM,
                (available, selected, random) -> available.isEmpty()
                        ? Optional.empty()
                        : Optional.of(available.get(random.nextInt(available.size()))),
                selected -> Double.NEGATIVE_INFINITY,
                (nucleus, core, expanded, random) -> {
                    List<Message> pool = new ArrayList<>(core);
                    pool.addAll(expanded);
                    List<Message> satellites = new ArrayList<>();
                    while (!pool.isEmpty() && satellites.size() < settings.maxSatellites()) {
                        Collections.shuffle(pool, random);
                        satellites.add(pool.remove(pool.size() - 1));
                    }
                    return satellites;
                },
                0.0);
    }

    // ===== Nucleus selection =====

    static String topic(Message message, int segments) {
        String[] parts = message.getMainFact().valueType().split(":");
        return String.join(":", Arrays.asList(parts).subList(0, Math.min(segments, parts.length)));
    }

    /**
     * Prefers a topic and location pair no earlier nucleus covered. Without any, an overview
     * document (at least {@code overviewTopicCount} distinct pairs) is finished, while a document
     * about a single topic goes in depth.
     */
    static Optional<Message> novelNucleus(List<Message> availableMessages, List<Message> selectedNuclei,
                                          PlannerSettings settings) {
        Set<String> coveredTopics = selectedNuclei.stream()
                .map(nucleus -> topic(nucleus, 3) + "@" + nucleus.getMainFact().location())
                .collect(Collectors.toCollection(LinkedHashSet::new));
        log.debug("Already talked about {}", coveredTopics);

        List<Message> available = new ArrayList<>();
        for (Message message : availableMessages) {
            if (!coveredTopics.contains(topic(message, 3) + "@" + message.getMainFact().location())) {
                available.add(message);
            }
        }

        if (available.isEmpty()) {
            if (coveredTopics.size() >= settings.overviewTopicCount()) {
                log.debug("{} topics covered and nothing new available, stopping", coveredTopics.size());
                return Optional.empty();
            }
            if (!coveredTopics.isEmpty()) {
                log.debug("No new topics to cover but only one covered so far, relaxing criteria");
                available = new ArrayList<>(availableMessages);
            }
        }
        return bestNucleus(available);
    }

    static Optional<Message> bestNucleus(List<Message> available) {
        Optional<Message> best = available.stream()
                .sorted(Comparator.comparingDouble(Message::getScore).reversed())
                .findFirst();
        best.ifPresent(nucleus -> log.debug("Most interesting thing is {}, selecting it as a nucleus", nucleus));
        return best;
    }

    /** No limit for the first paragraph, {@code secondFactor} of the first score for the second. */
    private static PlannerStrategy.RelativeThreshold relativeThreshold(double secondFactor, PlannerSettings settings) {
        return selected -> {
            if (selected.isEmpty()) {
                return Double.NEGATIVE_INFINITY;
            }
            double first = selected.get(0).getScore();
            return selected.size() == 1 ? secondFactor * first : settings.laterParagraphFactor() * first;
        };
    }

    // ===== Satellite selection =====

    @FunctionalInterface
    interface Rescorer {
        List<ScoredMessage> rescore(List<ScoredMessage> candidates, Message nucleus, Message previous);
    }

    private static List<Message> topN(List<Message> pool, int n) {
        return pool.stream()
                .sorted(Comparator.comparingDouble(Message::getScore).reversed())
                .limit(n)
                .toList();
    }

    /**
     * Grows the satellite list one message at a time, re-scoring what is left after every pick.
     * Expanded messages are damped by their distance from the last core satellite.
     */
    static List<Message> greedySatellites(Message nucleus, List<Message> core, List<Message> expanded,
                                          Rescorer rescorer, PlannerSettings settings) {
        List<Message> availableCore = new ArrayList<>(core);
        List<Message> availableExpanded = new ArrayList<>(expanded);
        List<Message> satellites = new ArrayList<>();

        Message previous = nucleus;
        int distanceFromCore = 1;
        while (true) {
            List<ScoredMessage> candidates = new ArrayList<>();
            for (Message message : availableCore) {
                if (message.getScore() > 0) {
                    candidates.add(new ScoredMessage(message.getScore(), message));
                }
            }
            for (Message message : availableExpanded) {
                if (message.getScore() > 0) {
                    candidates.add(new ScoredMessage(message.getScore() / (distanceFromCore + 1), message));
                }
            }
            List<ScoredMessage> rescored = rescorer.rescore(candidates, nucleus, previous);

            List<ScoredMessage> passing = new ArrayList<>();
            for (ScoredMessage scored : rescored) {
                if (scored.score() > settings.satelliteRelativeThreshold() * nucleus.getScore()
                        || scored.score() > settings.satelliteAbsoluteThreshold()) {
                    passing.add(scored);
                }
            }

            if (passing.isEmpty()) {
                if (satellites.size() >= settings.minSatellites()) {
                    log.debug("Minimum satellites reached and no candidate passes the thresholds");
                    return satellites;
                }
                if (rescored.isEmpty()) {
                    log.debug("Ran out of satellite candidates at {}", satellites.size());
                    return satellites;
                }
                log.debug("No candidate passes the thresholds, below minimum satellites, trying without filter");
                passing = new ArrayList<>(rescored);
            }

            if (satellites.size() >= settings.maxSatellites()) {
                return satellites;
            }

            passing.sort(Comparator.comparingDouble(ScoredMessage::score).reversed());
            ScoredMessage selected = passing.get(0);
            Message satellite = selected.message();
            satellites.add(satellite);
            log.debug("Added satellite {} (temp score {})", satellite, selected.score());

            if (removeByIdentity(availableCore, satellite)) {
                distanceFromCore = 1;
            } else {
                removeByIdentity(availableExpanded, satellite);
                distanceFromCore++;
            }
            previous = satellite;
        }
    }

    /**
     * Weighs candidates by the longest value type prefix they share with {@code previous}: the
     * n-th longest prefix divides the score by n. Candidates sharing nothing score zero, as do those
     * off the topic of {@code previous} when {@code topicSegments} is positive.
     */
    static List<ScoredMessage> analysisSimilarity(List<ScoredMessage> candidates, Message previous, int topicSegments) {
        List<ScoredMessage> weighted = new ArrayList<>();
        List<ScoredMessage> remaining = new ArrayList<>();
        if (topicSegments > 0) {
            String previousTopic = topic(previous, topicSegments);
            for (ScoredMessage scored : candidates) {
                if (topic(scored.message(), topicSegments).equals(previousTopic)) {
                    remaining.add(scored);
                } else {
                    weighted.add(scored.withScore(0));
                }
            }
        } else {
            remaining.addAll(candidates);
        }

        String[] fragments = previous.getMainFact().valueType().split(":");
        for (int n = 0; n < fragments.length; n++) {
            String prefix = String.join(":", Arrays.asList(fragments).subList(0, fragments.length - n));
            List<ScoredMessage> unmatched = new ArrayList<>();
            for (ScoredMessage scored : remaining) {
                if (scored.message().getMainFact().valueType().startsWith(prefix)) {
                    weighted.add(scored.withScore(scored.score() / (n + 1)));
                } else {
                    unmatched.add(scored);
                }
            }
            remaining = unmatched;
        }
        remaining.forEach(scored -> weighted.add(scored.withScore(0)));
        return weighted;
    }

    /** Zero when both location and timestamp differ, otherwise x2 for same location and x1.5 for same time. */
    static List<ScoredMessage> strictContext(List<ScoredMessage> candidates, Message previous) {
        Fact reference = previous.getMainFact();
        List<ScoredMessage> weighted = new ArrayList<>();
        for (ScoredMessage scored : candidates) {
            Fact fact = scored.message().getMainFact();
            boolean sameLocation = Objects.equals(reference.location(), fact.location());
            boolean sameTime = Objects.equals(reference.timestamp(), fact.timestamp());
            double score = scored.score();
            if (!sameLocation && !sameTime) {
                score = 0;
            } else {
                if (sameLocation) {
                    score *= 2;
                }
                if (sameTime) {
                    score *= 1.5;
                }
            }
            weighted.add(scored.withScore(score));
        }
        return weighted;
    }

    /** x1.5 for same location, x1.1 for same timestamp. */
    static List<ScoredMessage> lenientContext(List<ScoredMessage> candidates, Message previous) {
        Fact reference = previous.getMainFact();
        List<ScoredMessage> weighted = new ArrayList<>();
        for (ScoredMessage scored : candidates) {
            Fact fact = scored.message().getMainFact();
            double score = scored.score();
            if (Objects.equals(reference.location(), fact.location())) {
                score *= 1.5;
            }
            if (Objects.equals(reference.timestamp(), fact.timestamp())) {
                score *= 1.1;
            }
            weighted.add(scored.withScore(score));
        }
        return weighted;
    }

    static boolean removeByIdentity(List<Message> messages, Message target) {
        return messages.removeIf(message -> message == target);
    }
}
