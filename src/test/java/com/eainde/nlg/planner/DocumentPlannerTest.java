package com.eainde.nlg.planner;

import com.eainde.nlg.exception.NoViableNucleusException;
import com.eainde.nlg.model.DocumentPlanNode;
import com.eainde.nlg.model.Message;
import com.eainde.nlg.model.PlanNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static com.eainde.nlg.FactFixtures.scored;
import static com.eainde.nlg.FactFixtures.yearly;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DocumentPlannerTest {

    private final PlannerSettings settings = PlannerSettings.defaults();

    private final Message a = scored(yearly("FI", "cphi:hicp2015:cp-hi00", 102.3, 2020), 10);
    private final Message b = scored(yearly("FI", "cphi:hicp2015:cp-hi01", 104.1, 2020), 9);
    private final Message c = scored(yearly("SE", "cphi:hicp2015:cp-hi00", 101.0, 2020), 8);
    private final Message d = scored(yearly("SE", "cphi:hicp2015:cp-hi01", 99.5, 2020), 7);
    private final Message e = scored(yearly("FI", "cphi:rt12:cp-hi00", 1.1, 2020), 6);
    private final Message f = scored(yearly("FI", "cphi:rt12:cp-hi01", 0.9, 2020), 5);
    private final Message g = scored(yearly("EE", "cphi:hicp2015:cp-hi00", 108.0, 2020), 4);
    private final Message h = scored(yearly("EE", "cphi:hicp2015:cp-hi01", 110.2, 2020), 3);
    private final Message expandedBest = scored(yearly("SE", "cphi:rt12:cp-hi00", 0.4, 2019), 9.5);

    private List<Message> core() {
        return new ArrayList<>(List.of(a, b, c, d, e, f, g, h));
    }

    private DocumentPlanner planner(String variant) {
        return new DocumentPlanner(PlannerStrategies.forVariant(variant, settings), settings);
    }

    private static List<List<Message>> paragraphs(DocumentPlanNode plan) {
        return plan.getChildren().stream().map(PlanNode::asBranch).map(DocumentPlanNode::messages).toList();
    }

    @ParameterizedTest(name = "{0}")
    @ValueSource(strings = {"full", "contextsim", "earlystop", "score", "random"})
    @DisplayName("should place every message at most once and respect the size limits")
    void limits(String variant) {
        List<Message> core = core();
        List<Message> expanded = new ArrayList<>(List.of(expandedBest));

        DocumentPlanNode plan = planner(variant).planBody(core, expanded, new Random(7));

        List<Message> placed = plan.messages();
        Set<Message> unique = Collections.newSetFromMap(new IdentityHashMap<>());
        unique.addAll(placed);
        assertThat(unique).hasSameSizeAs(placed);
        assertThat(paragraphs(plan)).isNotEmpty()
                .hasSizeLessThanOrEqualTo(settings.maxParagraphs())
                .allSatisfy(paragraph -> assertThat(paragraph).hasSizeLessThanOrEqualTo(settings.maxSatellites() + 1));
        assertThat(core).hasSize(8);
        assertThat(expanded).containsExactly(expandedBest);
    }

    @Test
    @DisplayName("should take the best core messages as satellites in the earlystop variant")
    void earlyStop() {
        DocumentPlanNode plan = planner("earlystop").planBody(core(), List.of(expandedBest), new Random(1));

        assertThat(paragraphs(plan)).containsExactly(List.of(a, b, c, d, e, f), List.of(g, h));
    }

    @Test
    @DisplayName("should mix in expanded messages in the score variant")
    void scoreVariant() {
        DocumentPlanNode plan = planner("score").planBody(core(), List.of(expandedBest), new Random(1));

        assertThat(paragraphs(plan).get(0)).containsExactly(a, expandedBest, b, c, d, e);
    }

    @Test
    @DisplayName("should produce the same random plan for the same seed")
    void randomIsSeeded() {
        List<Message> first = planner("random").planBody(core(), List.of(expandedBest), new Random(42)).messages();
        List<Message> second = planner("random").planBody(core(), List.of(expandedBest), new Random(42)).messages();

        assertThat(second).containsExactlyElementsOf(first);
    }

    @Test
    @DisplayName("should fail without a nucleus")
    void noNucleus() {
        assertThatThrownBy(() -> planner("full").planBody(List.of(), List.of(expandedBest), new Random(1)))
                .isInstanceOf(NoViableNucleusException.class);
    }

    @Test
    @DisplayName("should not start a paragraph below the absolute threshold")
    void weakCore() {
        List<Message> weak = List.of(scored(yearly("FI", "cphi:hicp2015:cp-hi00", 100, 2020), 0.1));

        assertThatThrownBy(() -> planner("score").planBody(weak, List.of(), new Random(1)))
                .isInstanceOf(NoViableNucleusException.class);
    }

    @Test
    @DisplayName("should plan the best message as the headline")
    void headline() {
        DocumentPlanNode plan = planner("full").planHeadline(core(), new Random(1));

        assertThat(plan.messages()).containsExactly(a);
    }

    @Test
    @DisplayName("should reject unknown variants")
    void unknownVariant() {
        assertThatThrownBy(() -> PlannerStrategies.forVariant("greedy", settings))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("full, contextsim, earlystop, score, random");
    }

    @Nested
    @DisplayName("Nucleus novelty")
    class Novelty {

        private final Message repeat = scored(yearly("FI", "cphi:hicp2015:cp-hi00", 101.9, 2019), 29);

        @Test
        @DisplayName("should prefer a topic and location not covered yet")
        void prefersNovel() {
            assertThat(PlannerStrategies.novelNucleus(List.of(repeat, c), List.of(a), settings)).contains(c);
        }

        @Test
        @DisplayName("should go in depth when a single topic was covered")
        void relaxesForSingleTopic() {
            assertThat(PlannerStrategies.novelNucleus(List.of(repeat), List.of(a), settings)).contains(repeat);
        }

        @Test
        @DisplayName("should count a topic covered twice at the same location once")
        void countsDistinctTopics() {
            Message older = scored(yearly("FI", "cphi:hicp2015:cp-hi00", 101.2, 2018), 12);

            assertThat(PlannerStrategies.novelNucleus(List.of(older), List.of(a, repeat), settings)).contains(older);
        }

        @Test
        @DisplayName("should end an overview with nothing new to say")
        void stopsOverview() {
            assertThat(PlannerStrategies.novelNucleus(List.of(repeat), List.of(a, c), settings)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Satellite thresholds")
    class SatelliteThresholds {

        private final Message nucleus = scored(yearly("FI", "cphi:hicp2015:cp-hi00", 102.3, 2020), 100);
        private final Message weakest = scored(yearly("FI", "cphi:hicp2015:cp-hi03", 99.0, 2020), 0.05);
        private final Message weaker = scored(yearly("FI", "cphi:hicp2015:cp-hi02", 98.0, 2020), 0.1);
        private final Message weak = scored(yearly("FI", "cphi:hicp2015:cp-hi01", 97.0, 2020), 0.15);

        private List<Message> satellites(PlannerSettings plannerSettings, List<Message> core) {
            return PlannerStrategies.greedySatellites(nucleus, core, List.of(),
                    (candidates, ignoredNucleus, previous) -> candidates, plannerSettings);
        }

        @Test
        @DisplayName("should ignore the thresholds until the minimum number of satellites is reached")
        void fillsUpToMinimum() {
            List<Message> chosen = satellites(settings, List.of(weakest, weaker, weak));

            assertThat(chosen).hasSize(settings.minSatellites()).containsExactly(weak, weaker);
        }

        @Test
        @DisplayName("should keep adding candidates that pass the thresholds past the minimum")
        void passingCandidatesPastMinimum() {
            Message strong = scored(yearly("FI", "cphi:hicp2015:cp-hi04", 96.0, 2020), 60);
            Message stronger = scored(yearly("FI", "cphi:hicp2015:cp-hi05", 95.0, 2020), 70);
            Message strongest = scored(yearly("FI", "cphi:hicp2015:cp-hi06", 94.0, 2020), 80);

            List<Message> chosen = satellites(settings, List.of(weak, strong, strongest, stronger));

            assertThat(chosen).containsExactly(strongest, stronger, strong);
        }

        @Test
        @DisplayName("should choose nothing below the thresholds without a minimum")
        void noMinimum() {
            PlannerSettings noMinimum = new PlannerSettings(3, 5, 0, 0.5, 0.5, 0.2, 1.0, 0.3, 2);

            assertThat(satellites(noMinimum, List.of(weakest, weaker, weak))).isEmpty();
        }
    }

    @Test
    @DisplayName("should weigh candidates by the value type prefix they share")
    void analysisSimilarity() {
        Message other = scored(yearly("FI", "health:cost:hc1", 10, 2020), 10);
        List<ScoredMessage> candidates = List.of(
                new ScoredMessage(10, a),
                new ScoredMessage(10, b),
                new ScoredMessage(10, e),
                new ScoredMessage(10, other));

        List<ScoredMessage> weighted = PlannerStrategies.analysisSimilarity(candidates, a, 0);

        assertThat(weighted).extracting(ScoredMessage::message).containsExactly(a, b, e, other);
        assertThat(weighted).extracting(ScoredMessage::score).containsExactly(10.0, 5.0, 10.0 / 3, 0.0);
    }

    @Test
    @DisplayName("should zero candidates sharing neither location nor time")
    void strictContext() {
        Message elsewhere = scored(yearly("SE", "cphi:hicp2015:cp-hi00", 100, 2019), 10);
        Message sameTime = scored(yearly("SE", "cphi:hicp2015:cp-hi00", 100, 2020), 10);
        Message samePlace = scored(yearly("FI", "cphi:hicp2015:cp-hi00", 100, 2019), 10);

        List<ScoredMessage> weighted = PlannerStrategies.strictContext(List.of(
                new ScoredMessage(10, elsewhere),
                new ScoredMessage(10, sameTime),
                new ScoredMessage(10, samePlace),
                new ScoredMessage(10, b)), a);

        assertThat(weighted).extracting(ScoredMessage::score).containsExactly(0.0, 15.0, 20.0, 30.0);
    }
}
