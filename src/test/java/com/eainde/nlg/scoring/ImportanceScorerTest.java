package com.eainde.nlg.scoring;

import com.eainde.nlg.model.Fact;
import com.eainde.nlg.model.Message;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static com.eainde.nlg.FactFixtures.message;
import static com.eainde.nlg.FactFixtures.monthly;
import static com.eainde.nlg.FactFixtures.scored;
import static com.eainde.nlg.FactFixtures.withOutlierness;
import static com.eainde.nlg.FactFixtures.yearly;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ImportanceScorerTest {

    private final ImportanceScorer scorer = new ImportanceScorer(Clock.fixed(
            LocalDate.of(2021, 6, 1).atStartOfDay().toInstant(ZoneOffset.UTC), ZoneOffset.UTC));

    @Nested
    @DisplayName("Single messages")
    class Single {

        @Test
        @DisplayName("should multiply recency, outlierness and the yearly bonus")
        void yearly2020() {
            Fact fact = withOutlierness(yearly("FI", "cphi:hicp2015", 102.3, 2020), 3.5);

            assertThat(scorer.scoreSingle(message(fact))).isCloseTo(35.0, within(1e-9));
        }

        @Test
        @DisplayName("should never rank an older year above a newer one")
        void recencyMonotonic() {
            double previous = Double.MAX_VALUE;
            for (int year = 2021; year >= 2010; year--) {
                double score = scorer.scoreSingle(message(yearly("FI", "cphi:hicp2015", 100, year)));
                assertThat(score).isLessThanOrEqualTo(previous);
                previous = score;
            }
        }

        @Test
        @DisplayName("should rank later months of a year higher")
        void monthsMonotonic() {
            double january = scorer.scoreSingle(message(monthly("FI", "cphi:rt12", 1, "2021M01")));
            double april = scorer.scoreSingle(message(monthly("FI", "cphi:rt12", 1, "2021M04")));
            double december = scorer.scoreSingle(message(monthly("FI", "cphi:rt12", 1, "2020M12")));

            assertThat(april).isGreaterThan(january);
            assertThat(january).isGreaterThan(december);
        }

        @Test
        @DisplayName("should treat a missing or zero outlierness as neutral and NaN as worthless")
        void outlierness() {
            Fact base = yearly("FI", "cphi:hicp2015", 100, 2020);

            double neutral = scorer.scoreSingle(message(withOutlierness(base, 1.0)));
            assertThat(scorer.scoreSingle(message(withOutlierness(base, null)))).isEqualTo(neutral);
            assertThat(scorer.scoreSingle(message(withOutlierness(base, 0.0)))).isEqualTo(neutral);
            assertThat(scorer.scoreSingle(message(withOutlierness(base, Double.NaN)))).isZero();
        }

        @Test
        @DisplayName("should weigh value types by their name")
        void valueTypes() {
            double plain = scorer.scoreSingle(message(yearly("FI", "health:cost:hc1:mio", 1, 2019)));

            assertThat(scorer.scoreSingle(message(yearly("FI", "health:cost:hc1:mio_eur", 1, 2019))))
                    .isCloseTo(plain * 40, within(1e-9));
            assertThat(scorer.scoreSingle(message(yearly("FI", "x_nac", 1, 2019)))).isZero();
            assertThat(scorer.scoreSingle(message(yearly("FI", "x:y16-24", 1, 2019)))).isZero();
            assertThat(scorer.scoreSingle(message(yearly("FI", "x_rank", 3, 2019))))
                    .isCloseTo(plain * 0.49, within(1e-9));
        }

        @Test
        @DisplayName("should scale by the importance coefficient")
        void coefficient() {
            Fact fact = yearly("FI", "cphi:hicp2015", 100, 2020);
            Message half = new Message(List.of(fact), 0.5, 0);

            assertThat(scorer.scoreSingle(half)).isCloseTo(scorer.scoreSingle(message(fact)) / 2, within(1e-9));
        }
    }

    @Nested
    @DisplayName("Pools")
    class Pools {

        @Test
        @DisplayName("should return both pools sorted best first")
        void sorted() {
            Message old = message(yearly("FI", "cphi:hicp2015", 100, 2017));
            Message recent = message(yearly("FI", "cphi:hicp2015", 100, 2020));

            ScoredPools pools = scorer.scoreAll(List.of(old, recent), List.of(), List.of());

            assertThat(pools.core()).containsExactly(recent, old);
            assertThat(pools.expanded()).isEmpty();
        }

        @Test
        @DisplayName("should boost statistics the previous article covered")
        void cohesion() {
            Fact covered = yearly("SE", "cphi:hicp2015", 100, 2020);
            Message same = message(yearly("FI", "cphi:hicp2015", 100, 2020));
            Message other = message(yearly("FI", "cphi:rt12", 100, 2020));
            double before = scorer.scoreSingle(message(yearly("FI", "cphi:hicp2015", 100, 2020)));

            scorer.scoreAll(List.of(same, other), List.of(), List.of(scored(covered, 10)));

            assertThat(same.getScore()).isCloseTo(before * 2, within(1e-9));
            assertThat(other.getScore()).isCloseTo(before, within(1e-9));
        }

        @Test
        @DisplayName("should damp expanded messages about previously covered locations")
        void repetition() {
            Message best = message(withOutlierness(yearly("SE", "cphi:hicp2015", 100, 2020), 2.0));
            Message weaker = message(yearly("SE", "cphi:rt12", 100, 2020));
            Message elsewhere = message(yearly("EE", "cphi:rt12", 100, 2020));
            double elsewhereBefore = scorer.scoreSingle(message(yearly("EE", "cphi:rt12", 100, 2020)));

            scorer.scoreAll(List.of(), List.of(best, weaker, elsewhere),
                    List.of(scored(yearly("SE", "cphi:hicp2015", 100, 2020), 5)));

            assertThat(best.getScore()).isCloseTo(20.0, within(1e-9));
            assertThat(weaker.getScore()).isLessThan(10.0);
            assertThat(elsewhere.getScore()).isCloseTo(elsewhereBefore, within(1e-9));
        }
    }
}
