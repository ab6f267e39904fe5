package com.eainde.nlg.data;

import com.eainde.nlg.exception.NlgException;
import com.eainde.nlg.exception.NoMessagesForSelectionException;
import com.eainde.nlg.model.Fact;
import com.eainde.nlg.model.Message;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MessageGeneratorTest {

    private static final String ROWS = """
            [
              {"location": "FI", "location_type": "country", "timestamp": 2020, "timestamp_type": "year",
               "cphi:hicp2015:cp-hi00": 102.3, "cphi:hicp2015:cp-hi00:outlierness": 0.8,
               "cphi:hicp2015:cp-hi01": 104.1, "cphi:hicp2015:cp-hi01:outlierness": 0,
               "cphi:hicp2015:cp-hi01:grouped_by_time:outlierness": 1.7,
               "cphi:hicp2015:cp-hi02": ""},
              {"location": "FI", "location_type": "country", "timestamp": 2015, "timestamp_type": "year",
               "cphi:hicp2015:cp-hi00": 100.0},
              {"location": "FI", "location_type": "country", "timestamp": "2019M11", "timestamp_type": "month",
               "cphi:rt12:cp-hi00": 0.9},
              {"location": "SE", "location_type": "country", "timestamp": 2020, "timestamp_type": "year",
               "cphi:hicp2015:cp-hi00": 101.0}
            ]
            """;

    private MessageGenerator generator;

    @BeforeEach
    void setUp() throws IOException {
        JsonDatasetSource source = JsonDatasetSource.read("cphi",
                new ByteArrayInputStream(ROWS.getBytes(StandardCharsets.UTF_8)), new ObjectMapper());
        Clock clock = Clock.fixed(Instant.parse("2021-06-01T00:00:00Z"), ZoneOffset.UTC);
        generator = new MessageGenerator(new DatasetRegistry(List.of(source)), clock);
    }

    private static List<String> valueTypes(List<Message> messages) {
        return messages.stream().map(Message::getMainFact).map(Fact::valueType).toList();
    }

    @Nested
    @DisplayName("Extraction")
    class Extraction {

        @Test
        @DisplayName("should make one message per present value column of the selected location")
        void coreMessages() {
            ExtractedMessages messages = generator.generate("cphi", "FI");

            assertThat(valueTypes(messages.core()))
                    .containsExactlyInAnyOrder("cphi:hicp2015:cp-hi00", "cphi:hicp2015:cp-hi01");
            assertThat(valueTypes(messages.expanded())).containsExactly("cphi:hicp2015:cp-hi00");
        }

        @Test
        @DisplayName("should reference the location as an entity and keep the row's time")
        void factFields() {
            Fact fact = generator.generate("cphi", "FI").core().get(0).getMainFact();

            assertThat(fact.location()).isEqualTo("[ENTITY:country:FI]");
            assertThat(fact.locationType()).isEqualTo("country");
            assertThat(fact.timestamp()).isEqualTo("2020");
            assertThat(fact.timestampType()).isEqualTo("year");
            assertThat(fact.value()).isEqualTo(102.3);
            assertThat(fact.outlierness()).isEqualTo(0.8);
        }

        @Test
        @DisplayName("should fall back to the grouped-by-time outlierness when the plain one is zero")
        void groupedOutlierness() {
            Fact food = generator.generate("cphi", "FI").core().stream()
                    .map(Message::getMainFact)
                    .filter(fact -> fact.valueType().endsWith("cp-hi01"))
                    .findFirst().orElseThrow();

            assertThat(food.outlierness()).isEqualTo(1.7);
        }

        @Test
        @DisplayName("should leave out ignored columns")
        void ignoredColumns() {
            ExtractedMessages messages = generator.generate("cphi", "FI", Set.of("cphi:hicp2015:cp-hi01"));

            assertThat(valueTypes(messages.core())).containsExactly("cphi:hicp2015:cp-hi00");
        }

        @Test
        @DisplayName("should make every row core for all locations")
        void allLocations() {
            ExtractedMessages messages = generator.generate("cphi", MessageGenerator.ALL_LOCATIONS);

            assertThat(messages.core()).hasSize(3);
            assertThat(messages.expanded()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("should fail for a location without data")
        void noMessages() {
            assertThatThrownBy(() -> generator.generate("cphi", "XX"))
                    .isInstanceOf(NoMessagesForSelectionException.class);
        }

        @Test
        @DisplayName("should fail for an unknown dataset")
        void unknownDataset() {
            assertThatThrownBy(() -> generator.generate("weather", "FI"))
                    .isInstanceOf(NlgException.class)
                    .hasMessage("Unknown dataset: weather");
        }
    }

    @Test
    @DisplayName("should keep recent years and the previous year's months only")
    void tooOld() {
        assertThat(MessageGenerator.tooOld("2018", "year", 2021)).isFalse();
        assertThat(MessageGenerator.tooOld("2017", "year", 2021)).isTrue();
        assertThat(MessageGenerator.tooOld("2020M01", "month", 2021)).isFalse();
        assertThat(MessageGenerator.tooOld("2019M12", "month", 2021)).isTrue();
        assertThat(MessageGenerator.tooOld("last year", "year", 2021)).isTrue();
    }

    @Test
    @DisplayName("should read numbers given as text and treat blanks as missing")
    void dataRowNumbers() {
        DataRow row = new DataRow(Map.of("a", "1.5", "b", " ", "c", "NaN", "d", 2020));

        assertThat(row.getNumber("a")).isEqualTo(1.5);
        assertThat(row.getNumber("b")).isNull();
        assertThat(row.getNumber("c")).isNull();
        assertThat(row.getDouble("c")).isNaN();
        assertThat(row.getString("d")).isEqualTo("2020");
    }
}
