package com.eainde.nlg.realize.number;

import com.eainde.nlg.model.DocumentPlanNode;
import com.eainde.nlg.model.Message;
import com.eainde.nlg.model.Slot;
import com.eainde.nlg.model.SlotSource;
import com.eainde.nlg.model.Template;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;

import static com.eainde.nlg.FactFixtures.yearly;
import static org.assertj.core.api.Assertions.assertThat;

class NumberRealizerTest {

    private final NumberRealizer realizer = new NumberRealizer();

    private static Slot realize(NumberRealizer realizer, String text, String flag, String language) {
        Slot slot = new Slot(new SlotSource.LiteralSource(text), Map.of(flag, true), null);
        Message message = new Message(yearly("FI", "cphi:rank", 3, 2020));
        message.setTemplate(new Template(List.of(slot), List.of()));
        realizer.realize(DocumentPlanNode.sequence(DocumentPlanNode.sequence(message)), language);
        return slot;
    }

    @Nested
    @DisplayName("Ordinals")
    class Ordinals {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
                "2, second",
                "12, twelfth",
                "13, 13th",
                "21, 21st",
                "22, 22nd",
                "23, 23rd",
                "111, 111th",
                "112, 112th"
        })
        @DisplayName("should write English ordinals with the right suffix")
        void english(String number, String expected) {
            assertThat(OrdinalCapability.english().ordinal(number)).isEqualTo(expected);
        }

        @Test
        @DisplayName("should drop the English first so 'the 1 highest' reads 'the highest'")
        void englishFirst() {
            assertThat(OrdinalCapability.english().ordinal("1")).isEmpty();
        }

        @Test
        @DisplayName("should write small Finnish ordinals in words and others with a period")
        void finnish() {
            assertThat(OrdinalCapability.finnish().ordinal("3")).isEqualTo("kolmas");
            assertThat(OrdinalCapability.finnish().ordinal("14")).isEqualTo("14.");
        }

        @Test
        @DisplayName("should realize slots flagged 'ord' in the article language")
        void flaggedSlots() {
            assertThat(realize(realizer, "3", NumberRealizer.ORDINAL, "en-head").value()).isEqualTo("third");
            assertThat(realize(realizer, "3", NumberRealizer.ORDINAL, "hr").value()).isEqualTo("3.");
        }

        @Test
        @DisplayName("should leave the slot alone for languages without ordinals")
        void unsupportedLanguage() {
            assertThat(realize(realizer, "3", NumberRealizer.ORDINAL, "ru").value()).isEqualTo("3");
        }
    }

    @Nested
    @DisplayName("Cardinals")
    class Cardinals {

        @Test
        @DisplayName("should write small numbers in words and keep larger ones as digits")
        void words() {
            assertThat(realize(realizer, "4", NumberRealizer.CARDINAL, "en").value()).isEqualTo("four");
            assertThat(realize(realizer, "4", NumberRealizer.CARDINAL, "fi").value()).isEqualTo("neljä");
            assertThat(realize(realizer, "11", NumberRealizer.CARDINAL, "de").value()).isEqualTo("elf");
            assertThat(realize(realizer, "40", NumberRealizer.CARDINAL, "en").value()).isEqualTo("40");
        }
    }

    @Test
    @DisplayName("should not touch unflagged slots")
    void unflagged() {
        assertThat(realize(realizer, "3", "abs", "en").value()).isEqualTo("3");
    }
}
