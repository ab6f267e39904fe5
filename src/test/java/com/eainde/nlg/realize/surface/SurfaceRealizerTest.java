package com.eainde.nlg.realize.surface;

import com.eainde.nlg.exception.SurfaceRealizationException;
import com.eainde.nlg.model.DocumentPlanNode;
import com.eainde.nlg.model.Literal;
import com.eainde.nlg.model.Message;
import com.eainde.nlg.model.Template;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static com.eainde.nlg.FactFixtures.yearly;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SurfaceRealizerTest {

    private final SurfaceRealizer realizer = new SurfaceRealizer();

    private static Message sentence(String... words) {
        Message message = new Message(yearly("FI", "cphi:hicp2015:cp-hi00", 1, 2020));
        message.setTemplate(new Template(Arrays.stream(words).map(Literal::new).toList(), List.of()));
        return message;
    }

    private final DocumentPlanNode plan = DocumentPlanNode.sequence(
            DocumentPlanNode.sequence(sentence("in", "2020", ",", "it", "was", "high"), sentence("prices", "rose")),
            DocumentPlanNode.sequence(sentence("food", "(", "mostly", ")", "was", "cheap")));

    @Test
    @DisplayName("should wrap paragraphs and capitalize sentences in the body format")
    void body() {
        assertThat(realizer.realize(plan, SurfaceFormat.BODY)).isEqualTo(
                "<p>In 2020, it was high. Prices rose. </p><p>Food (mostly) was cheap. </p>");
    }

    @Test
    @DisplayName("should write list items in the list formats")
    void lists() {
        assertThat(realizer.realize(plan, SurfaceFormat.BODY_LIST)).isEqualTo(
                "<ul><li>In 2020, it was high.</li><li>Prices rose.</li></ul><ul><li>Food (mostly) was cheap.</li></ul>");
        assertThat(realizer.realize(plan, SurfaceFormat.BODY_ORDERED_LIST)).startsWith("<ol><li>In 2020");
    }

    @Test
    @DisplayName("should write a bare sentence as a headline")
    void headline() {
        DocumentPlanNode headline = DocumentPlanNode.sequence(DocumentPlanNode.sequence(sentence("prices", "rose")));

        assertThat(realizer.realize(headline, SurfaceFormat.HEADLINE)).isEqualTo("Prices rose");
    }

    @Test
    @DisplayName("should skip empty sentences in the body and reject them in headlines")
    void emptySentences() {
        DocumentPlanNode withEmpty = DocumentPlanNode.sequence(
                DocumentPlanNode.sequence(sentence(""), sentence("prices", "rose")));

        assertThat(realizer.realize(withEmpty, SurfaceFormat.BODY)).isEqualTo("<p>Prices rose. </p>");
        assertThatThrownBy(() -> realizer.realize(withEmpty, SurfaceFormat.HEADLINE))
                .isInstanceOf(SurfaceRealizationException.class);
    }
}
