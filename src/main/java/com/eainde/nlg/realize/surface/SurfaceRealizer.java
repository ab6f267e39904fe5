package com.eainde.nlg.realize.surface;

import com.eainde.nlg.exception.SurfaceRealizationException;
import com.eainde.nlg.model.DocumentPlanNode;
import com.eainde.nlg.model.Message;
import com.eainde.nlg.model.PlanNode;
import com.eainde.nlg.model.TemplateComponent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Renders a realized document plan as text. Root children are paragraphs, their messages sentences.
 */
@Slf4j
@Component
public class SurfaceRealizer {

    private static final Pattern SPACE_AFTER_PAREN = Pattern.compile("\\(\\s");
    private static final Pattern SPACE_BEFORE_PAREN = Pattern.compile("\\s\\)");
    private static final Pattern SPACE_BEFORE_COMMA = Pattern.compile("\\s,");

    /**
     * @throws SurfaceRealizationException on an empty sentence when the format does not allow one
     */
    public String realize(DocumentPlanNode plan, SurfaceFormat format) {
        StringBuilder output = new StringBuilder();
        for (PlanNode paragraph : plan.getChildren()) {
            output.append(format.paragraphStart());
            if (paragraph.kind() == PlanNode.Kind.LEAF) {
                appendSentence(output, paragraph.asLeaf(), format);
            } else {
                for (Message message : paragraph.asBranch().messages()) {
                    appendSentence(output, message, format);
                }
            }
            output.append(format.paragraphEnd());
        }
        return output.toString();
    }

    private void appendSentence(StringBuilder output, Message message, SurfaceFormat format) {
        String sentence = sentence(message);
        if (sentence.isEmpty()) {
            if (format.failOnEmpty()) {
                throw new SurfaceRealizationException("Empty sentence in surface realization of " + message);
            }
            log.debug("Skipping empty sentence of {}", message);
            return;
        }
        output.append(format.sentenceStart())
                .append(Character.toUpperCase(sentence.charAt(0)))
                .append(sentence.substring(1))
                .append(format.sentenceEnd());
    }

    static String sentence(Message message) {
        String sentence = message.getComponents().stream()
                .map(TemplateComponent::value)
                .filter(value -> !value.isEmpty())
                .collect(Collectors.joining(" "))
                .stripTrailing();
        sentence = SPACE_AFTER_PAREN.matcher(sentence).replaceAll("(");
        sentence = SPACE_BEFORE_PAREN.matcher(sentence).replaceAll(")");
        return SPACE_BEFORE_COMMA.matcher(sentence).replaceAll(",");
    }
}
