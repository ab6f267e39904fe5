package com.eainde.nlg.template;

import com.eainde.nlg.model.Literal;
import com.eainde.nlg.model.Rule;
import com.eainde.nlg.model.Slot;
import com.eainde.nlg.model.Template;
import com.eainde.nlg.model.TemplateComponent;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Translates templates with a chat model. Slots are sent as numbered placeholders ({@code {0}},
 * {@code {1}}, ...) and put back after the answer has been split into words, so rules keep
 * pointing at the same slots.
 */
@Slf4j
public class ChatModelTemplateTranslator implements TemplateTranslator {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{(\\d+)}");

    static final String SYSTEM_PROMPT = """
            You translate short news sentence templates from %s to %s.
            Placeholders such as {0} stand for words filled in later. Keep every placeholder exactly once \
            and do not add new ones. Reply with the translated template only, on one line.""";

    private final ChatModel chatModel;

    public ChatModelTemplateTranslator(ChatModel chatModel) {
        this.chatModel = chatModel;
    }

    @Override
    public Optional<Template> translate(Template template, String sourceLanguage, String targetLanguage) {
        List<Slot> slots = new ArrayList<>();
        String text = render(template, slots);

        ChatRequest request = ChatRequest.builder()
                .messages(
                        SystemMessage.from(SYSTEM_PROMPT.formatted(sourceLanguage, targetLanguage)),
                        UserMessage.from(text))
                .build();

        String answer;
        try {
            ChatResponse response = chatModel.chat(request);
            answer = response == null || response.aiMessage() == null ? null : response.aiMessage().text();
        } catch (RuntimeException e) {
            log.warn("Translating '{}' to {} failed: {}", text, targetLanguage, e.getMessage());
            return Optional.empty();
        }
        if (answer == null || answer.isBlank()) {
            log.warn("Empty translation of '{}' to {}", text, targetLanguage);
            return Optional.empty();
        }
        log.debug("Translated '{}' to {}: '{}'", text, targetLanguage, answer);
        return rebuild(template, slots, answer.strip());
    }

    // ===== Internals =====

    /** Literals as text, slot k as {k}. Collects the slots in order. */
    static String render(Template template, List<Slot> slots) {
        List<String> parts = new ArrayList<>();
        for (TemplateComponent component : template.getComponents()) {
            if (component instanceof Slot slot) {
                parts.add("{" + slots.size() + "}");
                slots.add(slot);
            } else {
                parts.add(component.value());
            }
        }
        return String.join(" ", parts);
    }

    static Optional<Template> rebuild(Template template, List<Slot> slots, String answer) {
        List<TemplateComponent> components = new ArrayList<>();
        Map<Integer, Integer> newIndexOfSlot = new HashMap<>();

        for (String word : answer.split("\\s+")) {
            Matcher matcher = PLACEHOLDER.matcher(word);
            int position = 0;
            while (matcher.find()) {
                addLiteral(components, word.substring(position, matcher.start()));
                int slotNumber = Integer.parseInt(matcher.group(1));
                if (slotNumber >= slots.size() || newIndexOfSlot.containsKey(slotNumber)) {
                    log.warn("Translation '{}' has an unknown or repeated placeholder {{{}}}", answer, slotNumber);
                    return Optional.empty();
                }
                newIndexOfSlot.put(slotNumber, components.size());
                components.add(slots.get(slotNumber).copy(false));
                position = matcher.end();
            }
            addLiteral(components, word.substring(position));
        }
        if (newIndexOfSlot.size() != slots.size()) {
            log.warn("Translation '{}' lost {} placeholders", answer, slots.size() - newIndexOfSlot.size());
            return Optional.empty();
        }

        Map<Integer, Integer> oldToNew = new HashMap<>();
        int slotNumber = 0;
        List<TemplateComponent> original = template.getComponents();
        for (int i = 0; i < original.size(); i++) {
            if (original.get(i) instanceof Slot) {
                oldToNew.put(i, newIndexOfSlot.get(slotNumber++));
            }
        }
        List<Rule> rules = new ArrayList<>();
        for (Rule rule : template.getRules()) {
            List<Integer> indices = rule.slotIndices().stream().map(oldToNew::get).toList();
            rules.add(new Rule(rule.matchers(), indices, rule.reuseAllowed()));
        }
        return Optional.of(new Template(components, rules));
    }

    private static void addLiteral(List<TemplateComponent> components, String text) {
        if (!text.isEmpty()) {
            components.add(new Literal(text));
        }
    }
}
