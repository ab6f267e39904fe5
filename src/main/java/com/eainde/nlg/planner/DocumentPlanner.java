package com.eainde.nlg.planner;

import com.eainde.nlg.exception.NoViableNucleusException;
import com.eainde.nlg.model.DocumentPlanNode;
import com.eainde.nlg.model.Message;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * Selects and orders messages into paragraphs. Each paragraph is a SEQUENCE of one nucleus
 * followed by its satellites. A message is placed at most once.
 */
@Slf4j
@Component
public class DocumentPlanner {

    private final PlannerStrategy strategy;
    private final PlannerSettings settings;

    public DocumentPlanner(PlannerStrategy strategy, PlannerSettings settings) {
        this.strategy = strategy;
        this.settings = settings;
    }

    public PlannerStrategy getStrategy() {
        return strategy;
    }

    /**
     * Plans a headline: the single most interesting core message.
     *
     * @throws NoViableNucleusException if no nucleus can be picked
     */
    public DocumentPlanNode planHeadline(List<Message> core, Random random) {
        log.debug("Creating headline document plan with the {} planner", strategy.name());
        Message headline = strategy.nucleusSelector()
                .select(core, List.of(), random)
                .orElseThrow(() -> new NoViableNucleusException("No message available for the headline"));
        return DocumentPlanNode.sequence(DocumentPlanNode.sequence(headline));
    }

    /**
     * Plans the body paragraphs. Nuclei come from the core pool, satellites may also come from the
     * expanded pool if the strategy allows it. The pools given are not modified.
     *
     * @throws NoViableNucleusException if not even the first paragraph could be started
     */
    public DocumentPlanNode planBody(List<Message> core, List<Message> expanded, Random random) {
        log.debug("Creating body document plan with the {} planner", strategy.name());
        DocumentPlanNode plan = DocumentPlanNode.sequence(new ArrayList<>());

        List<Message> availableCore = new ArrayList<>(core);
        List<Message> availableExpanded = new ArrayList<>(expanded);
        List<Message> selectedNuclei = new ArrayList<>();

        while (selectedNuclei.size() < settings.maxParagraphs()) {
            Optional<Message> next = strategy.nucleusSelector().select(availableCore, selectedNuclei, random);
            if (next.isEmpty() || tooWeak(next.get(), selectedNuclei)) {
                break;
            }
            Message nucleus = next.get();
            selectedNuclei.add(nucleus);
            PlannerStrategies.removeByIdentity(availableCore, nucleus);

            List<Message> satellites = strategy.satelliteSelector()
                    .select(nucleus, List.copyOf(availableCore), List.copyOf(availableExpanded), random);
            for (Message satellite : satellites) {
                PlannerStrategies.removeByIdentity(availableCore, satellite);
                PlannerStrategies.removeByIdentity(availableExpanded, satellite);
            }

            List<Message> paragraph = new ArrayList<>();
            paragraph.add(nucleus);
            paragraph.addAll(satellites);
            plan.getChildren().add(DocumentPlanNode.sequence(paragraph));
            log.debug("Paragraph {}: nucleus {} with {} satellites", selectedNuclei.size(), nucleus, satellites.size());
        }

        if (selectedNuclei.isEmpty()) {
            throw new NoViableNucleusException("Document plan generation finished with no nuclei");
        }
        return plan;
    }

    private boolean tooWeak(Message nucleus, List<Message> selectedNuclei) {
        double score = nucleus.getScore();
        if (score < strategy.newParagraphAbsoluteThreshold()) {
            log.debug("Nucleus score {} below the absolute threshold, stopping", score);
            return true;
        }
        double relative = strategy.relativeThreshold().threshold(selectedNuclei);
        if (score < relative) {
            log.debug("Nucleus score {} below the relative threshold {}, stopping", score, relative);
            return true;
        }
        return false;
    }
}
