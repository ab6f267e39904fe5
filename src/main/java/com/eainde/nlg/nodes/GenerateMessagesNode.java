package com.eainde.nlg.nodes;

import com.eainde.nlg.data.ExtractedMessages;
import com.eainde.nlg.data.MessageGenerator;
import com.eainde.nlg.exception.NlgException;
import com.eainde.nlg.model.DocumentPlanNode;
import com.eainde.nlg.model.Message;
import com.eainde.nlg.planner.DocumentPlanner;
import com.eainde.nlg.scoring.ImportanceScorer;
import com.eainde.nlg.scoring.ScoredPools;
import com.eainde.nlg.state.ArticleState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Extracts the core and expanded messages. When the reader came from another location, the plan
 * of that location's article is rebuilt so the scorer can favour related statistics.
 */
@Slf4j
@Component
public class GenerateMessagesNode extends ArticleStageNode {

    private final MessageGenerator messageGenerator;
    private final ImportanceScorer scorer;
    private final DocumentPlanner planner;

    public GenerateMessagesNode(MessageGenerator messageGenerator, ImportanceScorer scorer, DocumentPlanner planner) {
        this.messageGenerator = messageGenerator;
        this.scorer = scorer;
        this.planner = planner;
    }

    @Override
    protected String stageName() {
        return "generate_messages";
    }

    @Override
    protected Map<String, Object> process(ArticleState state) {
        ExtractedMessages extracted = messageGenerator.generate(state.getDataset(), state.getLocation());
        Random random = state.getRandom();

        List<Message> previous = List.of();
        if (!state.getPreviousLocation().isEmpty()) {
            previous = previousArticleMessages(state, random);
        }
        return Map.of(
                ArticleState.CORE, new ArrayList<>(extracted.core()),
                ArticleState.EXPANDED, new ArrayList<>(extracted.expanded()),
                ArticleState.PREVIOUS, new ArrayList<>(previous),
                ArticleState.RANDOM, random);
    }

    private List<Message> previousArticleMessages(ArticleState state, Random random) {
        log.info("Have previous location {}, planning its article", state.getPreviousLocation());
        try {
            ExtractedMessages extracted = messageGenerator.generate(state.getDataset(), state.getPreviousLocation());
            ScoredPools pools = scorer.scoreAll(extracted.core(), extracted.expanded(), List.of());
            DocumentPlanNode plan = state.isHeadline()
                    ? planner.planHeadline(pools.core(), random)
                    : planner.planBody(pools.core(), pools.expanded(), random);
            List<Message> messages = plan.messages();
            log.debug("Previous article had {} messages", messages.size());
            return messages;
        } catch (NlgException e) {
            log.warn("Ignoring previous location {}: {}", state.getPreviousLocation(), e.getMessage());
            return List.of();
        }
    }
}
