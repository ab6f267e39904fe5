package com.eainde.nlg.nodes;

import com.eainde.nlg.scoring.ImportanceScorer;
import com.eainde.nlg.scoring.ScoredPools;
import com.eainde.nlg.state.ArticleState;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Map;

@Component
public class ScoreImportanceNode extends ArticleStageNode {

    private final ImportanceScorer scorer;

    public ScoreImportanceNode(ImportanceScorer scorer) {
        this.scorer = scorer;
    }

    @Override
    protected String stageName() {
        return "score_importance";
    }

    @Override
    protected Map<String, Object> process(ArticleState state) {
        ScoredPools pools = scorer.scoreAll(state.getCore(), state.getExpanded(), state.getPrevious());
        return Map.of(
                ArticleState.CORE, new ArrayList<>(pools.core()),
                ArticleState.EXPANDED, new ArrayList<>(pools.expanded()));
    }
}
