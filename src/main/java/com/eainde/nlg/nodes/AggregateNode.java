package com.eainde.nlg.nodes;

import com.eainde.nlg.aggregation.Aggregator;
import com.eainde.nlg.state.ArticleState;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class AggregateNode extends ArticleStageNode {

    private final Aggregator aggregator;

    public AggregateNode(Aggregator aggregator) {
        this.aggregator = aggregator;
    }

    @Override
    protected String stageName() {
        return "aggregate";
    }

    @Override
    protected Map<String, Object> process(ArticleState state) {
        return Map.of(ArticleState.PLAN, aggregator.aggregate(state.getPlan(), state.getLanguage()));
    }
}
