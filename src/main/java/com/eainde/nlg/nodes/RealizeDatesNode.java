package com.eainde.nlg.nodes;

import com.eainde.nlg.model.DocumentPlanNode;
import com.eainde.nlg.realize.date.DateRealizer;
import com.eainde.nlg.state.ArticleState;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Random;

@Component
public class RealizeDatesNode extends ArticleStageNode {

    private final DateRealizer dateRealizer;

    public RealizeDatesNode(DateRealizer dateRealizer) {
        this.dateRealizer = dateRealizer;
    }

    @Override
    protected String stageName() {
        return "realize_dates";
    }

    @Override
    protected Map<String, Object> process(ArticleState state) {
        DocumentPlanNode plan = state.getPlan();
        Random random = state.getRandom();
        dateRealizer.realize(plan, state.getLanguage(), random);
        return Map.of(ArticleState.PLAN, plan, ArticleState.RANDOM, random);
    }
}
