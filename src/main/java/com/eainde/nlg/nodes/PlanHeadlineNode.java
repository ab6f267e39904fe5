package com.eainde.nlg.nodes;

import com.eainde.nlg.model.DocumentPlanNode;
import com.eainde.nlg.planner.DocumentPlanner;
import com.eainde.nlg.state.ArticleState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Random;

@Slf4j
@Component
public class PlanHeadlineNode extends ArticleStageNode {

    private final DocumentPlanner planner;

    public PlanHeadlineNode(DocumentPlanner planner) {
        this.planner = planner;
    }

    @Override
    protected String stageName() {
        return "plan_headline";
    }

    @Override
    protected Map<String, Object> process(ArticleState state) {
        Random random = state.getRandom();
        DocumentPlanNode plan = planner.planHeadline(state.getCore(), random);
        log.debug("Headline plan:\n{}", plan.toTreeString());
        return Map.of(ArticleState.PLAN, plan, ArticleState.RANDOM, random);
    }
}
