package com.eainde.nlg.nodes;

import com.eainde.nlg.model.DocumentPlanNode;
import com.eainde.nlg.realize.number.NumberRealizer;
import com.eainde.nlg.state.ArticleState;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class RealizeNumbersNode extends ArticleStageNode {

    private final NumberRealizer numberRealizer;

    public RealizeNumbersNode(NumberRealizer numberRealizer) {
        this.numberRealizer = numberRealizer;
    }

    @Override
    protected String stageName() {
        return "realize_numbers";
    }

    @Override
    protected Map<String, Object> process(ArticleState state) {
        DocumentPlanNode plan = state.getPlan();
        numberRealizer.realize(plan, state.getLanguage());
        return Map.of(ArticleState.PLAN, plan);
    }
}
