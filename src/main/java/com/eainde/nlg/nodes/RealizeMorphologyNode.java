package com.eainde.nlg.nodes;

import com.eainde.nlg.model.DocumentPlanNode;
import com.eainde.nlg.realize.morphology.MorphologicalRealizer;
import com.eainde.nlg.state.ArticleState;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class RealizeMorphologyNode extends ArticleStageNode {

    private final MorphologicalRealizer morphologicalRealizer;

    public RealizeMorphologyNode(MorphologicalRealizer morphologicalRealizer) {
        this.morphologicalRealizer = morphologicalRealizer;
    }

    @Override
    protected String stageName() {
        return "realize_morphology";
    }

    @Override
    protected Map<String, Object> process(ArticleState state) {
        DocumentPlanNode plan = state.getPlan();
        morphologicalRealizer.realize(plan, state.getLanguage());
        return Map.of(ArticleState.PLAN, plan);
    }
}
