package com.eainde.nlg.nodes;

import com.eainde.nlg.model.DocumentPlanNode;
import com.eainde.nlg.realize.slot.SlotRealizer;
import com.eainde.nlg.state.ArticleState;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Random;

@Component
public class RealizeSlotsNode extends ArticleStageNode {

    private final SlotRealizer slotRealizer;

    public RealizeSlotsNode(SlotRealizer slotRealizer) {
        this.slotRealizer = slotRealizer;
    }

    @Override
    protected String stageName() {
        return "realize_slots";
    }

    @Override
    protected Map<String, Object> process(ArticleState state) {
        DocumentPlanNode plan = state.getPlan();
        Random random = state.getRandom();
        slotRealizer.realize(plan, state.getLanguage(), random);
        return Map.of(ArticleState.PLAN, plan, ArticleState.RANDOM, random);
    }
}
