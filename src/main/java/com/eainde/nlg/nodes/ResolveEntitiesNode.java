package com.eainde.nlg.nodes;

import com.eainde.nlg.model.DocumentPlanNode;
import com.eainde.nlg.realize.entity.EntityNameResolver;
import com.eainde.nlg.state.ArticleState;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Random;

@Component
public class ResolveEntitiesNode extends ArticleStageNode {

    private final EntityNameResolver resolver;

    public ResolveEntitiesNode(EntityNameResolver resolver) {
        this.resolver = resolver;
    }

    @Override
    protected String stageName() {
        return "resolve_entities";
    }

    @Override
    protected Map<String, Object> process(ArticleState state) {
        DocumentPlanNode plan = state.getPlan();
        Random random = state.getRandom();
        resolver.resolve(plan, state.getLanguage(), random);
        return Map.of(ArticleState.PLAN, plan, ArticleState.RANDOM, random);
    }
}
