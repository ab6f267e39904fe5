package com.eainde.nlg.nodes;

import com.eainde.nlg.model.DocumentPlanNode;
import com.eainde.nlg.state.ArticleState;
import com.eainde.nlg.template.TemplateRepository;
import com.eainde.nlg.template.TemplateSelector;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Random;

@Component
public class SelectTemplatesNode extends ArticleStageNode {

    private final TemplateRepository templates;
    private final TemplateSelector selector;

    public SelectTemplatesNode(TemplateRepository templates, TemplateSelector selector) {
        this.templates = templates;
        this.selector = selector;
    }

    @Override
    protected String stageName() {
        return "select_templates";
    }

    @Override
    protected Map<String, Object> process(ArticleState state) {
        DocumentPlanNode plan = state.getPlan();
        Random random = state.getRandom();
        selector.selectTemplates(plan, state.getAllMessages(), templates.getTemplates(state.getLanguage()), random);
        return Map.of(ArticleState.PLAN, plan, ArticleState.RANDOM, random);
    }
}
