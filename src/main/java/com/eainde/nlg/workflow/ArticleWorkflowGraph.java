package com.eainde.nlg.workflow;

import com.eainde.nlg.edges.PlannerRoutingEdge;
import com.eainde.nlg.nodes.AggregateNode;
import com.eainde.nlg.nodes.GenerateMessagesNode;
import com.eainde.nlg.nodes.PlanBodyNode;
import com.eainde.nlg.nodes.PlanHeadlineNode;
import com.eainde.nlg.nodes.RealizeDatesNode;
import com.eainde.nlg.nodes.RealizeMorphologyNode;
import com.eainde.nlg.nodes.RealizeNumbersNode;
import com.eainde.nlg.nodes.RealizeSlotsNode;
import com.eainde.nlg.nodes.ResolveEntitiesNode;
import com.eainde.nlg.nodes.ScoreImportanceNode;
import com.eainde.nlg.nodes.SelectTemplatesNode;
import com.eainde.nlg.nodes.SurfaceRealizeNode;
import com.eainde.nlg.state.ArticleState;
import org.bsc.langgraph4j.CompileConfig;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.GraphStateException;
import org.bsc.langgraph4j.StateGraph;
import org.springframework.context.annotation.Bean;
import org.springframework.stereotype.Component;

import java.util.Map;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;

/**
 * The article pipeline:
 * <pre>
 * generate_messages -> score_importance -> (plan_headline | plan_body) -> select_templates
 *   -> aggregate -> realize_slots -> realize_dates -> resolve_entities -> realize_numbers
 *   -> realize_morphology -> surface_realize
 * </pre>
 */
@Component
public class ArticleWorkflowGraph {

    public static final String WORKFLOW = "articleWorkflow";

    static final String GENERATE_MESSAGES = "generate_messages";
    static final String SCORE_IMPORTANCE = "score_importance";
    static final String PLAN_HEADLINE = "plan_headline";
    static final String PLAN_BODY = "plan_body";
    static final String SELECT_TEMPLATES = "select_templates";
    static final String AGGREGATE = "aggregate";
    static final String REALIZE_SLOTS = "realize_slots";
    static final String REALIZE_DATES = "realize_dates";
    static final String RESOLVE_ENTITIES = "resolve_entities";
    static final String REALIZE_NUMBERS = "realize_numbers";
    static final String REALIZE_MORPHOLOGY = "realize_morphology";
    static final String SURFACE_REALIZE = "surface_realize";

    private final GenerateMessagesNode generateMessages;
    private final ScoreImportanceNode scoreImportance;
    private final PlanHeadlineNode planHeadline;
    private final PlanBodyNode planBody;
    private final SelectTemplatesNode selectTemplates;
    private final AggregateNode aggregate;
    private final RealizeSlotsNode realizeSlots;
    private final RealizeDatesNode realizeDates;
    private final ResolveEntitiesNode resolveEntities;
    private final RealizeNumbersNode realizeNumbers;
    private final RealizeMorphologyNode realizeMorphology;
    private final SurfaceRealizeNode surfaceRealize;
    private final PlannerRoutingEdge plannerRouting;

    public ArticleWorkflowGraph(
            GenerateMessagesNode generateMessages,
            ScoreImportanceNode scoreImportance,
            PlanHeadlineNode planHeadline,
            PlanBodyNode planBody,
            SelectTemplatesNode selectTemplates,
            AggregateNode aggregate,
            RealizeSlotsNode realizeSlots,
            RealizeDatesNode realizeDates,
            ResolveEntitiesNode resolveEntities,
            RealizeNumbersNode realizeNumbers,
            RealizeMorphologyNode realizeMorphology,
            SurfaceRealizeNode surfaceRealize,
            PlannerRoutingEdge plannerRouting) {
        this.generateMessages = generateMessages;
        this.scoreImportance = scoreImportance;
        this.planHeadline = planHeadline;
        this.planBody = planBody;
        this.selectTemplates = selectTemplates;
        this.aggregate = aggregate;
        this.realizeSlots = realizeSlots;
        this.realizeDates = realizeDates;
        this.resolveEntities = resolveEntities;
        this.realizeNumbers = realizeNumbers;
        this.realizeMorphology = realizeMorphology;
        this.surfaceRealize = surfaceRealize;
        this.plannerRouting = plannerRouting;
    }

    @Bean(WORKFLOW)
    public CompiledGraph<ArticleState> build() throws GraphStateException {

        StateGraph<ArticleState> workflow = new StateGraph<>(ArticleState::new);

        workflow.addNode(GENERATE_MESSAGES, generateMessages);
        workflow.addNode(SCORE_IMPORTANCE, scoreImportance);
        workflow.addNode(PLAN_HEADLINE, planHeadline);
        workflow.addNode(PLAN_BODY, planBody);
        workflow.addNode(SELECT_TEMPLATES, selectTemplates);
        workflow.addNode(AGGREGATE, aggregate);
        workflow.addNode(REALIZE_SLOTS, realizeSlots);
        workflow.addNode(REALIZE_DATES, realizeDates);
        workflow.addNode(RESOLVE_ENTITIES, resolveEntities);
        workflow.addNode(REALIZE_NUMBERS, realizeNumbers);
        workflow.addNode(REALIZE_MORPHOLOGY, realizeMorphology);
        workflow.addNode(SURFACE_REALIZE, surfaceRealize);

        workflow.addEdge(START, GENERATE_MESSAGES);
        workflow.addEdge(GENERATE_MESSAGES, SCORE_IMPORTANCE);

        workflow.addConditionalEdges(
                SCORE_IMPORTANCE,
                plannerRouting,
                Map.of(
                        PlannerRoutingEdge.HEADLINE, PLAN_HEADLINE,
                        PlannerRoutingEdge.BODY, PLAN_BODY
                )
        );

        workflow.addEdge(PLAN_HEADLINE, SELECT_TEMPLATES);
        workflow.addEdge(PLAN_BODY, SELECT_TEMPLATES);
        workflow.addEdge(SELECT_TEMPLATES, AGGREGATE);
        workflow.addEdge(AGGREGATE, REALIZE_SLOTS);
        workflow.addEdge(REALIZE_SLOTS, REALIZE_DATES);
        workflow.addEdge(REALIZE_DATES, RESOLVE_ENTITIES);
        workflow.addEdge(RESOLVE_ENTITIES, REALIZE_NUMBERS);
        workflow.addEdge(REALIZE_NUMBERS, REALIZE_MORPHOLOGY);
        workflow.addEdge(REALIZE_MORPHOLOGY, SURFACE_REALIZE);
        workflow.addEdge(SURFACE_REALIZE, END);

        return workflow.compile(CompileConfig.builder().build());
    }
}
