package com.eainde.nlg.edges;

import com.eainde.nlg.state.ArticleState;
import org.bsc.langgraph4j.action.AsyncEdgeAction;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Sends headline runs ({@code <lang>-head}) to the headline planner and everything else to the
 * body planner.
 */
@Component
public class PlannerRoutingEdge implements AsyncEdgeAction<ArticleState> {

    public static final String HEADLINE = "headline";
    public static final String BODY = "body";

    @Override
    public CompletableFuture<String> apply(ArticleState state) {
        return CompletableFuture.completedFuture(state.isHeadline() ? HEADLINE : BODY);
    }
}
