package com.eainde.nlg.nodes;

import com.eainde.nlg.state.ArticleState;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.action.AsyncNodeAction;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Base of the pipeline stages. A stage reads the state, does its work synchronously and returns
 * the keys it changed. Failures are returned as failed futures so the caller sees the original
 * exception as the cause.
 */
@Slf4j
public abstract class ArticleStageNode implements AsyncNodeAction<ArticleState> {

    @Override
    public CompletableFuture<Map<String, Object>> apply(ArticleState state) {
        log.debug("Running stage {} for {}", stageName(), state.getLanguage());
        try {
            return CompletableFuture.completedFuture(process(state));
        } catch (RuntimeException e) {
            log.debug("Stage {} failed: {}", stageName(), e.toString());
            return CompletableFuture.failedFuture(e);
        }
    }

    protected abstract String stageName();

    protected abstract Map<String, Object> process(ArticleState state);
}
