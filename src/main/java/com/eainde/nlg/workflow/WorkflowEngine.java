package com.eainde.nlg.workflow;

import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.RunnableConfig;
import org.bsc.langgraph4j.state.AgentState;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs the compiled workflows registered as beans, by bean name.
 * <p>
 * Every run gets its own thread id, which is also put in the MDC by the caller so that log lines
 * of one article can be told apart in bulk runs.
 * </p>
 */
@Log4j2
@Service
public class WorkflowEngine {

    private final Map<String, CompiledGraph<? extends AgentState>> registry = new ConcurrentHashMap<>();

    // Spring injects every CompiledGraph bean, keyed by bean name
    public WorkflowEngine(Map<String, CompiledGraph<? extends AgentState>> allGraphs) {
        this.registry.putAll(allGraphs);
        log.info("Registered workflows {}", registry.keySet());
    }

    public <S extends AgentState> Optional<S> start(String beanName, Map<String, Object> inputs) {
        return start(beanName, inputs, UUID.randomUUID().toString());
    }

    /**
     * Runs a workflow to completion on the calling thread.
     *
     * @param beanName name of the graph bean, e.g. {@code articleWorkflow}
     * @param inputs   initial state
     * @param runId    thread id of the run
     * @return the final state
     * @throws IllegalArgumentException if no workflow has that name
     */
    @SuppressWarnings("unchecked")
    public <S extends AgentState> Optional<S> start(String beanName, Map<String, Object> inputs, String runId) {
        CompiledGraph<S> graph = (CompiledGraph<S>) registry.get(beanName);
        if (graph == null) {
            throw new IllegalArgumentException("No workflow found with name: " + beanName);
        }
        log.debug("Starting {} as run {}", beanName, runId);

        RunnableConfig config = RunnableConfig.builder()
                .threadId(runId)
                .build();

        return graph.invoke(inputs, config);
    }
}
