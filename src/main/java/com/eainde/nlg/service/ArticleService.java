package com.eainde.nlg.service;

import com.eainde.nlg.config.NlgProperties;
import com.eainde.nlg.data.DataRow;
import com.eainde.nlg.data.DatasetRegistry;
import com.eainde.nlg.data.DatasetSource;
import com.eainde.nlg.data.MessageGenerator;
import com.eainde.nlg.exception.NlgException;
import com.eainde.nlg.exception.NoMessagesForSelectionException;
import com.eainde.nlg.realize.surface.SurfaceFormat;
import com.eainde.nlg.resource.DatasetResource;
import com.eainde.nlg.resource.Languages;
import com.eainde.nlg.state.ArticleState;
import com.eainde.nlg.workflow.ArticleWorkflowGraph;
import com.eainde.nlg.workflow.WorkflowEngine;
import lombok.extern.log4j.Log4j2;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;

/**
 * Entry point for article generation and the queries a client needs to build a request.
 *
 * <p>{@link #generate} never throws: a failed headline falls back to the location id and a failed
 * body to a localized error text.</p>
 */
@Log4j2
@Service
public class ArticleService {

    static final String MDC_RUN_ID = "runId";
    static final String MDC_LANGUAGE = "language";
    static final String MDC_DATASET = "dataset";

    private final WorkflowEngine workflowEngine;
    private final DatasetRegistry datasets;
    private final List<DatasetResource> resources;
    private final ErrorMessages errors;
    private final SurfaceFormat bodyFormat;
    private final long seed;

    public ArticleService(WorkflowEngine workflowEngine, DatasetRegistry datasets, List<DatasetResource> resources,
                          ErrorMessages errors, NlgProperties properties) {
        this.workflowEngine = workflowEngine;
        this.datasets = datasets;
        this.resources = resources;
        this.errors = errors;
        this.bodyFormat = properties.getSurfaceFormat();
        if (properties.getSeed() == null) {
            this.seed = 1 + new Random().nextInt(10_000_000);
            log.info("No preset seed, using random seed {}", seed);
        } else {
            this.seed = properties.getSeed();
            log.info("Using preset seed {}", seed);
        }
    }

    // ===== Public API =====

    public Article generate(String language, String dataset, String location, String locationType) {
        return generate(language, dataset, location, locationType, null);
    }

    /**
     * @param previousLocation location of the article the reader saw before, or null
     */
    public Article generate(String language, String dataset, String location, String locationType,
                            String previousLocation) {
        String headline;
        try {
            headline = run(Languages.headline(language), dataset, location, locationType, previousLocation);
            log.info("Headline pipeline complete");
        } catch (RuntimeException e) {
            log.error("Headline generation failed for {}/{}/{}: {}", language, dataset, location, e.toString());
            headline = location;
        }

        String body;
        try {
            body = run(language, dataset, location, locationType, previousLocation);
            log.info("Body pipeline complete");
        } catch (RuntimeException e) {
            if (causeOfType(e, NoMessagesForSelectionException.class).isPresent()) {
                log.error("User selection returned no messages");
                body = errors.get(language, ErrorMessages.NO_MESSAGES_FOR_SELECTION);
            } else {
                log.error("Body generation failed for {}/{}/{}", language, dataset, location, e);
                body = errors.get(language, ErrorMessages.GENERAL_ERROR);
            }
        }
        return new Article(headline, body);
    }

    /** Locations present in a dataset, plus {@code all}. */
    public List<String> getLocations(String dataset) {
        DatasetSource source = datasets.get(dataset)
                .orElseThrow(() -> new NlgException("Unknown dataset: " + dataset));
        Set<String> locations = new LinkedHashSet<>();
        for (DataRow row : source.all()) {
            if (row.location() != null) {
                locations.add(row.location());
            }
        }
        List<String> result = new ArrayList<>(locations);
        result.add(MessageGenerator.ALL_LOCATIONS);
        return result;
    }

    /** Loaded datasets that have resources for the language, or all of them for a null language. */
    public List<String> getDatasets(String language) {
        Set<String> result = new TreeSet<>();
        for (DatasetResource resource : resources) {
            String dataset = resource.dataset();
            if (datasets.names().contains(dataset) && (language == null || resource.supports(language, dataset))) {
                result.add(dataset);
            }
        }
        return new ArrayList<>(result);
    }

    public List<String> getLanguages() {
        Set<String> languages = new TreeSet<>();
        resources.forEach(resource -> languages.addAll(resource.languages()));
        return new ArrayList<>(languages);
    }

    public long getSeed() {
        return seed;
    }

    // ===== Internals =====

    private String run(String language, String dataset, String location, String locationType,
                       String previousLocation) {
        String runId = UUID.randomUUID().toString();
        Map<String, String> outerMdc = MDC.getCopyOfContextMap();
        MDC.put(MDC_RUN_ID, runId);
        MDC.put(MDC_LANGUAGE, language);
        MDC.put(MDC_DATASET, dataset);
        try {
            log.info("Running NLG pipeline: language={}, dataset={}, location={}, location_type={}",
                    language, dataset, location, locationType);
            Map<String, Object> inputs = ArticleState.inputs(language, dataset, location, locationType,
                    previousLocation, bodyFormat, seed);
            Optional<ArticleState> result = workflowEngine.start(ArticleWorkflowGraph.WORKFLOW, inputs, runId);
            return result.map(ArticleState::getText)
                    .orElseThrow(() -> new NlgException("Workflow produced no state"));
        } finally {
            if (outerMdc == null) {
                MDC.clear();
            } else {
                MDC.setContextMap(outerMdc);
            }
        }
    }

    static <T extends Throwable> Optional<T> causeOfType(Throwable error, Class<T> type) {
        Throwable current = error;
        while (current != null) {
            if (type.isInstance(current)) {
                return Optional.of(type.cast(current));
            }
            current = Objects.equals(current.getCause(), current) ? null : current.getCause();
        }
        return Optional.empty();
    }
}
