package com.eainde.nlg.bulk;

import com.eainde.nlg.config.NlgProperties;
import com.eainde.nlg.service.Article;
import com.eainde.nlg.service.ArticleService;
import com.eainde.nlg.thread.MdcAwareExecutor;
import lombok.extern.log4j.Log4j2;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Writes the body of every (language, dataset, location) article to
 * {@code <variant>-<language>-<dataset>-<location>.txt}. Articles are generated in parallel; a
 * failing article is logged and skipped.
 */
@Log4j2
@Service
public class BulkArticleGenerator {

    static final String LOCATION_TYPE = "country";

    private final ArticleService articleService;
    private final MdcAwareExecutor executor;
    private final String variant;

    public BulkArticleGenerator(ArticleService articleService, MdcAwareExecutor bulkExecutor,
                                NlgProperties properties) {
        this.articleService = articleService;
        this.executor = bulkExecutor;
        this.variant = properties.getPlanner().getVariant();
    }

    public record Report(List<Path> written, List<String> failed) {
    }

    /**
     * @param datasets  datasets to generate, or empty for all
     * @param languages languages to generate, or empty for all
     */
    public Report generate(Path outputDirectory, Collection<String> datasets, Collection<String> languages) {
        try {
            Files.createDirectories(outputDirectory);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not create " + outputDirectory, e);
        }

        ConcurrentLinkedQueue<Path> written = new ConcurrentLinkedQueue<>();
        ConcurrentLinkedQueue<String> failed = new ConcurrentLinkedQueue<>();
        List<CompletableFuture<Void>> tasks = new ArrayList<>();

        for (String language : articleService.getLanguages()) {
            if (!languages.isEmpty() && !languages.contains(language)) {
                continue;
            }
            for (String dataset : articleService.getDatasets(language)) {
                if (!datasets.isEmpty() && !datasets.contains(dataset)) {
                    continue;
                }
                for (String location : articleService.getLocations(dataset)) {
                    Path target = outputDirectory.resolve(
                            String.format("%s-%s-%s-%s.txt", variant, language, dataset, location));
                    String name = target.getFileName().toString();
                    tasks.add(CompletableFuture.runAsync(() -> {
                        MDC.put("article", name);
                        long start = System.currentTimeMillis();
                        try {
                            Article article = articleService.generate(language, dataset, location, LOCATION_TYPE);
                            Files.writeString(target, article.body() + "\n", StandardCharsets.UTF_8);
                            written.add(target);
                            log.info("Wrote {} in {} ms", name, System.currentTimeMillis() - start);
                        } catch (IOException | RuntimeException e) {
                            log.error("Error with inputs: variant={}, language={}, dataset={}, location={}",
                                    variant, language, dataset, location, e);
                            failed.add(name);
                        }
                    }, executor));
                }
            }
        }

        CompletableFuture.allOf(tasks.toArray(new CompletableFuture[0])).join();
        log.info("Bulk generation done: {} written, {} failed", written.size(), failed.size());
        return new Report(List.copyOf(written), List.copyOf(failed));
    }
}
