package com.eainde.nlg.bulk;

import com.eainde.nlg.config.NlgProperties;
import com.eainde.nlg.service.Article;
import com.eainde.nlg.service.ArticleService;
import com.eainde.nlg.thread.MdcAwareExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BulkArticleGeneratorTest {

    @Mock
    private ArticleService articleService;

    @TempDir
    Path outputDirectory;

    private final MdcAwareExecutor executor = new MdcAwareExecutor(2);

    private BulkArticleGenerator generator;

    @BeforeEach
    void setUp() {
        NlgProperties properties = new NlgProperties();
        generator = new BulkArticleGenerator(articleService, executor, properties);
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    @DisplayName("should write one body per language, dataset and location and report failures")
    void writesArticles() throws IOException {
        when(articleService.getLanguages()).thenReturn(List.of("en", "fi"));
        when(articleService.getDatasets("en")).thenReturn(List.of("cphi"));
        when(articleService.getLocations("cphi")).thenReturn(List.of("FI", "SE"));
        when(articleService.generate("en", "cphi", "FI", "country"))
                .thenReturn(new Article("Prices rose", "<p>Prices rose in Finland. </p>"));
        when(articleService.generate("en", "cphi", "SE", "country"))
                .thenThrow(new IllegalStateException("boom"));

        BulkArticleGenerator.Report report = generator.generate(outputDirectory, Set.of(), Set.of("en"));

        Path written = outputDirectory.resolve("full-en-cphi-FI.txt");
        assertThat(report.written()).containsExactly(written);
        assertThat(report.failed()).containsExactly("full-en-cphi-SE.txt");
        assertThat(Files.readString(written)).isEqualTo("<p>Prices rose in Finland. </p>\n");
        verify(articleService, never()).getDatasets("fi");
    }

    @Test
    @DisplayName("should skip datasets that were not asked for")
    void filtersDatasets() {
        when(articleService.getLanguages()).thenReturn(List.of("en"));
        when(articleService.getDatasets("en")).thenReturn(List.of("cphi", "health_cost"));
        when(articleService.getLocations("health_cost")).thenReturn(List.of("FI"));
        when(articleService.generate("en", "health_cost", "FI", "country"))
                .thenReturn(new Article("FI", "<p>Costs. </p>"));

        BulkArticleGenerator.Report report = generator.generate(outputDirectory, Set.of("health_cost"), Set.of());

        assertThat(report.written()).containsExactly(outputDirectory.resolve("full-en-health_cost-FI.txt"));
        verify(articleService, never()).getLocations("cphi");
    }
}
