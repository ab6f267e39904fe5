package com.eainde.nlg.service;

import com.eainde.nlg.config.NlgProperties;
import com.eainde.nlg.data.DataRow;
import com.eainde.nlg.data.DatasetRegistry;
import com.eainde.nlg.data.JsonDatasetSource;
import com.eainde.nlg.exception.NlgException;
import com.eainde.nlg.exception.NoMessagesForSelectionException;
import com.eainde.nlg.realize.slot.SlotRealizerComponent;
import com.eainde.nlg.resource.DatasetResource;
import com.eainde.nlg.state.ArticleState;
import com.eainde.nlg.workflow.ArticleWorkflowGraph;
import com.eainde.nlg.workflow.WorkflowEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ArticleServiceTest {

    private record StubResource(String dataset, Set<String> languages) implements DatasetResource {

        @Override
        public String templateLocation() {
            return "templates/" + dataset + ".txt";
        }

        @Override
        public List<SlotRealizerComponent> slotRealizers() {
            return List.of();
        }
    }

    @Mock
    private WorkflowEngine workflowEngine;

    private ArticleService service;

    @BeforeEach
    void setUp() {
        DatasetRegistry datasets = new DatasetRegistry(List.of(
                new JsonDatasetSource("cphi", List.of(
                        new DataRow(Map.of(DataRow.LOCATION, "FI", DataRow.TIMESTAMP, "2020")),
                        new DataRow(Map.of(DataRow.LOCATION, "SE", DataRow.TIMESTAMP, "2020")),
                        new DataRow(Map.of(DataRow.LOCATION, "FI", DataRow.TIMESTAMP, "2019")))),
                new JsonDatasetSource("health_cost", List.of())));
        List<DatasetResource> resources = List.of(
                new StubResource("cphi", Set.of("en", "fi", "hr")),
                new StubResource("health_cost", Set.of("en", "fi")),
                new StubResource("weather", Set.of("sv")));
        ErrorMessages errors = new ErrorMessages(Map.of("en", Map.of(
                ErrorMessages.NO_MESSAGES_FOR_SELECTION, "Nothing to report",
                ErrorMessages.GENERAL_ERROR, "Generation failed")));
        NlgProperties properties = new NlgProperties();
        properties.setSeed(42L);
        service = new ArticleService(workflowEngine, datasets, resources, errors, properties);
    }

    private void answerOnlyFor(String language, String text) {
        when(workflowEngine.<ArticleState>start(eq(ArticleWorkflowGraph.WORKFLOW),
                anyMap(), anyString()))
                .thenAnswer(invocation -> {
                    Map<String, Object> inputs = invocation.getArgument(1);
                    if (!language.equals(inputs.get(ArticleState.LANGUAGE))) {
                        throw new IllegalStateException("headline failed");
                    }
                    return Optional.of(new ArticleState(Map.of(ArticleState.TEXT, text)));
                });
    }

    @Nested
    @DisplayName("Generation")
    class Generation {

        @Test
        @DisplayName("should run the headline and body workflows")
        void headlineAndBody() {
            when(workflowEngine.<ArticleState>start(eq(ArticleWorkflowGraph.WORKFLOW), anyMap(), anyString()))
                    .thenAnswer(invocation -> {
                        Map<String, Object> inputs = invocation.getArgument(1);
                        String text = "en-head".equals(inputs.get(ArticleState.LANGUAGE))
                                ? "Prices rose"
                                : "<p>Body</p>";
                        return Optional.of(new ArticleState(Map.of(ArticleState.TEXT, text)));
                    });

            Article article = service.generate("en", "cphi", "FI", "country");

            assertThat(article).isEqualTo(new Article("Prices rose", "<p>Body</p>"));
        }

        @Test
        @DisplayName("should fall back to the location when the headline fails")
        void headlineFallback() {
            answerOnlyFor("en", "<p>Body</p>");

            Article article = service.generate("en", "cphi", "FI", "country");

            assertThat(article.headline()).isEqualTo("FI");
            assertThat(article.body()).isEqualTo("<p>Body</p>");
        }

        @Test
        @DisplayName("should explain an empty selection in the body")
        void noMessages() {
            when(workflowEngine.<ArticleState>start(eq(ArticleWorkflowGraph.WORKFLOW), anyMap(), anyString()))
                    .thenThrow(new RuntimeException("node failed",
                            new NoMessagesForSelectionException("No core messages for XX in cphi")));

            Article article = service.generate("en", "cphi", "XX", "country");

            assertThat(article).isEqualTo(new Article("XX", "Nothing to report"));
        }

        @Test
        @DisplayName("should show the general error text for other failures")
        void generalError() {
            when(workflowEngine.<ArticleState>start(eq(ArticleWorkflowGraph.WORKFLOW), anyMap(), anyString()))
                    .thenThrow(new IllegalStateException("boom"));

            assertThat(service.generate("en", "cphi", "FI", "country").body()).isEqualTo("Generation failed");
            assertThat(service.generate("fi", "cphi", "FI", "country").body()).isEqualTo(ErrorMessages.FALLBACK);
        }
    }

    @Nested
    @DisplayName("Queries")
    class Queries {

        @Test
        @DisplayName("should list the locations of a dataset once each, plus all")
        void locations() {
            assertThat(service.getLocations("cphi")).containsExactly("FI", "SE", "all");
        }

        @Test
        @DisplayName("should reject an unknown dataset")
        void unknownDataset() {
            assertThatThrownBy(() -> service.getLocations("weather")).isInstanceOf(NlgException.class);
        }

        @Test
        @DisplayName("should list only loaded datasets supporting the language")
        void datasets() {
            assertThat(service.getDatasets("hr")).containsExactly("cphi");
            assertThat(service.getDatasets("fi-head")).containsExactly("cphi", "health_cost");
            assertThat(service.getDatasets(null)).containsExactly("cphi", "health_cost");
        }

        @Test
        @DisplayName("should list every language some dataset supports")
        void languages() {
            assertThat(service.getLanguages()).containsExactly("en", "fi", "hr", "sv");
        }

        @Test
        @DisplayName("should use the preset seed")
        void seed() {
            assertThat(service.getSeed()).isEqualTo(42L);
        }
    }

    @Test
    @DisplayName("should find a cause of a given type in the chain")
    void causeOfType() {
        NoMessagesForSelectionException cause = new NoMessagesForSelectionException("none");

        assertThat(ArticleService.causeOfType(new RuntimeException(new RuntimeException(cause)),
                NoMessagesForSelectionException.class)).containsSame(cause);
        assertThat(ArticleService.causeOfType(new RuntimeException("plain"),
                NoMessagesForSelectionException.class)).isEmpty();
    }
}
