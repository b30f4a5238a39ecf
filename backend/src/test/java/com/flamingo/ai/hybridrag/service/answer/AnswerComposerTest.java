package com.flamingo.ai.hybridrag.service.answer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.hybridrag.config.RagConfig;
import com.flamingo.ai.hybridrag.domain.model.ComposedAnswer;
import com.flamingo.ai.hybridrag.domain.model.Evidence;
import com.flamingo.ai.hybridrag.domain.model.RoutingDecision;
import com.flamingo.ai.hybridrag.domain.model.Triple;
import com.flamingo.ai.hybridrag.exception.LlmServiceException;
import com.flamingo.ai.hybridrag.service.llm.TextGenerator;
import com.flamingo.ai.hybridrag.store.RelationshipIndex;
import com.flamingo.ai.hybridrag.store.SemanticHit;
import com.flamingo.ai.hybridrag.store.SemanticIndex;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentMatchers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("AnswerComposer Tests")
class AnswerComposerTest {

  @Mock private SemanticIndex semanticIndex;
  @Mock private RelationshipIndex relationshipIndex;
  @Mock private TextGenerator textGenerator;

  private SimpleMeterRegistry meterRegistry;
  private AnswerComposer composer;

  @BeforeEach
  void setUp() {
    RagConfig ragConfig = new RagConfig();
    meterRegistry = new SimpleMeterRegistry();
    composer =
        new AnswerComposer(
            List.of(
                new SemanticRetrievalPath(semanticIndex, ragConfig),
                new RelationalRetrievalPath(relationshipIndex, ragConfig)),
            textGenerator,
            meterRegistry);
  }

  @Nested
  @DisplayName("Semantic route")
  class SemanticRoute {

    @Test
    @DisplayName("should answer from passages through the generator")
    void shouldAnswerThroughGenerator() {
      when(semanticIndex.query("What is FastAPI?", 3))
          .thenReturn(List.of(new SemanticHit("c1", "FastAPI is a framework.", Map.of(), 0.9)));
      when(textGenerator.isAvailable()).thenReturn(true);
      when(textGenerator.answerFromPassages("FastAPI is a framework.", "What is FastAPI?"))
          .thenReturn("FastAPI is a web framework.");

      ComposedAnswer answer = composer.answer("What is FastAPI?", RoutingDecision.SEMANTIC);

      assertThat(answer.text()).isEqualTo("FastAPI is a web framework.");
      assertThat(answer.generated()).isTrue();
      assertThat(answer.evidence())
          .containsExactly(new Evidence(Evidence.SEMANTIC_INDEX, List.of("c1"), 1));
    }

    @Test
    @DisplayName("should answer without the generator when nothing is retrieved")
    void shouldAnswerNoResults_withoutGenerator() {
      when(semanticIndex.query("What is FastAPI?", 3)).thenReturn(List.of());

      ComposedAnswer answer = composer.answer("What is FastAPI?", RoutingDecision.SEMANTIC);

      assertThat(answer.text()).isEqualTo("No relevant information found");
      assertThat(answer.evidence()).isEmpty();
      verify(textGenerator, never()).isAvailable();
    }

    @Test
    @DisplayName("should fall back to the template answer when generation fails")
    void shouldFallBack_whenGenerationFails() {
      when(semanticIndex.query("What is FastAPI?", 3))
          .thenReturn(List.of(new SemanticHit("c1", "FastAPI is a framework.", Map.of(), 0.9)));
      when(textGenerator.isAvailable()).thenReturn(true);
      when(textGenerator.answerFromPassages(anyString(), anyString()))
          .thenThrow(new LlmServiceException("Text generation failed: timeout"));

      ComposedAnswer answer = composer.answer("What is FastAPI?", RoutingDecision.SEMANTIC);

      assertThat(answer.text())
          .isEqualTo("Based on the available information: FastAPI is a framework....");
      assertThat(answer.generated()).isFalse();
      assertThat(answer.evidence()).hasSize(1);
      assertThat(meterRegistry.counter("answer.fallback", "route", "semantic").count())
          .isEqualTo(1.0);
    }
  }

  @Nested
  @DisplayName("Relational route")
  class RelationalRoute {

    @Test
    @DisplayName("should list facts when the generator is not configured")
    void shouldListFacts_whenGeneratorUnavailable() {
      when(relationshipIndex.match(ArgumentMatchers.anySet()))
          .thenReturn(List.of(new Triple("FastAPI", "HAS", "routers")));
      when(textGenerator.isAvailable()).thenReturn(false);

      ComposedAnswer answer =
          composer.answer("What does FastAPI have?", RoutingDecision.RELATIONAL);

      assertThat(answer.text()).isEqualTo("Based on the relationships:\n• FastAPI has routers");
      assertThat(answer.evidence())
          .containsExactly(new Evidence(Evidence.RELATIONSHIP_INDEX, List.of(), 1));
      verify(textGenerator, never()).answerFromFacts(anyString(), anyString());
    }

    @Test
    @DisplayName("should answer no relevant relationships when nothing matches")
    void shouldAnswerNoRelationships() {
      when(relationshipIndex.match(ArgumentMatchers.anySet())).thenReturn(List.of());

      ComposedAnswer answer =
          composer.answer("How does Django relate to Flask?", RoutingDecision.RELATIONAL);

      assertThat(answer.text()).isEqualTo("No relevant relationships found");
      assertThat(answer.evidence()).isEmpty();
    }
  }

  @Test
  @DisplayName("should fail when no retrieval path serves the route")
  void shouldFail_whenNoPathForRoute() {
    AnswerComposer semanticOnly =
        new AnswerComposer(
            List.of(new SemanticRetrievalPath(semanticIndex, new RagConfig())),
            textGenerator,
            meterRegistry);

    assertThatThrownBy(() -> semanticOnly.answer("What has routers?", RoutingDecision.RELATIONAL))
        .isInstanceOf(IllegalStateException.class);
  }
}
