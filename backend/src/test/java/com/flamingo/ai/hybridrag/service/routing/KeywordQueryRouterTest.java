package com.flamingo.ai.hybridrag.service.routing;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.hybridrag.config.RagConfig;
import com.flamingo.ai.hybridrag.domain.model.RoutingDecision;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("KeywordQueryRouter Tests")
class KeywordQueryRouterTest {

  private final KeywordQueryRouter router = new KeywordQueryRouter(new RagConfig());

  @ParameterizedTest
  @ValueSource(
      strings = {
        "How does FastAPI relate to routers?",
        "What is the connection between routers and apps?",
        "Which tools does FastAPI use? What uses Starlette?",
        "WHAT DEPENDS ON UVICORN"
      })
  @DisplayName("should route questions with relational indicators to the relationship index")
  void shouldRouteRelationalQuestions(String question) {
    assertThat(router.route(question)).isEqualTo(RoutingDecision.RELATIONAL);
  }

  @ParameterizedTest
  @ValueSource(strings = {"What is FastAPI?", "Explain dependency injection", "Tell me a story"})
  @DisplayName("should route everything else to the semantic index")
  void shouldRouteOtherQuestionsToSemantic(String question) {
    assertThat(router.route(question)).isEqualTo(RoutingDecision.SEMANTIC);
  }

  @Test
  @DisplayName("should check relational indicators before semantic ones")
  void shouldPreferRelational_whenBothIndicatorsPresent() {
    assertThat(router.route("Explain what FastAPI includes")).isEqualTo(RoutingDecision.RELATIONAL);
  }

  @Test
  @DisplayName("should route a null question to semantic search")
  void shouldRouteNullQuestionToSemantic() {
    assertThat(router.route(null)).isEqualTo(RoutingDecision.SEMANTIC);
  }
}
