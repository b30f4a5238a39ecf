package com.flamingo.ai.hybridrag.store;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("EntityKeywords Tests")
class EntityKeywordsTest {

  @Test
  @DisplayName("should lower-case and split on non-alphanumeric characters")
  void shouldTokenizeQuestion() {
    assertThat(EntityKeywords.tokenize("How does FastAPI relate to Pydantic?"))
        .containsExactly("how", "does", "fastapi", "relate", "to", "pydantic");
  }

  @Test
  @DisplayName("should return no tokens for blank text")
  void shouldReturnNoTokens_forBlankText() {
    assertThat(EntityKeywords.tokenize(" ?! ")).isEmpty();
    assertThat(EntityKeywords.tokenize(null)).isEmpty();
  }

  @Test
  @DisplayName("should match whole tokens only")
  void shouldMatchWholeTokensOnly() {
    Set<String> keywords = Set.of("api", "routers");

    assertThat(EntityKeywords.sharesToken("FastAPI", keywords)).isFalse();
    assertThat(EntityKeywords.sharesToken("API gateway", keywords)).isTrue();
    assertThat(EntityKeywords.sharesToken("Routers", keywords)).isTrue();
    assertThat(EntityKeywords.sharesToken("Routers", Set.of())).isFalse();
  }
}
