package com.flamingo.ai.hybridrag.service.extraction;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.hybridrag.domain.model.Triple;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("TripleLineParser Tests")
class TripleLineParserTest {

  private final TripleLineParser parser = new TripleLineParser();

  @Test
  @DisplayName("should parse one triple per well-formed line")
  void shouldParseWellFormedLines() {
    String reply = "(FastAPI, HAS, routers)\n(Routers, ENABLE, organization)";

    List<Triple> triples = parser.parse(reply);

    assertThat(triples)
        .containsExactly(
            new Triple("FastAPI", "HAS", "routers"),
            new Triple("Routers", "ENABLE", "organization"));
  }

  @Test
  @DisplayName("should skip prose and malformed lines")
  void shouldSkipMalformedLines() {
    String reply =
        "Here are the triples:\r\n"
            + "1. (FastAPI, USES, Pydantic)\r\n"
            + "(only, two)\r\n"
            + "\r\n"
            + "(Pydantic, provides, \"data validation\")";

    List<Triple> triples = parser.parse(reply);

    assertThat(triples)
        .containsExactly(
            new Triple("FastAPI", "USES", "Pydantic"),
            new Triple("Pydantic", "PROVIDES", "data validation"));
  }

  @Test
  @DisplayName("should normalize multi-word relations")
  void shouldNormalizeMultiWordRelations() {
    assertThat(parser.parse("(FastAPI, is built on, Starlette)"))
        .containsExactly(new Triple("FastAPI", "IS_BUILT_ON", "Starlette"));
  }

  @Test
  @DisplayName("should return no triples for an empty reply")
  void shouldReturnNoTriples_forEmptyReply() {
    assertThat(parser.parse("")).isEmpty();
    assertThat(parser.parse(null)).isEmpty();
  }
}
