package com.flamingo.ai.hybridrag.agent;

import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** AI agent that mines {@code (head, relation, tail)} triples from a chunk of text. */
public interface TripleExtractionAgent {

  @UserMessage(
      """
        From the text below, extract relationships as triples (HEAD, RELATION, TAIL).
        Examples: (FastAPI, HAS_COMPONENT, routers), (routers, ENABLES, organization), \
        (Pydantic, PROVIDES, validation).

        Text: '{{text}}'

        Extract only clear, factual relationships. Write one triple per line, formatted as:
        (entity1, relationship, entity2)

        Triples:
        """)
  String extractTriples(@V("text") String text);
}
