package com.flamingo.ai.hybridrag.agent;

import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** AI agent that picks the retrieval path for a question. Replies mention (A) or (B). */
public interface QueryRoutingAgent {

  String SEMANTIC_OPTION = "Semantic Search";
  String RELATIONAL_OPTION = "Relationship Query";

  @UserMessage(
      """
        Given the user's question, determine if it is better answered by:
        (A) Semantic Search: for questions about definitions, explanations, or 'what is' \
        questions.
        (B) Relationship Query: for questions about relationships, connections, or 'how does \
        X relate to Y' questions.

        Question: '{{question}}'

        Answer with (A) or (B) only.
        """)
  String chooseRoute(@V("question") String question);
}
