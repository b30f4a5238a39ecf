package com.flamingo.ai.hybridrag.agent;

import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** AI agent that answers a question strictly from retrieved passages or facts. */
public interface GroundedAnswerAgent {

  @UserMessage(
      """
        Based on the following context, answer the question concisely and accurately:

        Context:
        {{context}}

        Question: {{question}}

        Answer:
        """)
  String answerFromPassages(@V("context") String context, @V("question") String question);

  @UserMessage(
      """
        Based on the following relationships, answer the question:

        Relationships:
        {{facts}}

        Question: {{question}}

        Provide a clear, concise answer based on these relationships:
        """)
  String answerFromFacts(@V("facts") String facts, @V("question") String question);
}
