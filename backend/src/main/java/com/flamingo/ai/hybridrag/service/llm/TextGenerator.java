package com.flamingo.ai.hybridrag.service.llm;

import com.flamingo.ai.hybridrag.exception.LlmServiceException;

/**
 * Gateway to the optional text generator used by generative extraction, routing and answering.
 *
 * <p>Every call either returns non-blank text or throws {@link LlmServiceException}; callers
 * degrade to their deterministic path on failure.
 */
public interface TextGenerator {

  /** Returns {@code true} if a chat model is configured. */
  boolean isAvailable();

  /**
   * Asks for {@code (entity1, relationship, entity2)} lines describing the chunk.
   *
   * @param chunkText chunk to mine
   * @return raw completion, one candidate triple per line
   */
  String extractTriples(String chunkText);

  /**
   * Asks which retrieval path suits the question.
   *
   * @param question user question
   * @return raw completion mentioning option (A) or (B)
   */
  String chooseRoute(String question);

  String answerFromPassages(String context, String question);

  String answerFromFacts(String facts, String question);
}
