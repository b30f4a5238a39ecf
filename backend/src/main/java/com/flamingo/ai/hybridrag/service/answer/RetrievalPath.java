package com.flamingo.ai.hybridrag.service.answer;

import com.flamingo.ai.hybridrag.domain.model.Evidence;
import com.flamingo.ai.hybridrag.domain.model.RetrievalResult;
import com.flamingo.ai.hybridrag.domain.model.RoutingDecision;
import com.flamingo.ai.hybridrag.service.llm.TextGenerator;
import java.util.List;

/**
 * One way of answering a question: retrieve ranked results from a store, then turn them into text
 * either through the generator or through a fixed template.
 */
public interface RetrievalPath {

  RoutingDecision route();

  /**
   * Retrieves results for the question.
   *
   * @param question user question
   * @return results in rank order; empty when nothing matched
   */
  List<RetrievalResult> retrieve(String question);

  /** Fixed answer used when {@link #retrieve} finds nothing. */
  String noResultsAnswer();

  /**
   * Asks the generator to answer from the results.
   *
   * @throws com.flamingo.ai.hybridrag.exception.LlmServiceException if generation fails
   */
  String generate(TextGenerator textGenerator, String question, List<RetrievalResult> results);

  /** Deterministic answer used when the generator is unavailable or fails. Never blank. */
  String fallbackAnswer(List<RetrievalResult> results);

  Evidence evidence(List<RetrievalResult> results);
}
