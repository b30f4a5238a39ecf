package com.flamingo.ai.hybridrag.service.answer;

import com.flamingo.ai.hybridrag.domain.model.ComposedAnswer;
import com.flamingo.ai.hybridrag.domain.model.Evidence;
import com.flamingo.ai.hybridrag.domain.model.RetrievalResult;
import com.flamingo.ai.hybridrag.domain.model.RoutingDecision;
import com.flamingo.ai.hybridrag.service.llm.TextGenerator;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Turns a routed question into an answer with provenance.
 *
 * <p>Nothing retrieved means a fixed "no relevant ..." answer and no generator call. Otherwise the
 * generator answers from the results; when it is not configured or fails, the path's template
 * answer is used instead.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AnswerComposer {

  private final List<RetrievalPath> retrievalPaths;
  private final TextGenerator textGenerator;
  private final MeterRegistry meterRegistry;

  @Timed(value = "rag.answer", description = "Time to retrieve and compose an answer")
  public ComposedAnswer answer(String question, RoutingDecision route) {
    RetrievalPath path = pathFor(route);
    List<RetrievalResult> results = path.retrieve(question);
    if (results.isEmpty()) {
      log.info("No {} results for question", route.getLabel());
      return ComposedAnswer.withoutEvidence(path.noResultsAnswer());
    }

    Evidence evidence = path.evidence(results);
    if (textGenerator.isAvailable()) {
      try {
        String text = path.generate(textGenerator, question, results);
        return new ComposedAnswer(text, List.of(evidence), true);
      } catch (RuntimeException e) {
        log.warn("Answer generation failed, using template answer: {}", e.getMessage());
      }
    }
    meterRegistry.counter("answer.fallback", "route", route.getLabel()).increment();
    return new ComposedAnswer(path.fallbackAnswer(results), List.of(evidence), false);
  }

  private RetrievalPath pathFor(RoutingDecision route) {
    return retrievalPaths.stream()
        .filter(p -> p.route() == route)
        .findFirst()
        .orElseThrow(() -> new IllegalStateException("No RetrievalPath for route: " + route));
  }
}
