package com.flamingo.ai.hybridrag.service.answer;

import com.flamingo.ai.hybridrag.config.RagConfig;
import com.flamingo.ai.hybridrag.domain.model.Evidence;
import com.flamingo.ai.hybridrag.domain.model.RetrievalResult;
import com.flamingo.ai.hybridrag.domain.model.RoutingDecision;
import com.flamingo.ai.hybridrag.service.llm.TextGenerator;
import com.flamingo.ai.hybridrag.store.EntityKeywords;
import com.flamingo.ai.hybridrag.store.SemanticHit;
import com.flamingo.ai.hybridrag.store.SemanticIndex;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Answers from the passages nearest to the question in the semantic index. */
@Component
@RequiredArgsConstructor
@Slf4j
public class SemanticRetrievalPath implements RetrievalPath {

  static final String NO_RESULTS = "No relevant information found";
  private static final String PASSAGE_SEPARATOR = "\n\n";

  private final SemanticIndex semanticIndex;
  private final RagConfig ragConfig;

  @Override
  public RoutingDecision route() {
    return RoutingDecision.SEMANTIC;
  }

  @Override
  public List<RetrievalResult> retrieve(String question) {
    RagConfig.Retrieval config = ragConfig.getRetrieval();
    List<SemanticHit> hits = semanticIndex.query(question, config.getTopK());
    Set<String> questionTerms = EntityKeywords.contentTokens(question);

    List<RetrievalResult> results = new ArrayList<>();
    for (SemanticHit hit : hits) {
      if (hit.score() < config.getMinScore()) {
        log.debug(
            "Dropping hit {} below min score ({} < {})",
            hit.id(),
            hit.score(),
            config.getMinScore());
        continue;
      }
      if (config.isRequireTermOverlap() && !EntityKeywords.sharesToken(hit.text(), questionTerms)) {
        log.debug("Dropping hit {} sharing no content word with the question", hit.id());
        continue;
      }
      results.add(
          new RetrievalResult(hit.text(), Evidence.SEMANTIC_INDEX, results.size() + 1, hit.id()));
    }
    log.debug("Semantic retrieval returned {} of {} hits", results.size(), hits.size());
    return results;
  }

  @Override
  public String noResultsAnswer() {
    return NO_RESULTS;
  }

  @Override
  public String generate(
      TextGenerator textGenerator, String question, List<RetrievalResult> results) {
    return textGenerator.answerFromPassages(context(results), question);
  }

  @Override
  public String fallbackAnswer(List<RetrievalResult> results) {
    String context = context(results);
    int previewChars = ragConfig.getRetrieval().getFallbackPreviewChars();
    String preview = context.length() > previewChars ? context.substring(0, previewChars) : context;
    return "Based on the available information: " + preview + "...";
  }

  @Override
  public Evidence evidence(List<RetrievalResult> results) {
    List<String> ids = results.stream().map(RetrievalResult::itemId).toList();
    return new Evidence(Evidence.SEMANTIC_INDEX, ids, results.size());
  }

  private String context(List<RetrievalResult> results) {
    return results.stream()
        .map(RetrievalResult::content)
        .collect(Collectors.joining(PASSAGE_SEPARATOR));
  }
}
