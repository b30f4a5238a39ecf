package com.flamingo.ai.hybridrag.service.answer;

import com.flamingo.ai.hybridrag.config.RagConfig;
import com.flamingo.ai.hybridrag.domain.model.Evidence;
import com.flamingo.ai.hybridrag.domain.model.RetrievalResult;
import com.flamingo.ai.hybridrag.domain.model.RoutingDecision;
import com.flamingo.ai.hybridrag.domain.model.Triple;
import com.flamingo.ai.hybridrag.service.llm.TextGenerator;
import com.flamingo.ai.hybridrag.store.EntityKeywords;
import com.flamingo.ai.hybridrag.store.RelationshipIndex;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Answers from relationship facts whose entities share a word with the question. All matches are
 * counted as evidence, but only the first {@code maxFacts} are shown to the generator.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RelationalRetrievalPath implements RetrievalPath {

  static final String NO_RESULTS = "No relevant relationships found";

  private final RelationshipIndex relationshipIndex;
  private final RagConfig ragConfig;

  @Override
  public RoutingDecision route() {
    return RoutingDecision.RELATIONAL;
  }

  @Override
  public List<RetrievalResult> retrieve(String question) {
    Set<String> keywords = EntityKeywords.tokenize(question);
    List<Triple> matches = relationshipIndex.match(keywords);
    log.debug("Relational retrieval matched {} facts for keywords {}", matches.size(), keywords);

    List<RetrievalResult> results = new ArrayList<>(matches.size());
    for (Triple triple : matches) {
      results.add(
          new RetrievalResult(
              triple.asFact(), Evidence.RELATIONSHIP_INDEX, results.size() + 1, null));
    }
    return results;
  }

  @Override
  public String noResultsAnswer() {
    return NO_RESULTS;
  }

  @Override
  public String generate(
      TextGenerator textGenerator, String question, List<RetrievalResult> results) {
    return textGenerator.answerFromFacts(facts(results), question);
  }

  @Override
  public String fallbackAnswer(List<RetrievalResult> results) {
    return "Based on the relationships:\n" + facts(results);
  }

  @Override
  public Evidence evidence(List<RetrievalResult> results) {
    return new Evidence(Evidence.RELATIONSHIP_INDEX, List.of(), results.size());
  }

  private String facts(List<RetrievalResult> results) {
    return results.stream()
        .limit(ragConfig.getRetrieval().getMaxFacts())
        .map(RetrievalResult::content)
        .collect(Collectors.joining("\n"));
  }
}
