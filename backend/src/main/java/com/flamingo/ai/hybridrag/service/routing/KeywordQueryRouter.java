package com.flamingo.ai.hybridrag.service.routing;

import com.flamingo.ai.hybridrag.config.RagConfig;
import com.flamingo.ai.hybridrag.domain.model.RoutingDecision;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Deterministic router. A question containing any relational indicator goes to the relationship
 * index, even when it also contains a semantic indicator; everything else goes to the semantic
 * index.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class KeywordQueryRouter implements QueryRouter {

  private final RagConfig ragConfig;

  @Override
  public RoutingDecision route(String question) {
    String normalized = question == null ? "" : question.toLowerCase(Locale.ROOT);
    RagConfig.Routing config = ragConfig.getRouting();

    String relational = firstContained(normalized, config.getRelationalIndicators());
    if (relational != null) {
      log.debug("Relational indicator '{}' found", relational);
      return RoutingDecision.RELATIONAL;
    }
    String semantic = firstContained(normalized, config.getSemanticIndicators());
    if (semantic != null) {
      log.debug("Semantic indicator '{}' found", semantic);
    }
    return RoutingDecision.SEMANTIC;
  }

  @Override
  public boolean supports(RoutingStrategy strategy) {
    return strategy == RoutingStrategy.HEURISTIC;
  }

  private String firstContained(String question, List<String> indicators) {
    for (String indicator : indicators) {
      if (!indicator.isBlank() && question.contains(indicator.toLowerCase(Locale.ROOT))) {
        return indicator;
      }
    }
    return null;
  }
}
