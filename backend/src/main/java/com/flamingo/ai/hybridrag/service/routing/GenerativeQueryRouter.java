package com.flamingo.ai.hybridrag.service.routing;

import com.flamingo.ai.hybridrag.agent.QueryRoutingAgent;
import com.flamingo.ai.hybridrag.domain.model.RoutingDecision;
import com.flamingo.ai.hybridrag.service.llm.TextGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Router that lets the text generator choose. Option (A) is checked before (B); an unclear reply,
 * a missing generator or a failed call all fall back to semantic search.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GenerativeQueryRouter implements QueryRouter {

  private final TextGenerator textGenerator;

  @Override
  public RoutingDecision route(String question) {
    if (!textGenerator.isAvailable()) {
      log.debug("Text generator not configured, routing to semantic search");
      return RoutingDecision.SEMANTIC;
    }
    String reply;
    try {
      reply = textGenerator.chooseRoute(question);
    } catch (RuntimeException e) {
      log.warn("Generative routing failed, routing to semantic search: {}", e.getMessage());
      return RoutingDecision.SEMANTIC;
    }
    return parse(reply);
  }

  @Override
  public boolean supports(RoutingStrategy strategy) {
    return strategy == RoutingStrategy.GENERATIVE;
  }

  RoutingDecision parse(String reply) {
    String trimmed = reply == null ? "" : reply.strip();
    if (trimmed.contains("(A)")
        || trimmed.contains(QueryRoutingAgent.SEMANTIC_OPTION)
        || trimmed.equalsIgnoreCase("A")) {
      return RoutingDecision.SEMANTIC;
    }
    if (trimmed.contains("(B)")
        || trimmed.contains(QueryRoutingAgent.RELATIONAL_OPTION)
        || trimmed.equalsIgnoreCase("B")) {
      return RoutingDecision.RELATIONAL;
    }
    log.debug("Unclear routing reply '{}', routing to semantic search", trimmed);
    return RoutingDecision.SEMANTIC;
  }
}
