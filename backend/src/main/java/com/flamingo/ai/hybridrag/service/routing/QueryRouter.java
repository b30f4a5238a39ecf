package com.flamingo.ai.hybridrag.service.routing;

import com.flamingo.ai.hybridrag.domain.model.RoutingDecision;

/** Decides which retrieval path answers a question. Never throws. */
public interface QueryRouter {

  RoutingDecision route(String question);

  boolean supports(RoutingStrategy strategy);
}
