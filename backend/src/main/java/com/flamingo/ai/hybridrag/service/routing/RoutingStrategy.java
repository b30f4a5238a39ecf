package com.flamingo.ai.hybridrag.service.routing;

/** Available query routing policies. */
public enum RoutingStrategy {
  /** Keyword indicators, relational checked first. */
  HEURISTIC,
  /** Ask the text generator to pick between the two paths. */
  GENERATIVE
}
