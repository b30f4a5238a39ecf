package com.flamingo.ai.hybridrag.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Which retrieval path answers a question. */
public enum RoutingDecision {
  SEMANTIC("semantic"),
  RELATIONAL("relational");

  private final String label;

  RoutingDecision(String label) {
    this.label = label;
  }

  @JsonValue
  public String getLabel() {
    return label;
  }
}
