package com.flamingo.ai.hybridrag.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum OperationStatus {
  SUCCESS("success"),
  ERROR("error");

  private final String label;

  OperationStatus(String label) {
    this.label = label;
  }

  @JsonValue
  public String getLabel() {
    return label;
  }
}
