package com.flamingo.ai.hybridrag.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * Envelope returned for every question. Success carries answer, route and sources; failure
 * carries only the message.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QueryResponse(
    OperationStatus status,
    String answer,
    RoutingDecision searchMethod,
    List<Evidence> sources,
    String message) {

  public static QueryResponse success(RoutingDecision route, ComposedAnswer answer) {
    return new QueryResponse(
        OperationStatus.SUCCESS, answer.text(), route, answer.evidence(), null);
  }

  public static QueryResponse error(String reason) {
    return new QueryResponse(
        OperationStatus.ERROR, null, null, null, "Failed to process query: " + reason);
  }
}
