package com.flamingo.ai.hybridrag.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Outcome of one ingestion run.
 *
 * @param chunksProcessed chunks written to the semantic index
 * @param triplesExtracted triples mined from those chunks
 * @param status overall outcome
 * @param message human-readable summary or failure reason
 */
public record IngestionReport(
    int chunksProcessed, int triplesExtracted, OperationStatus status, String message) {

  public static IngestionReport success(int chunksProcessed, int triplesExtracted) {
    return new IngestionReport(
        chunksProcessed,
        triplesExtracted,
        OperationStatus.SUCCESS,
        String.format(
            "Successfully ingested %d chunks and extracted %d triples",
            chunksProcessed, triplesExtracted));
  }

  public static IngestionReport error(int chunksProcessed, int triplesExtracted, String reason) {
    return new IngestionReport(
        chunksProcessed,
        triplesExtracted,
        OperationStatus.ERROR,
        "Failed to ingest data: " + reason);
  }

  @JsonIgnore
  public boolean isSuccess() {
    return status == OperationStatus.SUCCESS;
  }
}
