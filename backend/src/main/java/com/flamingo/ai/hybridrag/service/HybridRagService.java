package com.flamingo.ai.hybridrag.service;

import com.flamingo.ai.hybridrag.domain.model.IngestionReport;
import com.flamingo.ai.hybridrag.domain.model.QueryResponse;
import java.util.Map;

/** Entry point for ingestion, question answering and component health. */
public interface HybridRagService {

  /**
   * Ingests a document into both indexes.
   *
   * @param documentRef file path or resource URL; {@code null} for the default document
   * @return ingestion report
   */
  IngestionReport ingest(String documentRef);

  /**
   * Routes and answers a question. Failures are reported inside the envelope, never thrown.
   *
   * @param question user question
   * @return query envelope
   */
  QueryResponse query(String question);

  /** Status of the semantic index, the relationship index and the text generator. */
  Map<String, Object> health();
}
