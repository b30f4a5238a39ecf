package com.flamingo.ai.hybridrag.api.rest;

import com.flamingo.ai.hybridrag.api.dto.request.IngestRequest;
import com.flamingo.ai.hybridrag.api.dto.request.QueryRequest;
import com.flamingo.ai.hybridrag.domain.model.IngestionReport;
import com.flamingo.ai.hybridrag.domain.model.QueryResponse;
import com.flamingo.ai.hybridrag.service.HybridRagService;
import jakarta.validation.Valid;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for hybrid RAG ingestion and question answering. */
@RestController
@RequestMapping("/hybrid-rag")
@RequiredArgsConstructor
public class HybridRagController {

  private final HybridRagService hybridRagService;

  /** Ingests a document into the semantic and relationship indexes. */
  @PostMapping("/ingest")
  public ResponseEntity<IngestionReport> ingest(
      @RequestBody(required = false) IngestRequest request) {
    IngestionReport report = hybridRagService.ingest(request == null ? null : request.getPath());
    HttpStatus status = report.isSuccess() ? HttpStatus.OK : HttpStatus.UNPROCESSABLE_ENTITY;
    return ResponseEntity.status(status).body(report);
  }

  /** Answers a question from whichever index the router picks. */
  @PostMapping("/query")
  public ResponseEntity<QueryResponse> query(@Valid @RequestBody QueryRequest request) {
    return ResponseEntity.ok(hybridRagService.query(request.getQuestion()));
  }

  /** Reports the status of the indexes and the text generator. */
  @GetMapping("/health")
  public ResponseEntity<Map<String, Object>> health() {
    return ResponseEntity.ok(hybridRagService.health());
  }
}
