package com.flamingo.ai.hybridrag.service;

import com.flamingo.ai.hybridrag.domain.model.ComposedAnswer;
import com.flamingo.ai.hybridrag.domain.model.IngestionReport;
import com.flamingo.ai.hybridrag.domain.model.QueryResponse;
import com.flamingo.ai.hybridrag.domain.model.RoutingDecision;
import com.flamingo.ai.hybridrag.service.answer.AnswerComposer;
import com.flamingo.ai.hybridrag.service.ingestion.IngestionService;
import com.flamingo.ai.hybridrag.service.llm.TextGenerator;
import com.flamingo.ai.hybridrag.service.routing.QueryRoutingService;
import com.flamingo.ai.hybridrag.store.RelationshipIndex;
import com.flamingo.ai.hybridrag.store.SemanticIndex;
import io.micrometer.core.annotation.Timed;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Implementation of {@link HybridRagService}. */
@Service
@RequiredArgsConstructor
@Slf4j
public class HybridRagServiceImpl implements HybridRagService {

  private final IngestionService ingestionService;
  private final QueryRoutingService queryRoutingService;
  private final AnswerComposer answerComposer;
  private final SemanticIndex semanticIndex;
  private final RelationshipIndex relationshipIndex;
  private final TextGenerator textGenerator;

  @Override
  public IngestionReport ingest(String documentRef) {
    return ingestionService.ingest(documentRef);
  }

  @Override
  @Timed(value = "rag.query", description = "Time to answer a question")
  public QueryResponse query(String question) {
    try {
      RoutingDecision route = queryRoutingService.route(question);
      ComposedAnswer answer = answerComposer.answer(question, route);
      return QueryResponse.success(route, answer);
    } catch (RuntimeException e) {
      log.error("Query failed: {}", e.getMessage(), e);
      return QueryResponse.error(e.getMessage());
    }
  }

  @Override
  public Map<String, Object> health() {
    Map<String, Object> components = new LinkedHashMap<>();
    boolean healthy = true;

    Map<String, Object> semantic = new LinkedHashMap<>();
    semantic.put("backend", semanticIndex.backend());
    try {
      semantic.put("status", "connected");
      semantic.put("size", semanticIndex.size());
    } catch (RuntimeException e) {
      log.warn("Semantic index health check failed: {}", e.getMessage());
      semantic.put("status", "disconnected");
      healthy = false;
    }
    components.put("semantic_index", semantic);

    Map<String, Object> relationship = new LinkedHashMap<>();
    relationship.put("backend", relationshipIndex.backend());
    try {
      relationship.put("status", "connected");
      relationship.put("nodes", relationshipIndex.nodeCount());
      relationship.put("edges", relationshipIndex.edgeCount());
    } catch (RuntimeException e) {
      log.warn("Relationship index health check failed: {}", e.getMessage());
      relationship.put("status", "disconnected");
      healthy = false;
    }
    components.put("relationship_index", relationship);

    components.put("generator", textGenerator.isAvailable() ? "loaded" : "not_loaded");

    Map<String, Object> health = new LinkedHashMap<>();
    health.put("status", healthy ? "healthy" : "degraded");
    health.put("components", components);
    health.put("timestamp", LocalDateTime.now());
    return health;
  }
}
