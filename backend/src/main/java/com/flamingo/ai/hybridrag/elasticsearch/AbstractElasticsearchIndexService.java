package com.flamingo.ai.hybridrag.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.mapping.DynamicMapping;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import com.flamingo.ai.hybridrag.exception.SearchException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Base class for Elasticsearch index services storing documents with a dense vector.
 *
 * <p>Subclasses define the schema, the document conversion and the kNN request. Index writes
 * propagate failures as {@link SearchException}; searches degrade to an empty result when the
 * circuit breaker opens.
 *
 * @param <T> the document type stored in the index
 */
@Slf4j
public abstract class AbstractElasticsearchIndexService<T> {

  protected final ElasticsearchClient elasticsearchClient;
  protected final MeterRegistry meterRegistry;

  protected AbstractElasticsearchIndexService(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry) {
    this.elasticsearchClient = elasticsearchClient;
    this.meterRegistry = meterRegistry;
  }

  public abstract String getIndexName();

  /** Defines the index properties (schema) for this document type. */
  protected abstract Map<String, Property> defineIndexProperties();

  protected abstract Map<String, Object> convertToDocument(T entity);

  /**
   * Converts a search hit's source back to a document.
   *
   * @param source the {@code _source} map with the hit's {@code _id} injected as {@code id}
   * @param score the hit's relevance score, may be {@code null}
   * @return the document
   */
  protected abstract T convertFromDocument(Map<String, Object> source, Double score);

  protected abstract String getDocumentId(T entity);

  protected abstract SearchRequest buildVectorSearchRequest(List<Float> queryEmbedding, int topK);

  /** Metric prefix for this index, e.g. {@code chunk}. */
  protected abstract String getMetricPrefix();

  @PostConstruct
  public void initIndex() {
    try {
      boolean exists = elasticsearchClient.indices().exists(e -> e.index(getIndexName())).value();
      if (!exists) {
        createIndex();
        log.info("Created Elasticsearch index: {}", getIndexName());
      } else {
        validateMappings();
      }
    } catch (IOException e) {
      log.error(
          "Failed to initialize Elasticsearch index '{}': {}", getIndexName(), e.getMessage(), e);
      throw new IllegalStateException(
          "Failed to initialize Elasticsearch index '" + getIndexName() + "'", e);
    }
  }

  private void createIndex() throws IOException {
    Map<String, Property> properties = defineIndexProperties();
    // dynamic=false keeps undeclared fields out of the mapping.
    CreateIndexRequest request =
        CreateIndexRequest.of(
            c ->
                c.index(getIndexName())
                    .mappings(m -> m.dynamic(DynamicMapping.False).properties(properties)));
    elasticsearchClient.indices().create(request);
  }

  /** Fails fast on field type mismatches; those require the index to be recreated. */
  private void validateMappings() throws IOException {
    var response = elasticsearchClient.indices().getMapping(g -> g.index(getIndexName()));
    var indexMapping = response.get(getIndexName());
    if (indexMapping == null) {
      return;
    }
    Map<String, Property> actualProperties = indexMapping.mappings().properties();

    List<String> mismatches = new ArrayList<>();
    for (Map.Entry<String, Property> entry : defineIndexProperties().entrySet()) {
      Property actual = actualProperties.get(entry.getKey());
      if (actual != null && entry.getValue()._kind() != actual._kind()) {
        mismatches.add(
            String.format(
                "field '%s' expected type '%s' but found '%s'",
                entry.getKey(), entry.getValue()._kind(), actual._kind()));
      }
    }
    if (!mismatches.isEmpty()) {
      throw new IllegalStateException(
          "Index '"
              + getIndexName()
              + "' has incompatible field type(s): "
              + String.join("; ", mismatches)
              + ". Delete the index and restart the application.");
    }
    log.debug("Index '{}' mapping verified.", getIndexName());
  }

  @Timed(value = "elasticsearch.index", description = "Time to index documents")
  public void indexDocuments(List<T> documents) {
    if (documents.isEmpty()) {
      return;
    }

    BulkResponse response;
    try {
      BulkRequest.Builder bulkBuilder = new BulkRequest.Builder();
      for (T document : documents) {
        String id = getDocumentId(document);
        Map<String, Object> docMap = convertToDocument(document);
        bulkBuilder.operations(
            op -> op.index(idx -> idx.index(getIndexName()).id(id).document(docMap)));
      }
      response = elasticsearchClient.bulk(bulkBuilder.build());
    } catch (IOException e) {
      log.error("Failed to index documents to {}: {}", getIndexName(), e.getMessage(), e);
      meterRegistry.counter(getMetricPrefix() + ".index.errors").increment();
      throw new SearchException("Failed to index documents to " + getIndexName(), e);
    }

    if (response.errors()) {
      List<String> reasons =
          response.items().stream()
              .map(item -> item.error())
              .filter(Objects::nonNull)
              .map(error -> error.reason())
              .distinct()
              .limit(3)
              .toList();
      log.error("Some documents failed to index in {}: {}", getIndexName(), reasons);
      meterRegistry.counter(getMetricPrefix() + ".index.errors").increment();
      throw new SearchException("Bulk indexing to " + getIndexName() + " failed: " + reasons);
    }
    log.debug("Indexed {} documents to {}", documents.size(), getIndexName());
    meterRegistry.counter(getMetricPrefix() + ".indexed").increment(documents.size());
  }

  @Timed(value = "elasticsearch.vector_search", description = "Time for vector search")
  @CircuitBreaker(name = "elasticsearch", fallbackMethod = "vectorSearchFallback")
  @SuppressWarnings({"unchecked", "rawtypes"})
  public List<T> vectorSearch(List<Float> queryEmbedding, int topK) {
    try {
      SearchRequest request = buildVectorSearchRequest(queryEmbedding, topK);
      SearchResponse<Map> response = elasticsearchClient.search(request, Map.class);
      List<T> results = new ArrayList<>();
      for (Hit<Map> hit : response.hits().hits()) {
        Map<String, Object> source = hit.source();
        if (source != null) {
          // _id is metadata and not part of _source.
          source.put("id", hit.id());
          results.add(convertFromDocument(source, hit.score()));
        }
      }
      log.debug("Vector search on {} returned {} hits", getIndexName(), results.size());
      meterRegistry.counter(getMetricPrefix() + ".vector_search").increment();
      return results;
    } catch (IOException e) {
      log.error("Vector search failed for {}: {}", getIndexName(), e.getMessage(), e);
      throw new SearchException("Vector search failed on " + getIndexName(), e);
    }
  }

  @SuppressWarnings("unused")
  private List<T> vectorSearchFallback(List<Float> queryEmbedding, int topK, Throwable t) {
    log.warn("{} vector search fallback triggered: {}", getIndexName(), t.getMessage());
    meterRegistry.counter(getMetricPrefix() + ".vector_search.fallback").increment();
    return List.of();
  }

  public long count() {
    try {
      return elasticsearchClient.count(c -> c.index(getIndexName())).count();
    } catch (IOException e) {
      throw new SearchException("Count failed on " + getIndexName(), e);
    }
  }

  public void refresh() {
    try {
      elasticsearchClient.indices().refresh(r -> r.index(getIndexName()));
      log.debug("Refreshed index: {}", getIndexName());
    } catch (IOException e) {
      log.warn("Failed to refresh index {}: {}", getIndexName(), e.getMessage());
    }
  }
}
