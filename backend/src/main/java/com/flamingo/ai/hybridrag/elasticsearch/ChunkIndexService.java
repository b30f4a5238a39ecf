package com.flamingo.ai.hybridrag.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorProperty;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorSimilarity;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.mapping.TextProperty;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/** Elasticsearch index of {@link ChunkDocument}s searched by cosine kNN. */
@Service
@ConditionalOnProperty(name = "rag.store.semantic", havingValue = "elasticsearch")
@Slf4j
public class ChunkIndexService extends AbstractElasticsearchIndexService<ChunkDocument> {

  @Value("${elasticsearch.index-name:hybrid-rag-chunks}")
  private String indexName;

  @Value("${elasticsearch.vector-dimensions:384}")
  private int vectorDimensions;

  @Autowired
  public ChunkIndexService(ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry) {
    super(elasticsearchClient, meterRegistry);
  }

  /** Constructor for testing - allows setting index name and vector dimensions. */
  @VisibleForTesting
  public ChunkIndexService(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      String indexName,
      int vectorDimensions) {
    super(elasticsearchClient, meterRegistry);
    this.indexName = indexName;
    this.vectorDimensions = vectorDimensions;
  }

  @Override
  public String getIndexName() {
    return indexName;
  }

  @Override
  protected Map<String, Property> defineIndexProperties() {
    Map<String, Property> properties = new HashMap<>();
    properties.put("source", Property.of(p -> p.keyword(k -> k)));
    properties.put("sequenceIndex", Property.of(p -> p.integer(i -> i)));
    properties.put("content", Property.of(p -> p.text(TextProperty.of(t -> t))));
    properties.put(
        "embedding",
        Property.of(
            p ->
                p.denseVector(
                    DenseVectorProperty.of(
                        d ->
                            d.dims(vectorDimensions)
                                .index(true)
                                .similarity(DenseVectorSimilarity.Cosine)))));
    return properties;
  }

  @Override
  protected Map<String, Object> convertToDocument(ChunkDocument chunk) {
    Map<String, Object> document = new HashMap<>();
    document.put("source", chunk.getSource());
    document.put("sequenceIndex", chunk.getSequenceIndex());
    document.put("content", chunk.getContent());
    document.put("embedding", chunk.getEmbedding());
    return document;
  }

  @Override
  protected ChunkDocument convertFromDocument(Map<String, Object> source, Double score) {
    Object sequenceIndex = source.get("sequenceIndex");
    return ChunkDocument.builder()
        .id((String) source.get("id"))
        .source((String) source.get("source"))
        .sequenceIndex(sequenceIndex instanceof Number n ? n.intValue() : -1)
        .content((String) source.get("content"))
        .relevanceScore(score != null ? score : 0.0)
        .build();
  }

  @Override
  protected String getDocumentId(ChunkDocument entity) {
    return entity.getId();
  }

  @Override
  protected SearchRequest buildVectorSearchRequest(List<Float> queryEmbedding, int topK) {
    log.debug("kNN search on {} with topK={}", indexName, topK);
    return SearchRequest.of(
        s ->
            s.index(indexName)
                .knn(
                    k ->
                        k.field("embedding")
                            .queryVector(queryEmbedding)
                            .k(topK)
                            .numCandidates(Math.max(topK * 10, 50)))
                .source(src -> src.filter(f -> f.excludes("embedding")))
                .size(topK));
  }

  @Override
  protected String getMetricPrefix() {
    return "chunk";
  }
}
