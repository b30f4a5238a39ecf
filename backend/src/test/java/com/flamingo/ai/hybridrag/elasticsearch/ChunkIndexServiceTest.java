package com.flamingo.ai.hybridrag.elasticsearch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.KnnSearch;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import com.flamingo.ai.hybridrag.exception.SearchException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("ChunkIndexService Tests")
class ChunkIndexServiceTest {

  @Mock private ElasticsearchClient elasticsearchClient;

  private SimpleMeterRegistry meterRegistry;
  private ChunkIndexService service;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    service = new ChunkIndexService(elasticsearchClient, meterRegistry, "test-chunks", 8);
  }

  private ChunkDocument document(String id) {
    return ChunkDocument.builder()
        .id(id)
        .source("doc.txt")
        .sequenceIndex(0)
        .content("FastAPI has routers.")
        .embedding(List.of(0.1f, 0.2f))
        .build();
  }

  @Nested
  @DisplayName("Schema and conversion")
  class SchemaAndConversion {

    @Test
    @DisplayName("should map the embedding as a dense vector with the configured dimensions")
    void shouldMapEmbeddingAsDenseVector() {
      Map<String, Property> properties = service.defineIndexProperties();

      assertThat(properties).containsKeys("source", "sequenceIndex", "content", "embedding");
      assertThat(properties.get("embedding").isDenseVector()).isTrue();
      assertThat(properties.get("embedding").denseVector().dims()).isEqualTo(8);
      assertThat(properties.get("source").isKeyword()).isTrue();
    }

    @Test
    @DisplayName("should write every field except the id into the document body")
    void shouldConvertToDocument() {
      Map<String, Object> body = service.convertToDocument(document("c1"));

      assertThat(body)
          .containsEntry("source", "doc.txt")
          .containsEntry("sequenceIndex", 0)
          .containsEntry("content", "FastAPI has routers.")
          .doesNotContainKey("id");
    }

    @Test
    @DisplayName("should restore a hit with its id and score")
    void shouldConvertFromDocument() {
      Map<String, Object> source = new HashMap<>();
      source.put("id", "c1");
      source.put("source", "doc.txt");
      source.put("sequenceIndex", 3);
      source.put("content", "FastAPI has routers.");

      ChunkDocument restored = service.convertFromDocument(source, 0.87);

      assertThat(restored.getId()).isEqualTo("c1");
      assertThat(restored.getSequenceIndex()).isEqualTo(3);
      assertThat(restored.getRelevanceScore()).isEqualTo(0.87);
      assertThat(service.convertFromDocument(source, null).getRelevanceScore()).isZero();
    }

    @Test
    @DisplayName("should build a kNN request that leaves the vector out of the hits")
    void shouldBuildKnnRequest() {
      SearchRequest request = service.buildVectorSearchRequest(List.of(0.1f, 0.2f), 3);

      assertThat(request.index()).containsExactly("test-chunks");
      assertThat(request.size()).isEqualTo(3);
      KnnSearch knn = request.knn().get(0);
      assertThat(knn.field()).isEqualTo("embedding");
      assertThat(knn.k()).isEqualTo(3);
      assertThat(knn.numCandidates()).isEqualTo(50);
    }
  }

  @Nested
  @DisplayName("Bulk indexing")
  class BulkIndexing {

    @Test
    @DisplayName("should send one bulk request and count indexed documents")
    void shouldIndexDocuments() throws IOException {
      when(elasticsearchClient.bulk(any(BulkRequest.class)))
          .thenReturn(BulkResponse.of(b -> b.errors(false).items(List.of()).took(1)));

      service.indexDocuments(List.of(document("c1"), document("c2")));

      assertThat(meterRegistry.counter("chunk.indexed").count()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("should skip the request for an empty batch")
    void shouldSkipEmptyBatch() throws IOException {
      service.indexDocuments(List.of());

      verify(elasticsearchClient, never()).bulk(any(BulkRequest.class));
    }

    @Test
    @DisplayName("should raise SearchException when the cluster is unreachable")
    void shouldRaiseSearchException_whenUnreachable() throws IOException {
      when(elasticsearchClient.bulk(any(BulkRequest.class)))
          .thenThrow(new IOException("Connection refused"));

      assertThatThrownBy(() -> service.indexDocuments(List.of(document("c1"))))
          .isInstanceOf(SearchException.class)
          .hasMessageContaining("test-chunks");
      assertThat(meterRegistry.counter("chunk.index.errors").count()).isEqualTo(1.0);
    }
  }
}
