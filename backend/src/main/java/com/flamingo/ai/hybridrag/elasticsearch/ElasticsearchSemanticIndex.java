package com.flamingo.ai.hybridrag.elasticsearch;

import com.flamingo.ai.hybridrag.domain.model.ChunkMetadata;
import com.flamingo.ai.hybridrag.exception.SearchException;
import com.flamingo.ai.hybridrag.service.embedding.EmbeddingService;
import com.flamingo.ai.hybridrag.store.SemanticHit;
import com.flamingo.ai.hybridrag.store.SemanticIndex;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Semantic index backed by an Elasticsearch dense-vector index. */
@Component
@ConditionalOnProperty(name = "rag.store.semantic", havingValue = "elasticsearch")
@RequiredArgsConstructor
@Slf4j
public class ElasticsearchSemanticIndex implements SemanticIndex {

  private final ChunkIndexService chunkIndexService;
  private final EmbeddingService embeddingService;

  @Override
  public void add(String id, String text, Map<String, Object> metadata) {
    List<Float> vector = embeddingService.embedPassage(text);
    if (vector.isEmpty()) {
      throw new SearchException("Embedding unavailable for chunk " + id);
    }
    Object sequenceIndex = metadata.get(ChunkMetadata.SEQUENCE_INDEX);
    ChunkDocument document =
        ChunkDocument.builder()
            .id(id)
            .source(String.valueOf(metadata.get(ChunkMetadata.SOURCE)))
            .sequenceIndex(sequenceIndex instanceof Number n ? n.intValue() : -1)
            .content(text)
            .embedding(vector)
            .build();
    chunkIndexService.indexDocuments(List.of(document));
  }

  @Override
  public List<SemanticHit> query(String text, int k) {
    List<Float> vector = embeddingService.embedQuery(text);
    if (vector.isEmpty()) {
      log.warn("Query embedding unavailable, returning no semantic hits");
      return List.of();
    }
    return chunkIndexService.vectorSearch(vector, k).stream().map(this::toHit).toList();
  }

  @Override
  public long size() {
    return chunkIndexService.count();
  }

  @Override
  public void refresh() {
    chunkIndexService.refresh();
  }

  @Override
  public String backend() {
    return "elasticsearch";
  }

  private SemanticHit toHit(ChunkDocument document) {
    return new SemanticHit(
        document.getId(),
        document.getContent(),
        Map.of(
            ChunkMetadata.SOURCE,
            Objects.requireNonNullElse(document.getSource(), ""),
            ChunkMetadata.SEQUENCE_INDEX,
            document.getSequenceIndex()),
        Objects.requireNonNullElse(document.getRelevanceScore(), 0.0));
  }
}
