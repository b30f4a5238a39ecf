package com.flamingo.ai.hybridrag.store.memory;

import com.flamingo.ai.hybridrag.exception.SearchException;
import com.flamingo.ai.hybridrag.service.embedding.EmbeddingService;
import com.flamingo.ai.hybridrag.store.SemanticHit;
import com.flamingo.ai.hybridrag.store.SemanticIndex;
import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Semantic index backed by LangChain4j's {@link InMemoryEmbeddingStore}. */
@Component
@ConditionalOnProperty(
    name = "rag.store.semantic",
    havingValue = "in-memory",
    matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class InMemorySemanticIndex implements SemanticIndex {

  private final EmbeddingService embeddingService;
  private final InMemoryEmbeddingStore<TextSegment> store = new InMemoryEmbeddingStore<>();
  private final Set<String> ids = ConcurrentHashMap.newKeySet();

  @Override
  public void add(String id, String text, Map<String, Object> metadata) {
    List<Float> vector = embeddingService.embedPassage(text);
    if (vector.isEmpty()) {
      throw new SearchException("Embedding unavailable for chunk " + id);
    }
    if (!ids.add(id)) {
      store.remove(id);
    }
    store.add(id, Embedding.from(vector), TextSegment.from(text, Metadata.from(metadata)));
  }

  @Override
  public List<SemanticHit> query(String text, int k) {
    if (ids.isEmpty()) {
      return List.of();
    }
    List<Float> vector = embeddingService.embedQuery(text);
    if (vector.isEmpty()) {
      log.warn("Query embedding unavailable, returning no semantic hits");
      return List.of();
    }

    EmbeddingSearchRequest request =
        EmbeddingSearchRequest.builder()
            .queryEmbedding(Embedding.from(vector))
            .maxResults(k)
            .minScore(0.0)
            .build();
    return store.search(request).matches().stream().map(this::toHit).toList();
  }

  @Override
  public long size() {
    return ids.size();
  }

  @Override
  public String backend() {
    return "in-memory";
  }

  private SemanticHit toHit(EmbeddingMatch<TextSegment> match) {
    TextSegment segment = match.embedded();
    return new SemanticHit(
        match.embeddingId(), segment.text(), segment.metadata().toMap(), match.score());
  }
}
