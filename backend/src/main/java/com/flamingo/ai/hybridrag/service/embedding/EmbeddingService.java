package com.flamingo.ai.hybridrag.service.embedding;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Embeds questions and chunk passages with the configured {@link EmbeddingModel}. Failures return
 * an empty vector; callers decide whether that is fatal.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingService {

  // OpenAI text-embedding-3-small has an 8192 token limit; stay well below it.
  private static final int MAX_CHARS_PER_EMBEDDING = 5000;

  private final EmbeddingModel embeddingModel;
  private final MeterRegistry meterRegistry;

  /**
   * Embeds a question for nearest-neighbour search.
   *
   * @param query the question text
   * @return embedding vector, empty if the model is unavailable
   */
  @Timed(value = "embedding.embedQuery", description = "Time to embed query")
  @CircuitBreaker(name = "llm", fallbackMethod = "embedTextFallback")
  @Retry(name = "llm")
  public List<Float> embedQuery(String query) {
    return embed(query, "query");
  }

  /**
   * Embeds a chunk passage for indexing.
   *
   * @param passage the chunk text
   * @return embedding vector, empty if the model is unavailable
   */
  @Timed(value = "embedding.embedPassage", description = "Time to embed passage")
  @CircuitBreaker(name = "llm", fallbackMethod = "embedTextFallback")
  @Retry(name = "llm")
  public List<Float> embedPassage(String passage) {
    return embed(passage, "passage");
  }

  private List<Float> embed(String text, String type) {
    String input = text;
    if (input.length() > MAX_CHARS_PER_EMBEDDING) {
      log.warn(
          "{} too long for embedding, truncating from {} chars to {} chars",
          type,
          input.length(),
          MAX_CHARS_PER_EMBEDDING);
      input = input.substring(0, MAX_CHARS_PER_EMBEDDING);
    }

    Response<Embedding> response = embeddingModel.embed(input);
    meterRegistry.counter("embedding.requests.success", "type", type).increment();
    return toFloatList(response.content().vector());
  }

  /** Converts float array to Float list. */
  private List<Float> toFloatList(float[] vector) {
    List<Float> result = new ArrayList<>(vector.length);
    for (float f : vector) {
      result.add(f);
    }
    return result;
  }

  @SuppressWarnings("unused")
  private List<Float> embedTextFallback(String text, Throwable t) {
    log.error("Embedding failed, circuit breaker open or retries exhausted: {}", t.getMessage());
    meterRegistry.counter("embedding.requests.failure").increment();
    return List.of();
  }
}
