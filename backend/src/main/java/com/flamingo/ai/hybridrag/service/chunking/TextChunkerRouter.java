package com.flamingo.ai.hybridrag.service.chunking;

import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Routes a configured {@link ChunkingStrategy} to the first {@link TextChunker} bean that supports
 * it. Callers depend on this router, never on concrete chunkers.
 */
@Service
@RequiredArgsConstructor
public class TextChunkerRouter {

  private final List<TextChunker> chunkers;

  /**
   * Returns the chunker for the given policy.
   *
   * @param strategy configured policy
   * @return selected chunker
   * @throws IllegalStateException if no chunker supports the policy
   */
  public TextChunker route(ChunkingStrategy strategy) {
    return chunkers.stream()
        .filter(c -> c.supports(strategy))
        .findFirst()
        .orElseThrow(
            () -> new IllegalStateException("No TextChunker found for strategy: " + strategy));
  }
}
