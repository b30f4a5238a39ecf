package com.flamingo.ai.hybridrag.service.extraction;

import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/** Routes a configured {@link ExtractionStrategy} to the first extractor bean that supports it. */
@Service
@RequiredArgsConstructor
public class RelationExtractorRouter {

  private final List<RelationExtractor> extractors;

  /**
   * Returns the extractor for the given strategy.
   *
   * @throws IllegalStateException if no extractor supports the strategy
   */
  public RelationExtractor route(ExtractionStrategy strategy) {
    return extractors.stream()
        .filter(e -> e.supports(strategy))
        .findFirst()
        .orElseThrow(
            () ->
                new IllegalStateException("No RelationExtractor found for strategy: " + strategy));
  }
}
