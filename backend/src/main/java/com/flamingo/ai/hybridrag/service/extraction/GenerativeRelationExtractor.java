package com.flamingo.ai.hybridrag.service.extraction;

import com.flamingo.ai.hybridrag.domain.model.Triple;
import com.flamingo.ai.hybridrag.service.llm.TextGenerator;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Extractor that asks the text generator for triples. Degrades to no triples on failure. */
@Component
@RequiredArgsConstructor
@Slf4j
public class GenerativeRelationExtractor implements RelationExtractor {

  private final TextGenerator textGenerator;
  private final TripleLineParser tripleLineParser;
  private final MeterRegistry meterRegistry;

  @Override
  public List<Triple> extract(String chunkText) {
    if (chunkText == null || chunkText.isBlank()) {
      return List.of();
    }
    if (!textGenerator.isAvailable()) {
      log.debug("Text generator not configured, no triples extracted");
      return List.of();
    }
    try {
      return tripleLineParser.parse(textGenerator.extractTriples(chunkText));
    } catch (RuntimeException e) {
      log.warn("Generative extraction failed: {}", e.getMessage());
      meterRegistry.counter("extraction.failure", "strategy", "generative").increment();
      return List.of();
    }
  }

  @Override
  public boolean supports(ExtractionStrategy strategy) {
    return strategy == ExtractionStrategy.GENERATIVE;
  }
}
