package com.flamingo.ai.hybridrag.domain.model;

import java.util.Map;

/**
 * Where a chunk came from.
 *
 * @param source document reference the chunk was read from
 * @param sequenceIndex 0-based position of the chunk in the document, contiguous after filtering
 */
public record ChunkMetadata(String source, int sequenceIndex) {

  public static final String SOURCE = "source";
  public static final String SEQUENCE_INDEX = "sequence_index";

  /** Flat representation stored alongside the chunk in the semantic index. */
  public Map<String, Object> asMap() {
    return Map.of(SOURCE, source, SEQUENCE_INDEX, sequenceIndex);
  }
}
