package com.flamingo.ai.hybridrag.domain.model;

import java.util.UUID;

/**
 * A contiguous piece of a source document, the unit that gets embedded and mined for triples.
 *
 * @param id random identifier, so that re-ingesting the same document appends new index entries
 * @param text trimmed chunk text, never blank
 * @param metadata provenance of the chunk
 */
public record Chunk(String id, String text, ChunkMetadata metadata) {

  public static Chunk of(String text, String source, int sequenceIndex) {
    return new Chunk(UUID.randomUUID().toString(), text, new ChunkMetadata(source, sequenceIndex));
  }
}
