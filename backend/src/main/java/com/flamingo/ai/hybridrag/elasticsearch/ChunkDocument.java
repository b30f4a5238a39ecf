package com.flamingo.ai.hybridrag.elasticsearch;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A chunk stored in Elasticsearch with its text, provenance and embedding. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChunkDocument {

  private String id;
  private String source;
  private int sequenceIndex;
  private String content;
  private List<Float> embedding;

  // Set by search methods
  @Builder.Default private Double relevanceScore = 0.0;
}
