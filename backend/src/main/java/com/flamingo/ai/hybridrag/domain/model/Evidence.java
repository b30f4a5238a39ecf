package com.flamingo.ai.hybridrag.domain.model;

import java.util.List;

/**
 * Provenance attached to an answer.
 *
 * @param store {@link #SEMANTIC_INDEX} or {@link #RELATIONSHIP_INDEX}
 * @param itemIds chunk ids backing a semantic answer; empty for relationship answers
 * @param matchCount number of items that matched the question
 */
public record Evidence(String store, List<String> itemIds, int matchCount) {

  public static final String SEMANTIC_INDEX = "semantic_index";
  public static final String RELATIONSHIP_INDEX = "relationship_index";

  public Evidence {
    itemIds = List.copyOf(itemIds);
  }
}
