package com.flamingo.ai.hybridrag.store;

import java.util.List;
import java.util.Map;

/**
 * Vector index over chunk embeddings. Implementations embed text themselves; callers only deal in
 * text.
 */
public interface SemanticIndex {

  /**
   * Embeds and stores a chunk.
   *
   * @param id chunk id; adding an existing id overwrites it
   * @param text chunk text
   * @param metadata flat provenance map stored alongside the vector
   * @throws com.flamingo.ai.hybridrag.exception.SearchException if the chunk cannot be stored
   */
  void add(String id, String text, Map<String, Object> metadata);

  /**
   * Returns the {@code k} nearest chunks to the query text, best first.
   *
   * @param text query text
   * @param k maximum number of hits
   * @return hits ordered by descending score; empty when the index is empty or unreachable
   */
  List<SemanticHit> query(String text, int k);

  /** Number of stored chunks. */
  long size();

  /** Makes recent writes visible to queries. No-op for stores that are immediately consistent. */
  default void refresh() {}

  /** Short backend name reported by the health endpoint. */
  String backend();
}
