package com.flamingo.ai.hybridrag.store;

import com.flamingo.ai.hybridrag.domain.model.Triple;
import java.util.List;
import java.util.Set;

/**
 * Entity graph built from extracted triples. Nodes are merged by exact name and edges by
 * {@code (subject, predicate, object)}, so repeated writes are idempotent.
 */
public interface RelationshipIndex {

  void mergeNode(String name);

  /** Merges the edge, creating either endpoint if it does not exist yet. */
  void mergeEdge(String subject, String predicate, String object);

  /**
   * Returns every edge whose subject or object shares at least one token with the keywords.
   *
   * @param keywords lower-cased question tokens
   * @return matching edges in a stable order
   */
  List<Triple> match(Set<String> keywords);

  long nodeCount();

  long edgeCount();

  /** Short backend name reported by the health endpoint. */
  String backend();
}
