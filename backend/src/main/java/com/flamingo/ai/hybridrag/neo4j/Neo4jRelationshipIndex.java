package com.flamingo.ai.hybridrag.neo4j;

import com.flamingo.ai.hybridrag.config.Neo4jConfig.Neo4jSettings;
import com.flamingo.ai.hybridrag.domain.model.Triple;
import com.flamingo.ai.hybridrag.exception.SearchException;
import com.flamingo.ai.hybridrag.store.EntityKeywords;
import com.flamingo.ai.hybridrag.store.RelationshipIndex;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.annotation.Timed;
import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.Driver;
import org.neo4j.driver.Record;
import org.neo4j.driver.Session;
import org.neo4j.driver.SessionConfig;
import org.neo4j.driver.exceptions.Neo4jException;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Relationship index stored in Neo4j as {@code (:Entity {name})} nodes joined by relationships
 * typed with the triple's predicate. All writes use {@code MERGE}.
 */
@Component
@ConditionalOnProperty(name = "rag.store.relationship", havingValue = "neo4j")
@RequiredArgsConstructor
@Slf4j
public class Neo4jRelationshipIndex implements RelationshipIndex {

  private static final Pattern INVALID_TYPE_CHARS = Pattern.compile("[^A-Za-z0-9_]");

  static final String CREATE_CONSTRAINT =
      "CREATE CONSTRAINT entity_name IF NOT EXISTS FOR (e:Entity) REQUIRE e.name IS UNIQUE";
  static final String MERGE_NODE = "MERGE (:Entity {name: $name})";
  static final String MERGE_EDGE =
      "MERGE (h:Entity {name: $subject}) "
          + "MERGE (t:Entity {name: $object}) "
          + "MERGE (h)-[:`%s`]->(t)";
  // Coarse substring prefilter in Cypher; whole-token matching is applied afterwards.
  static final String MATCH_EDGES =
      "MATCH (h:Entity)-[r]->(t:Entity) "
          + "WHERE any(k IN $keywords "
          + "WHERE toLower(h.name) CONTAINS k OR toLower(t.name) CONTAINS k) "
          + "RETURN h.name AS subject, type(r) AS predicate, t.name AS object "
          + "ORDER BY subject, predicate, object";
  static final String COUNT_NODES = "MATCH (n:Entity) RETURN count(n) AS count";
  static final String COUNT_EDGES = "MATCH (:Entity)-[r]->(:Entity) RETURN count(r) AS count";

  private final Driver driver;
  private final Neo4jSettings settings;

  @PostConstruct
  public void initSchema() {
    run(CREATE_CONSTRAINT, Map.of(), record -> null);
    log.info("Neo4j relationship index ready (database={})", settings.database());
  }

  @Override
  public void mergeNode(String name) {
    run(MERGE_NODE, Map.of("name", name), record -> null);
  }

  @Override
  @Timed(value = "graph.merge_edge", description = "Time to merge one relationship")
  public void mergeEdge(String subject, String predicate, String object) {
    String query = MERGE_EDGE.formatted(relationshipType(predicate));
    run(query, Map.of("subject", subject, "object", object), record -> null);
  }

  @Override
  @Timed(value = "graph.match", description = "Time to match relationships")
  public List<Triple> match(Set<String> keywords) {
    if (keywords.isEmpty()) {
      return List.of();
    }
    List<Triple> candidates =
        run(
            MATCH_EDGES,
            Map.of("keywords", List.copyOf(keywords)),
            record ->
                new Triple(
                    record.get("subject").asString(),
                    record.get("predicate").asString(),
                    record.get("object").asString()));

    List<Triple> matches = new ArrayList<>();
    for (Triple candidate : candidates) {
      if (EntityKeywords.sharesToken(candidate.subject(), keywords)
          || EntityKeywords.sharesToken(candidate.object(), keywords)) {
        matches.add(candidate);
      }
    }
    return matches;
  }

  @Override
  public long nodeCount() {
    return count(COUNT_NODES);
  }

  @Override
  public long edgeCount() {
    return count(COUNT_EDGES);
  }

  @Override
  public String backend() {
    return "neo4j";
  }

  /** Relationship types cannot be parameterized, so anything outside [A-Za-z0-9_] is replaced. */
  @VisibleForTesting
  static String relationshipType(String predicate) {
    return INVALID_TYPE_CHARS.matcher(predicate).replaceAll("_");
  }

  private long count(String query) {
    List<Long> counts = run(query, Map.of(), record -> record.get("count").asLong());
    return counts.isEmpty() ? 0L : counts.get(0);
  }

  private <T> List<T> run(
      String query, Map<String, Object> parameters, Function<Record, T> mapper) {
    try (Session session = driver.session(SessionConfig.forDatabase(settings.database()))) {
      List<T> rows = new ArrayList<>();
      for (Record record : session.run(query, parameters).list()) {
        T row = mapper.apply(record);
        if (row != null) {
          rows.add(row);
        }
      }
      return rows;
    } catch (Neo4jException e) {
      log.error("Neo4j query failed: {}", e.getMessage(), e);
      throw new SearchException("Relationship graph query failed: " + e.getMessage(), e);
    }
  }
}
