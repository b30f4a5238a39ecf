package com.flamingo.ai.hybridrag;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.elasticsearch.ElasticsearchClientAutoConfiguration;
import org.springframework.boot.autoconfigure.elasticsearch.ElasticsearchRestClientAutoConfiguration;
import org.springframework.boot.autoconfigure.neo4j.Neo4jAutoConfiguration;

/**
 * Hybrid RAG backend: ingests a text corpus into a semantic index and a relationship graph, then
 * answers questions from whichever representation the query router picks.
 *
 * <p>Store clients are wired by {@code ElasticsearchConfig} and {@code Neo4jConfig} only when the
 * corresponding backend is selected, so Boot's own client auto-configurations are excluded.
 */
@SpringBootApplication(
    exclude = {
      ElasticsearchClientAutoConfiguration.class,
      ElasticsearchRestClientAutoConfiguration.class,
      Neo4jAutoConfiguration.class
    })
public class HybridRagApplication {

  public static void main(String[] args) {
    SpringApplication.run(HybridRagApplication.class, args);
  }
}
