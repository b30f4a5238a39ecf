package com.flamingo.ai.hybridrag.config;

import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Neo4j driver for the relationship index. Only active when the graph lives in Neo4j. */
@Configuration
@ConditionalOnProperty(name = "rag.store.relationship", havingValue = "neo4j")
@Slf4j
public class Neo4jConfig {

  @Value("${neo4j.uri:bolt://localhost:7687}")
  private String uri;

  @Value("${neo4j.username:neo4j}")
  private String username;

  @Value("${neo4j.password:password}")
  private String password;

  @Value("${neo4j.database:neo4j}")
  private String database;

  @Bean(destroyMethod = "close")
  public Driver neo4jDriver() {
    log.info("Connecting to Neo4j at {}", uri);
    return GraphDatabase.driver(uri, AuthTokens.basic(username, password));
  }

  @Bean
  public Neo4jSettings neo4jSettings() {
    return new Neo4jSettings(database);
  }

  /** Connection-level settings shared by the graph store. */
  public record Neo4jSettings(String database) {}
}
