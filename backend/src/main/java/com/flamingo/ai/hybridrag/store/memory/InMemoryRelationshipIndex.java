package com.flamingo.ai.hybridrag.store.memory;

import com.flamingo.ai.hybridrag.domain.model.Triple;
import com.flamingo.ai.hybridrag.store.EntityKeywords;
import com.flamingo.ai.hybridrag.store.RelationshipIndex;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Process-local entity graph. Readers proceed concurrently; writers are exclusive. */
@Component
@ConditionalOnProperty(
    name = "rag.store.relationship",
    havingValue = "in-memory",
    matchIfMissing = true)
@Slf4j
public class InMemoryRelationshipIndex implements RelationshipIndex {

  private final Set<String> nodes = new LinkedHashSet<>();
  private final Set<Triple> edges = new LinkedHashSet<>();
  private final ReadWriteLock lock = new ReentrantReadWriteLock();

  @Override
  public void mergeNode(String name) {
    lock.writeLock().lock();
    try {
      nodes.add(name);
    } finally {
      lock.writeLock().unlock();
    }
  }

  @Override
  public void mergeEdge(String subject, String predicate, String object) {
    Triple edge = new Triple(subject, predicate, object);
    lock.writeLock().lock();
    try {
      nodes.add(edge.subject());
      nodes.add(edge.object());
      if (edges.add(edge)) {
        log.debug("Added edge ({}, {}, {})", edge.subject(), edge.predicate(), edge.object());
      }
    } finally {
      lock.writeLock().unlock();
    }
  }

  @Override
  public List<Triple> match(Set<String> keywords) {
    lock.readLock().lock();
    try {
      List<Triple> matches = new ArrayList<>();
      for (Triple edge : edges) {
        if (EntityKeywords.sharesToken(edge.subject(), keywords)
            || EntityKeywords.sharesToken(edge.object(), keywords)) {
          matches.add(edge);
        }
      }
      return matches;
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public long nodeCount() {
    lock.readLock().lock();
    try {
      return nodes.size();
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public long edgeCount() {
    lock.readLock().lock();
    try {
      return edges.size();
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public String backend() {
    return "in-memory";
  }
}
