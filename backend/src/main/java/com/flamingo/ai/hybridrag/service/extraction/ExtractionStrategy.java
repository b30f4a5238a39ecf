package com.flamingo.ai.hybridrag.service.extraction;

/** Available triple extraction strategies. */
public enum ExtractionStrategy {
  /** Fixed lexical templates over a small set of verb families. */
  PATTERN,
  /** Ask the text generator for triples and parse its reply. */
  GENERATIVE
}
