package com.flamingo.ai.hybridrag.service.chunking;

/** Available chunking policies. */
public enum ChunkingStrategy {
  /** Fixed window with overlap, split at the coarsest boundary that fits. */
  RECURSIVE,
  /** Paragraphs, with long paragraphs re-packed by sentence. */
  STRUCTURAL
}
