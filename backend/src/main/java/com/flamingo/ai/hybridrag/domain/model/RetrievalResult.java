package com.flamingo.ai.hybridrag.domain.model;

/**
 * Uniform envelope for an item returned by either retrieval path.
 *
 * @param content passage text or formatted fact
 * @param sourceDescriptor store the item came from
 * @param rank 1-based relevance order
 * @param itemId chunk id for passages, {@code null} for relationship facts
 */
public record RetrievalResult(String content, String sourceDescriptor, int rank, String itemId) {}
