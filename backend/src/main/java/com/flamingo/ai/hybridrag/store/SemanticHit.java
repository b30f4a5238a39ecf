package com.flamingo.ai.hybridrag.store;

import java.util.Map;

/**
 * One nearest-neighbour result.
 *
 * @param id chunk id
 * @param text chunk text
 * @param metadata provenance stored with the chunk
 * @param score relevance in [0, 1], higher is closer
 */
public record SemanticHit(String id, String text, Map<String, Object> metadata, double score) {}
