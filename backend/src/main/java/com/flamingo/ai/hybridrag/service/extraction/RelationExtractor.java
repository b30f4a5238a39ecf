package com.flamingo.ai.hybridrag.service.extraction;

import com.flamingo.ai.hybridrag.domain.model.Triple;
import java.util.List;

/**
 * Mines {@code (subject, predicate, object)} triples from one chunk of text.
 *
 * <p>Extraction is best-effort: implementations never throw, and an internal failure yields an
 * empty list for that chunk. Duplicate triples are allowed.
 */
public interface RelationExtractor {

  List<Triple> extract(String chunkText);

  boolean supports(ExtractionStrategy strategy);
}
