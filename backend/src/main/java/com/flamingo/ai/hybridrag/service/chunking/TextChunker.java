package com.flamingo.ai.hybridrag.service.chunking;

import com.flamingo.ai.hybridrag.config.RagConfig;
import com.flamingo.ai.hybridrag.domain.model.Chunk;
import java.util.List;

/**
 * Splits raw document text into ordered {@link Chunk}s.
 *
 * <p>Implementations are stateless and register as Spring beans; {@link TextChunkerRouter} picks
 * the one matching {@code rag.chunking.strategy}.
 */
public interface TextChunker {

  /**
   * Chunks the given text.
   *
   * @param text full document text; blank input yields an empty list
   * @param source document reference recorded in each chunk's metadata
   * @param config chunking tunables
   * @return chunks in document order with contiguous sequence indices
   */
  List<Chunk> chunk(String text, String source, RagConfig.Chunking config);

  /**
   * Returns {@code true} if this chunker implements the given policy.
   *
   * @param strategy configured policy
   * @return {@code true} if supported
   */
  boolean supports(ChunkingStrategy strategy);
}
