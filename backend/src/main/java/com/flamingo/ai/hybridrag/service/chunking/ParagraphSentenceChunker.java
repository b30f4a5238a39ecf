package com.flamingo.ai.hybridrag.service.chunking;

import com.flamingo.ai.hybridrag.config.RagConfig;
import com.flamingo.ai.hybridrag.domain.model.Chunk;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Structural chunker: one chunk per paragraph.
 *
 * <p>Paragraphs shorter than {@code minLength} are dropped as headings or noise. Paragraphs longer
 * than {@code maxParagraphLength} are split into sentences that are packed greedily into
 * sub-chunks of at most {@code sentencePackLength} characters; a single sentence longer than that
 * becomes its own sub-chunk.
 */
@Component
@Slf4j
public class ParagraphSentenceChunker implements TextChunker {

  private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n\\s*\\n");
  private static final Pattern SENTENCE_BREAK = Pattern.compile("(?<=[.!?])\\s+");

  @Override
  public List<Chunk> chunk(String text, String source, RagConfig.Chunking config) {
    if (text == null || text.isBlank()) {
      return List.of();
    }

    List<String> pieces = new ArrayList<>();
    int dropped = 0;
    for (String raw : PARAGRAPH_BREAK.split(text)) {
      String paragraph = raw.strip();
      if (paragraph.length() < config.getMinLength()) {
        if (!paragraph.isEmpty()) {
          dropped++;
        }
        continue;
      }
      if (paragraph.length() <= config.getMaxParagraphLength()) {
        pieces.add(paragraph);
      } else {
        pieces.addAll(packSentences(paragraph, config.getSentencePackLength()));
      }
    }

    List<Chunk> chunks = new ArrayList<>(pieces.size());
    for (String piece : pieces) {
      chunks.add(Chunk.of(piece, source, chunks.size()));
    }
    log.debug(
        "Structural chunking of {} produced {} chunks ({} short paragraphs dropped)",
        source,
        chunks.size(),
        dropped);
    return chunks;
  }

  @Override
  public boolean supports(ChunkingStrategy strategy) {
    return strategy == ChunkingStrategy.STRUCTURAL;
  }

  private List<String> packSentences(String paragraph, int packLength) {
    List<String> packed = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    for (String sentence : SENTENCE_BREAK.split(paragraph)) {
      if (sentence.isBlank()) {
        continue;
      }
      if (current.length() > 0 && current.length() + 1 + sentence.length() > packLength) {
        packed.add(current.toString());
        current.setLength(0);
      }
      if (current.length() > 0) {
        current.append(' ');
      }
      current.append(sentence);
    }
    if (current.length() > 0) {
      packed.add(current.toString());
    }
    return packed;
  }
}
