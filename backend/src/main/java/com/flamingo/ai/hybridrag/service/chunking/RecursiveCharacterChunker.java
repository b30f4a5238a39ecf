package com.flamingo.ai.hybridrag.service.chunking;

import com.flamingo.ai.hybridrag.config.RagConfig;
import com.flamingo.ai.hybridrag.domain.model.Chunk;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Fixed-window chunker with overlap.
 *
 * <p>Text is split at the coarsest boundary available (paragraph, line, sentence, whitespace);
 * pieces still larger than the window are split again at the next finer boundary. Fitting pieces
 * are then packed greedily into windows of at most {@code size} characters, each new window
 * starting with up to {@code overlap} characters taken from the end of the previous one.
 *
 * <p>Separators stay attached to the piece they terminate, so every chunk is a contiguous
 * substring of the source before trimming.
 */
@Component
@Slf4j
public class RecursiveCharacterChunker implements TextChunker {

  private static final List<Pattern> SEPARATORS =
      List.of(
          Pattern.compile("\\n\\s*\\n"),
          Pattern.compile("\\n"),
          Pattern.compile("(?<=[.!?])\\s+"),
          Pattern.compile("\\s+"));

  @Override
  public List<Chunk> chunk(String text, String source, RagConfig.Chunking config) {
    if (text == null || text.isBlank()) {
      return List.of();
    }
    validate(config);

    List<Chunk> chunks = new ArrayList<>();
    for (String window : split(text, 0, config)) {
      String trimmed = window.strip();
      if (!trimmed.isEmpty()) {
        chunks.add(Chunk.of(trimmed, source, chunks.size()));
      }
    }
    log.debug("Recursive chunking of {} produced {} chunks", source, chunks.size());
    return chunks;
  }

  @Override
  public boolean supports(ChunkingStrategy strategy) {
    return strategy == ChunkingStrategy.RECURSIVE;
  }

  private List<String> split(String text, int level, RagConfig.Chunking config) {
    List<String> windows = new ArrayList<>();
    if (text.length() <= config.getSize()) {
      windows.add(text);
      return windows;
    }

    int separatorLevel = level;
    while (separatorLevel < SEPARATORS.size()
        && !SEPARATORS.get(separatorLevel).matcher(text).find()) {
      separatorLevel++;
    }
    if (separatorLevel == SEPARATORS.size()) {
      return oversizedWord(text, config);
    }

    List<String> fitting = new ArrayList<>();
    for (String piece : splitKeepingSeparator(text, SEPARATORS.get(separatorLevel))) {
      if (piece.length() <= config.getSize()) {
        fitting.add(piece);
      } else {
        windows.addAll(merge(fitting, config));
        fitting.clear();
        windows.addAll(split(piece, separatorLevel + 1, config));
      }
    }
    windows.addAll(merge(fitting, config));
    return windows;
  }

  private List<String> splitKeepingSeparator(String text, Pattern separator) {
    List<String> pieces = new ArrayList<>();
    Matcher matcher = separator.matcher(text);
    int start = 0;
    while (matcher.find()) {
      addIfNotBlank(pieces, text.substring(start, matcher.end()));
      start = matcher.end();
    }
    addIfNotBlank(pieces, text.substring(start));
    return pieces;
  }

  private void addIfNotBlank(List<String> pieces, String piece) {
    if (!piece.isBlank()) {
      pieces.add(piece);
    }
  }

  private List<String> merge(List<String> pieces, RagConfig.Chunking config) {
    List<String> windows = new ArrayList<>();
    Deque<String> current = new ArrayDeque<>();
    int total = 0;
    for (String piece : pieces) {
      int length = piece.length();
      if (total + length > config.getSize() && !current.isEmpty()) {
        windows.add(String.join("", current));
        // Keep at most `overlap` trailing characters as the head of the next window.
        while (total > config.getOverlap()
            || (total + length > config.getSize() && total > 0)) {
          total -= current.removeFirst().length();
        }
      }
      current.addLast(piece);
      total += length;
    }
    if (!current.isEmpty()) {
      windows.add(String.join("", current));
    }
    return windows;
  }

  private List<String> oversizedWord(String text, RagConfig.Chunking config) {
    if (!config.isHardCutOversizedWords()) {
      log.debug("Keeping oversized run of {} characters as a single chunk", text.length());
      return List.of(text);
    }
    String word = text.strip();
    List<String> slices = new ArrayList<>();
    for (int start = 0; start < word.length(); start += config.getSize()) {
      slices.add(word.substring(start, Math.min(word.length(), start + config.getSize())));
    }
    return slices;
  }

  private void validate(RagConfig.Chunking config) {
    if (config.getSize() <= 0) {
      throw new IllegalArgumentException("Chunk size must be positive: " + config.getSize());
    }
    if (config.getOverlap() < 0 || config.getOverlap() >= config.getSize()) {
      throw new IllegalArgumentException(
          "Chunk overlap must be in [0, size): overlap="
              + config.getOverlap()
              + ", size="
              + config.getSize());
    }
  }
}
