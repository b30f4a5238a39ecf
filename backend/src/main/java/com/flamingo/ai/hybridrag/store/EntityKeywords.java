package com.flamingo.ai.hybridrag.store;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/** Tokenization shared by question keyword extraction and entity matching. */
public final class EntityKeywords {

  private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^\\p{L}\\p{N}]+");

  private static final Set<String> STOP_WORDS =
      Set.of(
          "a", "about", "an", "and", "any", "are", "as", "at", "be", "by", "can", "define",
          "describe", "did", "do", "does", "explain", "for", "from", "give", "how", "i", "in",
          "into", "is", "it", "its", "me", "my", "of", "on", "or", "please", "show", "tell", "that",
          "the", "their", "there", "these", "this", "those", "to", "us", "was", "we", "were",
          "what", "when", "where", "which", "who", "why", "will", "with", "you", "your");

  private EntityKeywords() {}

  /** Lower-cased alphanumeric tokens of the text, in first-seen order. */
  public static Set<String> tokenize(String text) {
    if (text == null || text.isBlank()) {
      return Set.of();
    }
    return Arrays.stream(NON_ALPHANUMERIC.split(text.toLowerCase(Locale.ROOT)))
        .filter(token -> !token.isEmpty())
        .collect(Collectors.toCollection(LinkedHashSet::new));
  }

  /** Tokens of the text with question words and other stop words removed. */
  public static Set<String> contentTokens(String text) {
    Set<String> tokens = tokenize(text);
    if (tokens.isEmpty()) {
      return tokens;
    }
    Set<String> content = new LinkedHashSet<>(tokens);
    content.removeAll(STOP_WORDS);
    return content;
  }

  /** Whether the text (an entity name or a passage) contains one of the keywords as a token. */
  public static boolean sharesToken(String entity, Set<String> keywords) {
    if (keywords.isEmpty()) {
      return false;
    }
    for (String token : tokenize(entity)) {
      if (keywords.contains(token)) {
        return true;
      }
    }
    return false;
  }
}
