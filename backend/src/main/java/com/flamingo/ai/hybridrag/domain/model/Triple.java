package com.flamingo.ai.hybridrag.domain.model;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * A directed, typed fact {@code (subject, predicate, object)} mined from a chunk.
 *
 * <p>All parts are normalized on construction: surrounding whitespace and quote characters are
 * stripped, and the predicate is upper-cased with whitespace runs replaced by underscores so it
 * can be used as a graph relationship type.
 */
public record Triple(String subject, String predicate, String object) {

  private static final Pattern QUOTES = Pattern.compile("[\"']");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  public Triple {
    subject = clean(subject);
    object = clean(object);
    predicate = WHITESPACE.matcher(clean(predicate)).replaceAll("_").toUpperCase(Locale.ROOT);
    if (subject.isEmpty() || predicate.isEmpty() || object.isEmpty()) {
      throw new IllegalArgumentException(
          "Triple parts must not be empty: (" + subject + ", " + predicate + ", " + object + ")");
    }
  }

  /** Builds a normalized triple, or empty when any part is blank after normalization. */
  public static Optional<Triple> of(String subject, String predicate, String object) {
    if (isBlankAfterCleaning(subject)
        || isBlankAfterCleaning(predicate)
        || isBlankAfterCleaning(object)) {
      return Optional.empty();
    }
    return Optional.of(new Triple(subject, predicate, object));
  }

  /** Human-readable fact line, e.g. {@code • FastAPI has routers}. */
  public String asFact() {
    String verb = predicate.replace('_', ' ').toLowerCase(Locale.ROOT);
    return "• " + subject + " " + verb + " " + object;
  }

  private static boolean isBlankAfterCleaning(String value) {
    return value == null || clean(value).isEmpty();
  }

  private static String clean(String value) {
    if (value == null) {
      return "";
    }
    return QUOTES.matcher(value).replaceAll("").strip();
  }
}
