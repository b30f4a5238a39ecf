package com.flamingo.ai.hybridrag.exception;

/** Exception thrown when a corpus store (vector index or graph) fails. */
public class SearchException extends RuntimeException {

  public SearchException(String message) {
    super(message);
  }

  public SearchException(String message, Throwable cause) {
    super(message, cause);
  }
}
