package com.flamingo.ai.hybridrag.exception;

/** Exception thrown when the text generator is unavailable or fails. */
public class LlmServiceException extends RuntimeException {

  public LlmServiceException(String message) {
    super(message);
  }

  public LlmServiceException(String message, Throwable cause) {
    super(message, cause);
  }
}
