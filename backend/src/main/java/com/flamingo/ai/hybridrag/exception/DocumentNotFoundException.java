package com.flamingo.ai.hybridrag.exception;

/** Exception thrown when a document reference cannot be resolved or read. */
public class DocumentNotFoundException extends RuntimeException {

  public DocumentNotFoundException(String documentRef) {
    super("Document not found: " + documentRef);
  }

  public DocumentNotFoundException(String documentRef, Throwable cause) {
    super("Document could not be read: " + documentRef, cause);
  }
}
