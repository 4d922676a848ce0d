package com.flamingo.ai.chunker.exception;

/** Exception thrown when a document id is null or blank. */
public class InvalidDocumentIdException extends RuntimeException {

  private final String documentId;

  public InvalidDocumentIdException(String documentId) {
    super("documentId must not be blank");
    this.documentId = documentId;
  }

  public String getDocumentId() {
    return documentId;
  }
}
