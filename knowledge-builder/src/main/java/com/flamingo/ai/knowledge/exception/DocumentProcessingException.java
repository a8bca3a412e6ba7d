package com.flamingo.ai.knowledge.exception;

/** Exception thrown when a source document cannot be read or chunked. */
public class DocumentProcessingException extends RuntimeException {

  private final String source;
  private final String userMessage;

  public DocumentProcessingException(String source, String message) {
    super(message);
    this.source = source;
    this.userMessage = "Failed to process document " + source;
  }

  public DocumentProcessingException(String source, String message, Throwable cause) {
    super(message, cause);
    this.source = source;
    this.userMessage = "Failed to process document " + source;
  }

  public String getSource() {
    return source;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
