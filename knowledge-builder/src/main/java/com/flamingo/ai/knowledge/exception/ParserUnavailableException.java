package com.flamingo.ai.knowledge.exception;

/**
 * Exception thrown when no document parser on the classpath can read the requested format. The run
 * cannot recover from this and is aborted.
 */
public class ParserUnavailableException extends RuntimeException {

  private final String mediaType;
  private final String userMessage;

  public ParserUnavailableException(String mediaType) {
    super("No parser available for media type " + mediaType);
    this.mediaType = mediaType;
    this.userMessage =
        "Missing document parser for "
            + mediaType
            + ". Add org.apache.tika:tika-parsers-standard-package to the classpath.";
  }

  public String getMediaType() {
    return mediaType;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
