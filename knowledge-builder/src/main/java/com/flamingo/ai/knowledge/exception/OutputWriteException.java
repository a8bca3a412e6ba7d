package com.flamingo.ai.knowledge.exception;

import java.nio.file.Path;

/** Exception thrown when the knowledge base or a converted text file cannot be written. */
public class OutputWriteException extends RuntimeException {

  private final Path target;

  public OutputWriteException(Path target, Throwable cause) {
    super("Failed to write " + target + ": " + cause.getMessage(), cause);
    this.target = target;
  }

  public Path getTarget() {
    return target;
  }

  public String getUserMessage() {
    return "Could not write " + target;
  }
}
