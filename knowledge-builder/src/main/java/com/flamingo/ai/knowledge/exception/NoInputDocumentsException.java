package com.flamingo.ai.knowledge.exception;

import java.nio.file.Path;

/** Exception thrown when an input directory holds no document with the expected extension. */
public class NoInputDocumentsException extends RuntimeException {

  private final Path directory;

  public NoInputDocumentsException(Path directory, String extension) {
    super("No " + extension + " files found in " + directory);
    this.directory = directory;
  }

  public Path getDirectory() {
    return directory;
  }

  public String getUserMessage() {
    return getMessage();
  }
}
