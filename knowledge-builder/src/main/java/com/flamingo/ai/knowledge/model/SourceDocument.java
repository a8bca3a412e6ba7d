package com.flamingo.ai.knowledge.model;

import java.nio.file.Path;

/**
 * A document to index together with the source name its chunks are tagged with.
 *
 * @param path location of the document on disk
 * @param name source identifier written to every chunk, e.g. {@code regelwerk}
 */
public record SourceDocument(Path path, String name) {}
