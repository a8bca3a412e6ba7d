package com.flamingo.ai.knowledge.service.parsing;

import java.nio.file.Path;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Routes a document path to the highest-priority {@link ParagraphSource} that supports it.
 *
 * <p>Sources are injected by Spring in {@code @Order} order (ascending). {@link
 * TikaParagraphSource} is registered last and accepts every file.
 */
@Service
@RequiredArgsConstructor
public class ParagraphSourceRouter {

  private final List<ParagraphSource> sources;

  /**
   * Returns the first source that supports the given document.
   *
   * @param path document path
   * @return selected source
   * @throws IllegalStateException if no source supports the path
   */
  public ParagraphSource route(Path path) {
    return sources.stream()
        .filter(s -> s.supports(path))
        .findFirst()
        .orElseThrow(
            () -> new IllegalStateException("No ParagraphSource found for document: " + path));
  }
}
