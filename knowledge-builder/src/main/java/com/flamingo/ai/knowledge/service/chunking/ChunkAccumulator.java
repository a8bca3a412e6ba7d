package com.flamingo.ai.knowledge.service.chunking;

import com.flamingo.ai.knowledge.model.Chunk;
import com.flamingo.ai.knowledge.util.UnicodeWhitespace;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Immutable chunker state between two paragraphs.
 *
 * <p>Every transition returns a new accumulator; {@link #flush} has no side effects and leaves the
 * caller to {@link #reset()}.
 *
 * @param title most recent heading, {@code null} until one is seen
 * @param lines body paragraphs collected since the last flush
 * @param length sum of the collected paragraph lengths plus one separator each
 */
public record ChunkAccumulator(String title, List<String> lines, int length) {

  public ChunkAccumulator {
    lines = List.copyOf(lines);
  }

  public static ChunkAccumulator empty() {
    return new ChunkAccumulator(null, List.of(), 0);
  }

  /** Replaces the title and keeps the collected body. */
  public ChunkAccumulator withTitle(String heading) {
    return new ChunkAccumulator(heading, lines, length);
  }

  public ChunkAccumulator append(String line) {
    List<String> next = new ArrayList<>(lines);
    next.add(line);
    return new ChunkAccumulator(title, next, length + HeadingClassifier.length(line) + 1);
  }

  /** Drops the collected body; the title carries over to the next chunk. */
  public ChunkAccumulator reset() {
    return new ChunkAccumulator(title, List.of(), 0);
  }

  public boolean isEmpty() {
    return lines.isEmpty();
  }

  /**
   * Builds the chunk the collected body would produce.
   *
   * @param source document identifier for the chunk
   * @param minChunkLength shortest text that is emitted
   * @param defaultTitle title used when no heading has been seen
   * @return the chunk, or empty if nothing was collected or the text is too short
   */
  public Optional<Chunk> flush(String source, int minChunkLength, String defaultTitle) {
    if (lines.isEmpty()) {
      return Optional.empty();
    }
    String text = UnicodeWhitespace.strip(String.join("\n", lines));
    if (HeadingClassifier.length(text) < minChunkLength) {
      return Optional.empty();
    }
    return Optional.of(new Chunk(source, title != null ? title : defaultTitle, text));
  }
}
