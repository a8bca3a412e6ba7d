package com.flamingo.ai.knowledge.service.chunking;

import com.flamingo.ai.knowledge.model.Chunk;
import java.util.List;

/**
 * Splits the ordered paragraphs of one document into titled {@link Chunk}s.
 *
 * <p>Implementations must be deterministic: the same paragraphs always yield the same chunks.
 */
public interface DocumentChunker {

  /**
   * Produces chunks from the paragraphs of a single document.
   *
   * @param paragraphs stripped, non-empty paragraphs in document order
   * @param source identifier written to every produced chunk
   * @return ordered list of chunks
   */
  List<Chunk> chunk(List<String> paragraphs, String source);
}
