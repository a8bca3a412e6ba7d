package com.flamingo.ai.knowledge.service.index;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Corpus-wide count of chunks containing each token.
 *
 * <p>One table is created per build run and handed to the {@link FrequencyIndexer} explicitly. It
 * is not thread-safe. Tokens keep the order in which they were first recorded.
 */
public class DocumentFrequencyTable {

  private final Map<String, Integer> counts = new LinkedHashMap<>();
  private int chunkCount;

  /**
   * Records one chunk: every distinct token counts once, however often it occurs.
   *
   * @param distinctTokens the chunk's distinct tokens
   */
  public void recordChunk(Collection<String> distinctTokens) {
    chunkCount++;
    for (String token : distinctTokens) {
      counts.merge(token, 1, Integer::sum);
    }
  }

  int get(String token) {
    return counts.getOrDefault(token, 0);
  }

  /** Number of chunks recorded so far. */
  public int chunkCount() {
    return chunkCount;
  }

  public int size() {
    return counts.size();
  }

  /** Read-only view in first-seen order. */
  public Map<String, Integer> asMap() {
    return Collections.unmodifiableMap(counts);
  }
}
