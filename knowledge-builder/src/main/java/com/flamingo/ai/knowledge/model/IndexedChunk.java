package com.flamingo.ai.knowledge.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Map;

/**
 * A chunk annotated with its trimmed term-frequency table, as persisted in the knowledge base.
 *
 * @param source identifier of the originating document
 * @param title chunk title
 * @param text chunk text
 * @param termFrequency token counts in descending count order, at most the configured number of
 *     entries
 */
@JsonPropertyOrder({"source", "title", "text", "tf"})
public record IndexedChunk(
    String source,
    String title,
    String text,
    @JsonProperty("tf") Map<String, Integer> termFrequency) {

  public static IndexedChunk of(Chunk chunk, Map<String, Integer> termFrequency) {
    return new IndexedChunk(chunk.source(), chunk.title(), chunk.text(), termFrequency);
  }
}
