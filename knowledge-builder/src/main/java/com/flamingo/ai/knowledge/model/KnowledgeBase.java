package com.flamingo.ai.knowledge.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;
import java.util.Map;

/**
 * The single output artifact of a build run.
 *
 * @param chunkCount number of emitted chunks
 * @param documentFrequency number of chunks containing each token at least once, computed before
 *     per-chunk trimming
 * @param chunks indexed chunks in document and paragraph order
 */
@JsonPropertyOrder({"chunk_count", "df", "chunks"})
public record KnowledgeBase(
    @JsonProperty("chunk_count") int chunkCount,
    @JsonProperty("df") Map<String, Integer> documentFrequency,
    List<IndexedChunk> chunks) {}
