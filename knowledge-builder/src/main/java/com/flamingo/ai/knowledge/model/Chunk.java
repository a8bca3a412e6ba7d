package com.flamingo.ai.knowledge.model;

/**
 * A titled span of document text produced by a {@link
 * com.flamingo.ai.knowledge.service.chunking.DocumentChunker} flush.
 *
 * @param source identifier of the document the text came from
 * @param title heading the text was collected under, or the configured placeholder
 * @param text paragraphs joined by {@code \n}, stripped
 */
public record Chunk(String source, String title, String text) {}
