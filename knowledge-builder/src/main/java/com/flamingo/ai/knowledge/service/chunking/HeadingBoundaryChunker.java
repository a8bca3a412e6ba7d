package com.flamingo.ai.knowledge.service.chunking;

import com.flamingo.ai.knowledge.config.KnowledgeConfig;
import com.flamingo.ai.knowledge.model.Chunk;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * {@link DocumentChunker} that accumulates body paragraphs under the latest heading and flushes
 * them into a chunk when a heading arrives after enough text or when the text grows too long.
 *
 * <p>For each paragraph, in order:
 *
 * <ol>
 *   <li>A heading flushes the accumulated body if it is at least {@code min-chars} long, then
 *       becomes the current title. Below {@code min-chars} only the title changes, so a short
 *       section is merged into the chunk of the following heading.
 *   <li>Any other paragraph is appended to the body.
 *   <li>A body of {@code max-chars} or more is flushed immediately.
 * </ol>
 *
 * <p>The remaining body is flushed at the end of the document. Flushed text shorter than {@code
 * min-chunk-length} is dropped; the title survives every flush.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HeadingBoundaryChunker implements DocumentChunker {

  private final HeadingClassifier headingClassifier;
  private final KnowledgeConfig config;

  @Override
  public List<Chunk> chunk(List<String> paragraphs, String source) {
    KnowledgeConfig.Chunking chunking = config.getChunking();
    List<Chunk> chunks = new ArrayList<>();
    ChunkAccumulator acc = ChunkAccumulator.empty();

    for (String paragraph : paragraphs) {
      if (headingClassifier.isHeading(paragraph)) {
        if (acc.length() >= chunking.getMinChars()) {
          acc = flush(acc, source, chunks);
        }
        log.trace("Heading in {}: {}", source, paragraph);
        acc = acc.withTitle(paragraph);
      } else {
        acc = acc.append(paragraph);
      }

      if (acc.length() >= chunking.getMaxChars()) {
        acc = flush(acc, source, chunks);
      }
    }
    flush(acc, source, chunks);

    log.debug("HeadingBoundaryChunker produced {} chunks for {}", chunks.size(), source);
    return chunks;
  }

  private ChunkAccumulator flush(ChunkAccumulator acc, String source, List<Chunk> chunks) {
    KnowledgeConfig.Chunking chunking = config.getChunking();
    Optional<Chunk> chunk =
        acc.flush(source, chunking.getMinChunkLength(), chunking.getDefaultTitle());
    if (chunk.isPresent()) {
      chunks.add(chunk.get());
    } else if (!acc.isEmpty()) {
      log.debug(
          "Discarded {} characters under '{}' in {}: below minimum chunk length",
          acc.length(),
          acc.title(),
          source);
    }
    return acc.reset();
  }
}
