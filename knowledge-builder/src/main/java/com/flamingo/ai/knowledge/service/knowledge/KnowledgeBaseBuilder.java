package com.flamingo.ai.knowledge.service.knowledge;

import com.flamingo.ai.knowledge.model.Chunk;
import com.flamingo.ai.knowledge.model.IndexedChunk;
import com.flamingo.ai.knowledge.model.KnowledgeBase;
import com.flamingo.ai.knowledge.model.SourceDocument;
import com.flamingo.ai.knowledge.service.chunking.DocumentChunker;
import com.flamingo.ai.knowledge.service.index.DocumentFrequencyTable;
import com.flamingo.ai.knowledge.service.index.FrequencyIndexer;
import com.flamingo.ai.knowledge.service.parsing.ParagraphSourceRouter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Orchestrates a build run: read, chunk, index and assemble.
 *
 * <p>Documents are processed one after another in the given order. The run owns the collected
 * chunks and the {@link DocumentFrequencyTable}; both live only for the duration of {@link #build}.
 * Any failure aborts the whole run, so a knowledge base is either complete or not produced.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class KnowledgeBaseBuilder {

  private final ParagraphSourceRouter sourceRouter;
  private final DocumentChunker chunker;
  private final FrequencyIndexer frequencyIndexer;
  private final KnowledgeBaseAssembler assembler;
  private final MeterRegistry meterRegistry;

  /**
   * Builds the knowledge base for the given documents.
   *
   * @param documents documents with their source names, in output order
   * @return the assembled knowledge base
   */
  public KnowledgeBase build(List<SourceDocument> documents) {
    Timer.Sample sample = Timer.start(meterRegistry);
    List<Chunk> chunks = new ArrayList<>();

    for (SourceDocument document : documents) {
      List<String> paragraphs =
          sourceRouter.route(document.path()).readParagraphs(document.path());
      List<Chunk> documentChunks = chunker.chunk(paragraphs, document.name());
      chunks.addAll(documentChunks);
      meterRegistry.counter("knowledge.documents.processed").increment();
      log.info(
          "Document {} ({}) split into {} chunks from {} paragraphs",
          document.name(),
          document.path(),
          documentChunks.size(),
          paragraphs.size());
    }

    DocumentFrequencyTable documentFrequency = new DocumentFrequencyTable();
    List<IndexedChunk> indexed = frequencyIndexer.index(chunks, documentFrequency);
    KnowledgeBase knowledgeBase = assembler.assemble(indexed, documentFrequency);

    meterRegistry.counter("knowledge.chunks.emitted").increment(knowledgeBase.chunkCount());
    long nanos = sample.stop(meterRegistry.timer("knowledge.build"));
    log.info(
        "Knowledge base built: {} documents, {} chunks, {} terms in {} ms",
        documents.size(),
        knowledgeBase.chunkCount(),
        knowledgeBase.documentFrequency().size(),
        nanos / 1_000_000);
    return knowledgeBase;
  }
}
