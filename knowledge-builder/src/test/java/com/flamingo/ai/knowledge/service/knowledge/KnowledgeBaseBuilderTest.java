package com.flamingo.ai.knowledge.service.knowledge;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.knowledge.config.KnowledgeConfig;
import com.flamingo.ai.knowledge.exception.DocumentProcessingException;
import com.flamingo.ai.knowledge.model.IndexedChunk;
import com.flamingo.ai.knowledge.model.KnowledgeBase;
import com.flamingo.ai.knowledge.model.SourceDocument;
import com.flamingo.ai.knowledge.service.chunking.HeadingBoundaryChunker;
import com.flamingo.ai.knowledge.service.chunking.SectionHeadingClassifier;
import com.flamingo.ai.knowledge.service.index.FrequencyIndexer;
import com.flamingo.ai.knowledge.service.index.Tokenizer;
import com.flamingo.ai.knowledge.service.parsing.ParagraphSource;
import com.flamingo.ai.knowledge.service.parsing.ParagraphSourceRouter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("KnowledgeBaseBuilder Tests")
class KnowledgeBaseBuilderTest {

  private static final Path REGELWERK = Path.of("Regelwerk.docx");
  private static final Path BRANDVOICE = Path.of("Brandvoice.docx");

  @Mock private ParagraphSourceRouter sourceRouter;
  @Mock private ParagraphSource paragraphSource;

  private SimpleMeterRegistry meterRegistry;
  private KnowledgeBaseBuilder builder;

  @BeforeEach
  void setUp() {
    KnowledgeConfig config = new KnowledgeConfig();
    meterRegistry = new SimpleMeterRegistry();
    builder =
        new KnowledgeBaseBuilder(
            sourceRouter,
            new HeadingBoundaryChunker(new SectionHeadingClassifier(config), config),
            new FrequencyIndexer(new Tokenizer(), config),
            new KnowledgeBaseAssembler(),
            meterRegistry);
  }

  private static String sentence(String word, int repeat) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < repeat; i++) {
      sb.append(word).append(i % 7 == 6 ? ". " : " ");
    }
    return sb.toString().strip();
  }

  @Test
  @DisplayName("should tag chunks with source names and keep document order")
  void shouldTagChunksWithSourceNames() {
    when(sourceRouter.route(any())).thenReturn(paragraphSource);
    when(paragraphSource.readParagraphs(REGELWERK))
        .thenReturn(List.of("TEIL A Grundlagen", sentence("regel", 60)));
    when(paragraphSource.readParagraphs(BRANDVOICE))
        .thenReturn(List.of("1. Schritt Ton", sentence("stimme", 60)));

    KnowledgeBase kb =
        builder.build(
            List.of(
                new SourceDocument(REGELWERK, "regelwerk"),
                new SourceDocument(BRANDVOICE, "brandvoice")));

    assertThat(kb.chunkCount()).isEqualTo(2).isEqualTo(kb.chunks().size());
    assertThat(kb.chunks())
        .extracting(IndexedChunk::source, IndexedChunk::title)
        .containsExactly(
            tuple("regelwerk", "TEIL A Grundlagen"),
            tuple("brandvoice", "1. Schritt Ton"));
    assertThat(kb.documentFrequency()).containsEntry("regel", 1).containsEntry("stimme", 1);
    assertThat(kb.chunks().get(0).termFrequency()).containsEntry("regel", 60);
  }

  @Test
  @DisplayName("should compute document frequency across all documents")
  void shouldComputeDocumentFrequencyAcrossDocuments() {
    when(sourceRouter.route(any())).thenReturn(paragraphSource);
    when(paragraphSource.readParagraphs(REGELWERK))
        .thenReturn(List.of(sentence("marke", 30) + " " + sentence("regel", 30)));
    when(paragraphSource.readParagraphs(BRANDVOICE))
        .thenReturn(List.of(sentence("marke", 30) + " " + sentence("stimme", 30)));

    KnowledgeBase kb =
        builder.build(
            List.of(
                new SourceDocument(REGELWERK, "regelwerk"),
                new SourceDocument(BRANDVOICE, "brandvoice")));

    assertThat(kb.documentFrequency())
        .containsEntry("marke", 2)
        .containsEntry("regel", 1)
        .containsEntry("stimme", 1);
    assertThat(kb.chunks()).extracting(IndexedChunk::title).containsOnly("Section");
  }

  @Test
  @DisplayName("should record processing metrics")
  void shouldRecordMetrics() {
    when(sourceRouter.route(any())).thenReturn(paragraphSource);
    when(paragraphSource.readParagraphs(any())).thenReturn(List.of(sentence("regel", 60)));

    builder.build(
        List.of(
            new SourceDocument(REGELWERK, "regelwerk"),
            new SourceDocument(BRANDVOICE, "brandvoice")));

    assertThat(meterRegistry.counter("knowledge.documents.processed").count()).isEqualTo(2.0);
    assertThat(meterRegistry.counter("knowledge.chunks.emitted").count()).isEqualTo(2.0);
    assertThat(meterRegistry.timer("knowledge.build").count()).isEqualTo(1);
  }

  @Test
  @DisplayName("should produce an empty knowledge base when no chunk reaches the minimum length")
  void shouldProduceEmptyKnowledgeBase_whenAllTextTooShort() {
    when(sourceRouter.route(any())).thenReturn(paragraphSource);
    when(paragraphSource.readParagraphs(any())).thenReturn(List.of("kurz", "auch kurz"));

    KnowledgeBase kb =
        builder.build(
            List.of(
                new SourceDocument(REGELWERK, "regelwerk"),
                new SourceDocument(BRANDVOICE, "brandvoice")));

    assertThat(kb.chunkCount()).isZero();
    assertThat(kb.chunks()).isEmpty();
    assertThat(kb.documentFrequency()).isEmpty();
  }

  @Test
  @DisplayName("should abort the run when a document cannot be read")
  void shouldAbortRun_whenDocumentFails() {
    when(sourceRouter.route(any())).thenReturn(paragraphSource);
    when(paragraphSource.readParagraphs(REGELWERK))
        .thenThrow(new DocumentProcessingException("Regelwerk.docx", "corrupt"));

    assertThatThrownBy(
            () ->
                builder.build(
                    List.of(
                        new SourceDocument(REGELWERK, "regelwerk"),
                        new SourceDocument(BRANDVOICE, "brandvoice"))))
        .isInstanceOf(DocumentProcessingException.class)
        .hasMessage("corrupt");

    verify(paragraphSource).readParagraphs(REGELWERK);
    assertThat(meterRegistry.counter("knowledge.documents.processed").count()).isZero();
  }
}
