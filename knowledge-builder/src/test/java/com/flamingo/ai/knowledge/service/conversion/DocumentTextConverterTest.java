package com.flamingo.ai.knowledge.service.conversion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.knowledge.config.KnowledgeConfig;
import com.flamingo.ai.knowledge.exception.NoInputDocumentsException;
import com.flamingo.ai.knowledge.service.chunking.ConversionHeadingClassifier;
import com.flamingo.ai.knowledge.service.parsing.ParagraphSource;
import com.flamingo.ai.knowledge.service.parsing.ParagraphSourceRouter;
import com.flamingo.ai.knowledge.service.parsing.PlainTextParagraphSource;
import com.flamingo.ai.knowledge.service.parsing.TikaParagraphSource;
import com.flamingo.ai.knowledge.util.DocxTestFiles;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.apache.tika.detect.DefaultDetector;
import org.apache.tika.parser.AutoDetectParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("DocumentTextConverter Tests")
class DocumentTextConverterTest {

  @TempDir Path tempDir;

  @Mock private ParagraphSourceRouter sourceRouter;
  @Mock private ParagraphSource paragraphSource;

  private DocumentTextConverter converter;

  @BeforeEach
  void setUp() {
    KnowledgeConfig config = new KnowledgeConfig();
    converter =
        new DocumentTextConverter(sourceRouter, new ConversionHeadingClassifier(config), config);
  }

  @Test
  @DisplayName("should surround headings with separators and blank lines")
  void shouldRenderHeadingSeparators() {
    Path document = Path.of("Regelwerk.docx");
    when(sourceRouter.route(document)).thenReturn(paragraphSource);
    when(paragraphSource.readParagraphs(document))
        .thenReturn(List.of("ÜBERSICHT", "Normaler Absatz hier.", "1. Schritt eins", "Text"));

    String text = converter.toText(document);

    assertThat(text)
        .isEqualTo(
            "=== ÜBERSICHT ===\n\n"
                + "Normaler Absatz hier.\n\n"
                + "=== 1. Schritt eins ===\n\n"
                + "Text\n");
  }

  @Test
  @DisplayName("should end with a single newline when the last paragraph is a heading")
  void shouldStripTrailingSeparatorWhitespace() {
    Path document = Path.of("Kurz.docx");
    when(sourceRouter.route(document)).thenReturn(paragraphSource);
    when(paragraphSource.readParagraphs(document)).thenReturn(List.of("Absatz", "ANHANG"));

    assertThat(converter.toText(document)).isEqualTo("Absatz\n\n=== ANHANG ===\n");
  }

  @Test
  @DisplayName("should convert matching files in name order and create the output directory")
  void shouldConvertDirectory() throws IOException {
    Path in = Files.createDirectory(tempDir.resolve("in"));
    Files.writeString(in.resolve("b doc.docx"), "x");
    Files.writeString(in.resolve("a.docx"), "x");
    Files.writeString(in.resolve("ignored.txt"), "x");
    Files.createDirectory(in.resolve("folder.docx"));
    Path out = tempDir.resolve("out").resolve("nested");
    when(sourceRouter.route(any())).thenReturn(paragraphSource);
    when(paragraphSource.readParagraphs(any())).thenReturn(List.of("Inhalt"));

    List<Path> written = converter.convertDirectory(in, out);

    assertThat(written)
        .extracting(p -> p.getFileName().toString())
        .containsExactly("a.txt", "b_doc.txt");
    assertThat(Files.readString(out.resolve("b_doc.txt"), StandardCharsets.UTF_8))
        .isEqualTo("Inhalt\n");
  }

  @Test
  @DisplayName("should throw NoInputDocumentsException after creating the output directory")
  void shouldThrow_whenNoDocuments() throws IOException {
    Path in = Files.createDirectory(tempDir.resolve("empty"));
    Files.writeString(in.resolve("notes.txt"), "x");
    Path out = tempDir.resolve("out");

    assertThatThrownBy(() -> converter.convertDirectory(in, out))
        .isInstanceOf(NoInputDocumentsException.class)
        .hasMessageContaining("No .docx files found");
    assertThat(out).isDirectory();
    verifyNoInteractions(sourceRouter);
  }

  @Test
  @DisplayName("should throw NoInputDocumentsException when the input directory does not exist")
  void shouldThrow_whenInputMissing() {
    assertThatThrownBy(
            () -> converter.convertDirectory(tempDir.resolve("missing"), tempDir.resolve("out")))
        .isInstanceOf(NoInputDocumentsException.class);
  }

  @Test
  @DisplayName("should derive target names from the source file name")
  void shouldDeriveTargetFileName() {
    assertThat(DocumentTextConverter.targetFileName(Path.of("Brand Voice v2.docx")))
        .isEqualTo("Brand_Voice_v2.txt");
    assertThat(DocumentTextConverter.targetFileName(Path.of(".docx"))).isEqualTo(".docx.txt");
  }

  @Test
  @DisplayName("should convert a real DOCX file with heading separators")
  void shouldConvertRealDocx() throws IOException {
    KnowledgeConfig config = new KnowledgeConfig();
    ParagraphSourceRouter router =
        new ParagraphSourceRouter(
            List.of(
                new PlainTextParagraphSource(),
                new TikaParagraphSource(new AutoDetectParser(), new DefaultDetector())));
    DocumentTextConverter realConverter =
        new DocumentTextConverter(router, new ConversionHeadingClassifier(config), config);
    Path in = Files.createDirectory(tempDir.resolve("docs"));
    DocxTestFiles.write(
        in.resolve("Brand Voice.docx"),
        "ÜBERSICHT",
        "Normaler Absatz hier.",
        "|Zelle",
        "1. Schritt eins",
        "Text");
    Path out = tempDir.resolve("txt");

    List<Path> written = realConverter.convertDirectory(in, out);

    assertThat(written).containsExactly(out.resolve("Brand_Voice.txt"));
    assertThat(Files.readString(out.resolve("Brand_Voice.txt"), StandardCharsets.UTF_8))
        .isEqualTo(
            "=== ÜBERSICHT ===\n\n"
                + "Normaler Absatz hier.\n\n"
                + "=== 1. Schritt eins ===\n\n"
                + "Text\n");
  }
}
