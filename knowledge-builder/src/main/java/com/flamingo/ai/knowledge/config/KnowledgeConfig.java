package com.flamingo.ai.knowledge.config;

import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the chunking and indexing pipeline. */
@Configuration
@ConfigurationProperties(prefix = "knowledge")
@Getter
@Setter
public class KnowledgeConfig {

  private Chunking chunking = new Chunking();
  private Headings headings = new Headings();
  private Indexing indexing = new Indexing();
  private Conversion conversion = new Conversion();

  @Getter
  @Setter
  public static class Chunking {
    /** Accumulated length that forces a flush regardless of headings. */
    private int maxChars = 1400;

    /** Accumulated length a heading needs to see before it closes the running chunk. */
    private int minChars = 350;

    /** Flushed text shorter than this is dropped. */
    private int minChunkLength = 120;

    /** Title used for chunks that no heading preceded. */
    private String defaultTitle = "Section";
  }

  /** Section heading rules used while chunking. */
  @Getter
  @Setter
  public static class Headings {
    private int maxLength = 120;

    /** Keywords that open a named part, e.g. {@code TEIL A}. */
    private List<String> partMarkers = new ArrayList<>(List.of("TEIL", "PART"));

    /** Words that follow a step number, e.g. {@code 3. Schritt}. */
    private List<String> stepWords = new ArrayList<>(List.of("Schritt", "Step"));

    /** Minimum run of uppercase characters that counts as an emphasized heading. */
    private int emphasisMinLength = 7;
  }

  @Getter
  @Setter
  public static class Indexing {
    private int minTokenLength = 3;
    private int maxTermsPerChunk = 250;
  }

  /** Settings for the document-to-text conversion command. */
  @Getter
  @Setter
  public static class Conversion {
    private String extension = ".docx";
    private int maxHeadingLength = 80;
    private List<String> headingPrefixes =
        new ArrayList<>(List.of("Step", "Schritt", "0.", "1.", "2.", "3."));
  }
}
