package com.flamingo.ai.knowledge.service.index;

import com.flamingo.ai.knowledge.config.KnowledgeConfig;
import com.flamingo.ai.knowledge.model.Chunk;
import com.flamingo.ai.knowledge.model.IndexedChunk;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Computes per-chunk term frequencies and feeds the corpus document-frequency table.
 *
 * <p>Tokens shorter than {@code knowledge.indexing.min-token-length} are not counted. Document
 * frequency is recorded from the full term-frequency table; only afterwards is the table trimmed
 * to its {@code max-terms-per-chunk} most frequent entries. Equal counts keep the order in which
 * the tokens first occur in the chunk.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FrequencyIndexer {

  private final Tokenizer tokenizer;
  private final KnowledgeConfig config;

  /**
   * Indexes the chunks in order, recording each of them in {@code documentFrequency}.
   *
   * @param chunks chunks to index
   * @param documentFrequency table owned by the current run
   * @return indexed chunks in the same order
   */
  public List<IndexedChunk> index(List<Chunk> chunks, DocumentFrequencyTable documentFrequency) {
    List<IndexedChunk> indexed = new ArrayList<>(chunks.size());
    for (Chunk chunk : chunks) {
      Map<String, Integer> termFrequency = termFrequency(chunk.text());
      documentFrequency.recordChunk(termFrequency.keySet());
      indexed.add(IndexedChunk.of(chunk, trim(termFrequency)));
    }
    log.debug(
        "Indexed {} chunks, {} distinct terms so far", indexed.size(), documentFrequency.size());
    return indexed;
  }

  /**
   * Counts qualifying tokens of the text.
   *
   * @param text chunk text
   * @return untrimmed counts in first-occurrence order
   */
  public Map<String, Integer> termFrequency(String text) {
    int minLength = config.getIndexing().getMinTokenLength();
    Map<String, Integer> counts = new LinkedHashMap<>();
    for (String token : tokenizer.tokenize(text)) {
      if (token.codePointCount(0, token.length()) < minLength) {
        continue;
      }
      counts.merge(token, 1, Integer::sum);
    }
    return counts;
  }

  /**
   * Keeps the most frequent entries, highest count first.
   *
   * @param termFrequency untrimmed counts
   * @return at most {@code max-terms-per-chunk} entries in descending count order
   */
  public Map<String, Integer> trim(Map<String, Integer> termFrequency) {
    Map<String, Integer> trimmed = new LinkedHashMap<>();
    termFrequency.entrySet().stream()
        .sorted(Map.Entry.comparingByValue(Comparator.reverseOrder()))
        .limit(config.getIndexing().getMaxTermsPerChunk())
        .forEachOrdered(e -> trimmed.put(e.getKey(), e.getValue()));
    return trimmed;
  }
}
