package com.flamingo.ai.knowledge.service.knowledge;

import com.flamingo.ai.knowledge.model.IndexedChunk;
import com.flamingo.ai.knowledge.model.KnowledgeBase;
import com.flamingo.ai.knowledge.service.index.DocumentFrequencyTable;
import java.util.LinkedHashMap;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Combines indexed chunks and the document-frequency table into a {@link KnowledgeBase}.
 *
 * <p>The table must have recorded exactly the given chunks.
 */
@Component
public class KnowledgeBaseAssembler {

  public KnowledgeBase assemble(
      List<IndexedChunk> chunks, DocumentFrequencyTable documentFrequency) {
    if (documentFrequency.chunkCount() != chunks.size()) {
      throw new IllegalStateException(
          "Document frequency covers "
              + documentFrequency.chunkCount()
              + " chunks but "
              + chunks.size()
              + " were indexed");
    }
    return new KnowledgeBase(
        chunks.size(), new LinkedHashMap<>(documentFrequency.asMap()), List.copyOf(chunks));
  }
}
