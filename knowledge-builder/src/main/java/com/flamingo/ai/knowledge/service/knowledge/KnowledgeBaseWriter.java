package com.flamingo.ai.knowledge.service.knowledge;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.knowledge.exception.OutputWriteException;
import com.flamingo.ai.knowledge.model.KnowledgeBase;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Writes a {@link KnowledgeBase} as UTF-8 JSON.
 *
 * <p>Non-ASCII characters are written literally. The JSON goes to a temporary file next to the
 * target which is then moved over it, so the target never holds a partial knowledge base.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class KnowledgeBaseWriter {

  private final ObjectMapper objectMapper;

  public void write(KnowledgeBase knowledgeBase, Path target) {
    Path absolute = target.toAbsolutePath();
    Path temp = null;
    try {
      temp = Files.createTempFile(absolute.getParent(), absolute.getFileName() + ".", ".tmp");
      try (Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
        objectMapper.writeValue(writer, knowledgeBase);
      }
      moveIntoPlace(temp, absolute);
      log.debug("Wrote knowledge base with {} chunks to {}", knowledgeBase.chunkCount(), absolute);
    } catch (IOException e) {
      deleteTemp(temp, e);
      throw new OutputWriteException(absolute, e);
    }
  }

  private void moveIntoPlace(Path temp, Path target) throws IOException {
    try {
      Files.move(
          temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private void deleteTemp(Path temp, IOException failure) {
    if (temp == null) {
      return;
    }
    try {
      Files.deleteIfExists(temp);
    } catch (IOException e) {
      failure.addSuppressed(e);
    }
  }
}
