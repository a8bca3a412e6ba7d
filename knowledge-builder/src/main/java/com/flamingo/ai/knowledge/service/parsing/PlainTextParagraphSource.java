package com.flamingo.ai.knowledge.service.parsing;

import com.flamingo.ai.knowledge.exception.DocumentProcessingException;
import com.flamingo.ai.knowledge.util.UnicodeWhitespace;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * {@link ParagraphSource} for UTF-8 text files, one paragraph per non-blank line.
 *
 * <p>Heading separators written by the conversion command ({@code === Heading ===}) are unwrapped
 * so converted text indexes the same way as the original document.
 */
@Service
@Order(10)
@Slf4j
public class PlainTextParagraphSource implements ParagraphSource {

  private static final Pattern SEPARATOR = Pattern.compile("^=== (.+) ===$");

  @Override
  public List<String> readParagraphs(Path path) {
    List<String> lines;
    try {
      lines = Files.readAllLines(path, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new DocumentProcessingException(
          path.toString(), "Failed to read text file: " + e.getMessage(), e);
    }

    List<String> paragraphs = new ArrayList<>();
    for (String line : lines) {
      String text = UnicodeWhitespace.strip(line);
      if (text.isEmpty()) {
        continue;
      }
      Matcher separator = SEPARATOR.matcher(text);
      String paragraph = separator.matches() ? UnicodeWhitespace.strip(separator.group(1)) : text;
      if (!paragraph.isEmpty()) {
        paragraphs.add(paragraph);
      }
    }
    log.debug("Read {} paragraphs from {}", paragraphs.size(), path);
    return paragraphs;
  }

  @Override
  public boolean supports(Path path) {
    return path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".txt");
  }
}
