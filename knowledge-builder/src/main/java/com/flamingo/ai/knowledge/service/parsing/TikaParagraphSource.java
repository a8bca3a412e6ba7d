package com.flamingo.ai.knowledge.service.parsing;

import com.flamingo.ai.knowledge.exception.DocumentProcessingException;
import com.flamingo.ai.knowledge.exception.ParserUnavailableException;
import com.flamingo.ai.knowledge.util.UnicodeWhitespace;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.detect.Detector;
import org.apache.tika.exception.TikaException;
import org.apache.tika.io.TikaInputStream;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.mime.MediaType;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.parser.Parser;
import org.apache.tika.sax.ToXMLContentHandler;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

/**
 * {@link ParagraphSource} for Office documents (DOCX first of all, but any format the Tika parsers
 * on the classpath understand).
 *
 * <p>Uses Apache Tika with a {@link ToXMLContentHandler} to produce an XHTML representation, then
 * walks the DOM and emits the text of every body paragraph:
 *
 * <ul>
 *   <li>{@code <p>}, {@code <h1>}–{@code <h6>} and {@code <li>} elements → one paragraph each
 *   <li>{@code <table>} elements and page header/footer blocks → skipped
 *   <li>other containers → walked recursively
 * </ul>
 *
 * <p>If no available parser handles the detected media type the source fails fast with a {@link
 * ParserUnavailableException}.
 */
@Service
@Order(100)
@RequiredArgsConstructor
@Slf4j
public class TikaParagraphSource implements ParagraphSource {

  private static final Set<String> SKIPPED_TAGS = Set.of("head", "table", "script", "style");
  private static final Set<String> SKIPPED_CLASSES = Set.of("header", "footer");

  private final Parser tikaParser;
  private final Detector tikaDetector;

  @Override
  public List<String> readParagraphs(Path path) {
    Metadata metadata = new Metadata();
    metadata.set(TikaCoreProperties.RESOURCE_NAME_KEY, path.getFileName().toString());

    byte[] xhtmlBytes;
    try (InputStream in = TikaInputStream.get(path, metadata)) {
      MediaType mediaType = tikaDetector.detect(in, metadata);
      ensureSupported(mediaType);
      xhtmlBytes = toXhtml(in, metadata);
    } catch (IOException | SAXException | TikaException e) {
      log.error("Tika extraction failed for {}: {}", path, e.getMessage());
      throw new DocumentProcessingException(
          path.toString(), "Failed to parse document: " + e.getMessage(), e);
    }

    try {
      List<String> paragraphs = paragraphsFromXhtml(xhtmlBytes);
      log.debug("Extracted {} paragraphs from {}", paragraphs.size(), path);
      return paragraphs;
    } catch (ParserConfigurationException | SAXException | IOException e) {
      throw new DocumentProcessingException(
          path.toString(), "Failed to read extracted XHTML: " + e.getMessage(), e);
    }
  }

  @Override
  public boolean supports(Path path) {
    // Catch-all; unsupported formats surface as ParserUnavailableException on read
    return true;
  }

  // ---- private helpers ----

  private void ensureSupported(MediaType mediaType) {
    Set<MediaType> supported = tikaParser.getSupportedTypes(new ParseContext());
    if (!supported.contains(mediaType) && !supported.contains(mediaType.getBaseType())) {
      throw new ParserUnavailableException(mediaType.toString());
    }
  }

  private byte[] toXhtml(InputStream in, Metadata metadata)
      throws IOException, SAXException, TikaException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    ToXMLContentHandler handler = new ToXMLContentHandler(out, StandardCharsets.UTF_8.name());
    tikaParser.parse(in, handler, metadata, new ParseContext());
    return out.toByteArray();
  }

  List<String> paragraphsFromXhtml(byte[] xhtmlBytes)
      throws ParserConfigurationException, SAXException, IOException {
    DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
    dbf.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
    dbf.setNamespaceAware(true);
    org.w3c.dom.Document dom = dbf.newDocumentBuilder().parse(new ByteArrayInputStream(xhtmlBytes));
    dom.getDocumentElement().normalize();

    List<String> paragraphs = new ArrayList<>();
    walk(dom.getDocumentElement(), paragraphs);
    return paragraphs;
  }

  private void walk(Element root, List<String> paragraphs) {
    NodeList children = root.getChildNodes();
    for (int i = 0; i < children.getLength(); i++) {
      Node child = children.item(i);
      if (child.getNodeType() != Node.ELEMENT_NODE) {
        continue;
      }
      Element el = (Element) child;
      String tag = el.getLocalName() != null ? el.getLocalName() : el.getTagName();
      tag = tag.toLowerCase(Locale.ROOT);

      if (SKIPPED_TAGS.contains(tag) || SKIPPED_CLASSES.contains(el.getAttribute("class"))) {
        continue;
      }
      if ("p".equals(tag) || "li".equals(tag) || tag.matches("h[1-6]")) {
        String text = UnicodeWhitespace.strip(el.getTextContent());
        if (!text.isEmpty()) {
          paragraphs.add(text);
        }
      } else {
        // Recurse into other block elements (html, body, div, ul, …)
        walk(el, paragraphs);
      }
    }
  }
}
