package com.flamingo.ai.ragindex.service.rag.parsing;

import com.flamingo.ai.ragindex.exception.ExtractionFailedException;
import java.io.IOException;
import java.io.InputStream;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.exception.TikaException;
import org.apache.tika.io.TikaInputStream;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.parser.microsoft.ooxml.OOXMLParser;
import org.apache.tika.sax.BodyContentHandler;
import org.springframework.stereotype.Service;
import org.xml.sax.SAXException;

/**
 * {@link DocumentTextExtractor} for Word documents, using Apache Tika's OOXML parser.
 *
 * <p>The OOXML parser is used directly rather than through auto-detection so that bytes which are
 * not a Word container fail instead of silently producing empty text.
 */
@Service
@Slf4j
public class OoxmlTextExtractor implements DocumentTextExtractor {

  private static final String DOCX_MIME_TYPE =
      "application/vnd.openxmlformats-officedocument.wordprocessingml.document";

  @Override
  public DocumentKind kind() {
    return DocumentKind.DOCX;
  }

  @Override
  public String extract(byte[] content) {
    // -1 disables the write limit; documents are bounded by the upload size instead
    BodyContentHandler handler = new BodyContentHandler(-1);
    Metadata metadata = new Metadata();
    metadata.set(Metadata.CONTENT_TYPE, DOCX_MIME_TYPE);
    try (InputStream in = TikaInputStream.get(content)) {
      new OOXMLParser().parse(in, handler, metadata, new ParseContext());
    } catch (IOException | SAXException | TikaException | RuntimeException e) {
      log.warn("Tika OOXML parsing failed: {}", e.getMessage());
      throw new ExtractionFailedException(DocumentKind.DOCX, e.getMessage(), e);
    }
    return handler.toString();
  }
}
