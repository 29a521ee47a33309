package com.flamingo.ai.ragindex.service.rag.parsing;

import com.flamingo.ai.ragindex.exception.UnsupportedDocumentKindException;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.CharMatcher;
import java.io.IOException;
import java.io.InputStream;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.Tika;
import org.apache.tika.io.TikaInputStream;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;

/**
 * Turns uploaded documents into single-line plain text.
 *
 * <p>The document kind comes from the declared MIME type or file name. When neither identifies a
 * supported format, the content is sniffed with Tika. Extracted text has control characters removed
 * and every whitespace run collapsed to one space, with no leading or trailing whitespace.
 */
@Service
@Slf4j
public class TextNormalizer {

  private static final CharMatcher NOISE =
      CharMatcher.javaIsoControl()
          .and(CharMatcher.whitespace().negate())
          .or(CharMatcher.is('\uFFFD'));

  private final Map<DocumentKind, DocumentTextExtractor> extractors =
      new EnumMap<>(DocumentKind.class);
  private final Tika tika = new Tika();

  public TextNormalizer(List<DocumentTextExtractor> extractors) {
    for (DocumentTextExtractor extractor : extractors) {
      this.extractors.put(extractor.kind(), extractor);
    }
  }

  /**
   * Extracts and normalizes the text of a document.
   *
   * @param source the document bytes and declared type
   * @return the resolved kind and the normalized text, possibly empty
   * @throws UnsupportedDocumentKindException if the type is not PDF, Word or plain text
   * @throws com.flamingo.ai.ragindex.exception.ExtractionFailedException if parsing fails
   */
  public NormalizedText normalize(DocumentSource source) {
    DocumentKind kind = resolveKind(source);
    DocumentTextExtractor extractor = extractors.get(kind);
    if (extractor == null) {
      throw new UnsupportedDocumentKindException(kind.name());
    }

    String text = normalizeText(extractor.extract(source.content()));
    log.debug("Normalized {} document '{}' to {} chars", kind, source.fileName(), text.length());
    return new NormalizedText(kind, text);
  }

  /**
   * Normalizes text that is already extracted.
   *
   * @param raw raw text, may be null
   * @return text with control characters removed and whitespace collapsed
   */
  public String normalizeText(String raw) {
    if (raw == null || raw.isEmpty()) {
      return "";
    }
    return CharMatcher.whitespace().trimAndCollapseFrom(NOISE.removeFrom(raw), ' ');
  }

  @VisibleForTesting
  DocumentKind resolveKind(DocumentSource source) {
    String declared = source.mimeType();
    if (declared != null && !isGeneric(declared)) {
      Optional<DocumentKind> kind = DocumentKind.fromMimeType(declared, source.fileName());
      if (kind.isPresent()) {
        return kind.get();
      }
    } else if (source.fileName() != null) {
      Optional<DocumentKind> kind = DocumentKind.fromMimeType(null, source.fileName());
      if (kind.isPresent()) {
        return kind.get();
      }
    }

    String detected = detect(source);
    return DocumentKind.fromMimeType(detected, source.fileName())
        .orElseThrow(
            () -> new UnsupportedDocumentKindException(declared != null ? declared : detected));
  }

  private String detect(DocumentSource source) {
    Metadata metadata = new Metadata();
    if (source.fileName() != null) {
      metadata.set(TikaCoreProperties.RESOURCE_NAME_KEY, source.fileName());
    }
    try (InputStream in = TikaInputStream.get(source.content())) {
      String detected = tika.detect(in, metadata);
      log.debug("Detected content type {} for '{}'", detected, source.fileName());
      return detected;
    } catch (IOException e) {
      log.warn("Content type detection failed for '{}': {}", source.fileName(), e.getMessage());
      return MediaType.APPLICATION_OCTET_STREAM_VALUE;
    }
  }

  private static boolean isGeneric(String mimeType) {
    return mimeType.isBlank() || mimeType.startsWith(MediaType.APPLICATION_OCTET_STREAM_VALUE);
  }
}
