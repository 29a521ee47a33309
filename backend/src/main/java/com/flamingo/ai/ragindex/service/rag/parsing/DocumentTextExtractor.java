package com.flamingo.ai.ragindex.service.rag.parsing;

import com.flamingo.ai.ragindex.exception.ExtractionFailedException;

/**
 * Extracts the raw text of one document format.
 *
 * <p>Implementations are stateless and shared across request threads. They return the text as the
 * parser produced it; whitespace normalization is left to {@link TextNormalizer}.
 */
public interface DocumentTextExtractor {

  /**
   * Returns the format this extractor reads.
   *
   * @return the document kind
   */
  DocumentKind kind();

  /**
   * Extracts all text of the document.
   *
   * @param content raw document bytes
   * @return the extracted text, never null
   * @throws ExtractionFailedException if the bytes cannot be parsed as {@link #kind()}
   */
  String extract(byte[] content);
}
