package com.flamingo.ai.ragindex.service.rag.chunking;

import com.flamingo.ai.ragindex.config.RagConfig;
import java.util.List;

/**
 * Splits normalized text into ordered segments ready for embedding.
 *
 * <p>Implementations must be stateless and safe for concurrent use. The same input and settings
 * always produce the same segments, so a failed ingest can be re-run from the start.
 */
public interface DocumentChunker {

  /**
   * Produces segments from the text.
   *
   * @param text normalized text
   * @param settings chunk size, unit, overlap and look-back window
   * @return ordered segments, each at most {@link RagConfig.Chunking#maxChars()} long; empty for
   *     blank text
   */
  List<String> chunk(String text, RagConfig.Chunking settings);
}
