package com.flamingo.ai.ragindex.service.rag.chunking;

import com.flamingo.ai.ragindex.config.RagConfig;
import com.google.common.annotations.VisibleForTesting;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * {@link DocumentChunker} that cuts at the last sentence boundary before the size limit.
 *
 * <p>A segment ends at the last {@code .}, {@code !} or {@code ?} followed by whitespace, or the
 * last newline, found inside the look-back window that ends at the size limit. Without one it ends
 * at the last word boundary. A single word longer than the limit is cut hard.
 *
 * <p>With overlap enabled the next segment starts up to {@code overlap} characters before the
 * previous cut, moved forward to the next word start so that no word is split by the overlap.
 */
@Component
@Slf4j
public class BoundaryAwareChunker implements DocumentChunker {

  @Override
  public List<String> chunk(String text, RagConfig.Chunking settings) {
    if (text == null || text.isBlank()) {
      return List.of();
    }

    int maxChars = Math.max(1, settings.maxChars());
    int overlap = Math.max(0, Math.min(settings.overlapChars(), maxChars - 1));
    int lookBack = Math.max(0, settings.getLookBack());
    int length = text.length();

    List<String> segments = new ArrayList<>();
    int pos = skipWhitespace(text, 0);
    while (pos < length) {
      if (length - pos <= maxChars) {
        addSegment(segments, text.substring(pos));
        break;
      }

      int cut = findCut(text, pos, maxChars, lookBack);
      addSegment(segments, text.substring(pos, cut));

      int next = cut;
      if (overlap > 0 && cut - overlap > pos) {
        next = cut - overlap;
        while (next < cut && !isWordStart(text, next)) {
          next++;
        }
      }
      pos = skipWhitespace(text, next);
    }

    log.debug(
        "Chunked {} chars into {} segments (max={}, overlap={})",
        length,
        segments.size(),
        maxChars,
        overlap);
    return segments;
  }

  /**
   * Returns the exclusive end of the segment starting at {@code pos}. Requires {@code pos +
   * maxChars < text.length()}.
   */
  @VisibleForTesting
  static int findCut(String text, int pos, int maxChars, int lookBack) {
    int end = pos + maxChars;

    int windowStart = Math.max(pos, end - lookBack);
    for (int i = end - 1; i >= windowStart; i--) {
      char c = text.charAt(i);
      if (c == '\n') {
        return i + 1;
      }
      if ((c == '.' || c == '!' || c == '?') && Character.isWhitespace(text.charAt(i + 1))) {
        return i + 1;
      }
    }

    for (int i = end; i > pos; i--) {
      if (Character.isWhitespace(text.charAt(i))) {
        return i;
      }
    }

    return end;
  }

  private static void addSegment(List<String> segments, String raw) {
    String segment = raw.strip();
    if (!segment.isEmpty()) {
      segments.add(segment);
    }
  }

  private static boolean isWordStart(String text, int i) {
    return !Character.isWhitespace(text.charAt(i))
        && (i == 0 || Character.isWhitespace(text.charAt(i - 1)));
  }

  private static int skipWhitespace(String text, int from) {
    int i = from;
    while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
      i++;
    }
    return i;
  }
}
