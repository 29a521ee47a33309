package com.flamingo.ai.ragindex.service.rag.parsing;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/** Document formats the service can turn into text. */
public enum DocumentKind {
  PDF,
  DOCX,
  PLAIN_TEXT;

  /** Office formats that share a container or a MIME prefix with Word but are not supported. */
  private static final List<String> OTHER_OFFICE_FORMATS =
      List.of("spreadsheetml", "presentationml", "ms-excel", "ms-powerpoint", "opendocument");

  /**
   * Maps a declared MIME type, falling back to the file name, to a document kind.
   *
   * <p>Matching is by substring so that parameters ({@code text/plain; charset=utf-8}) and vendor
   * variants ({@code application/msword}) resolve as well. Spreadsheets, presentations and
   * OpenDocument files never resolve, whatever the file name says.
   *
   * @param mimeType declared or detected MIME type, may be null
   * @param fileName original file name, may be null
   * @return the kind, or empty when neither value identifies a supported format
   */
  public static Optional<DocumentKind> fromMimeType(String mimeType, String fileName) {
    String mime = mimeType == null ? "" : mimeType.toLowerCase(Locale.ROOT);
    String name = fileName == null ? "" : fileName.toLowerCase(Locale.ROOT);

    if (OTHER_OFFICE_FORMATS.stream().anyMatch(mime::contains)) {
      return Optional.empty();
    }
    if (mime.contains("pdf")) {
      return Optional.of(PDF);
    }
    if (mime.contains("wordprocessingml") || mime.contains("msword") || mime.contains("ms-word")) {
      return Optional.of(DOCX);
    }
    if (mime.contains("text") || name.endsWith(".txt")) {
      return Optional.of(PLAIN_TEXT);
    }
    return Optional.empty();
  }
}
