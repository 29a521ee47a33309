package com.flamingo.ai.ragindex.service.rag.parsing;

/**
 * Raw bytes of an uploaded document together with what the client said about them.
 *
 * @param content the document bytes
 * @param mimeType declared MIME type; null or {@code application/octet-stream} when unknown
 * @param fileName original file name, may be null
 */
public record DocumentSource(byte[] content, String mimeType, String fileName) {

  public DocumentSource {
    content = content == null ? new byte[0] : content;
  }
}
