package com.flamingo.ai.ragindex.service.rag.parsing;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** {@link DocumentTextExtractor} for plain text: UTF-8 with undecodable bytes dropped. */
@Service
@Slf4j
public class PlainTextExtractor implements DocumentTextExtractor {

  @Override
  public DocumentKind kind() {
    return DocumentKind.PLAIN_TEXT;
  }

  @Override
  public String extract(byte[] content) {
    try {
      return StandardCharsets.UTF_8
          .newDecoder()
          .onMalformedInput(CodingErrorAction.IGNORE)
          .onUnmappableCharacter(CodingErrorAction.IGNORE)
          .decode(ByteBuffer.wrap(content))
          .toString();
    } catch (CharacterCodingException e) {
      log.debug("UTF-8 decoding failed, falling back to ISO-8859-1: {}", e.getMessage());
      return new String(content, StandardCharsets.ISO_8859_1);
    }
  }
}
