package com.flamingo.ai.ragindex.service.rag.parsing;

/**
 * Result of text normalization.
 *
 * @param kind the kind the document was read as
 * @param text plain text with whitespace collapsed to single spaces
 */
public record NormalizedText(DocumentKind kind, String text) {}
