package com.flamingo.ai.ragindex.service.rag.parsing;

import com.flamingo.ai.ragindex.exception.ExtractionFailedException;
import java.io.IOException;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Service;

/** {@link DocumentTextExtractor} for PDF documents, using Apache PDFBox 3.x. */
@Service
@Slf4j
public class PdfBoxTextExtractor implements DocumentTextExtractor {

  @Override
  public DocumentKind kind() {
    return DocumentKind.PDF;
  }

  @Override
  public String extract(byte[] content) {
    try (PDDocument pdfDoc = Loader.loadPDF(content)) {
      PDFTextStripper stripper = new PDFTextStripper();
      stripper.setPageEnd("\n");
      String text = stripper.getText(pdfDoc);
      log.debug(
          "PDFBox extracted {} chars from {} pages", text.length(), pdfDoc.getNumberOfPages());
      return text;
    } catch (IOException | RuntimeException e) {
      log.warn("PDFBox parsing failed: {}", e.getMessage());
      throw new ExtractionFailedException(DocumentKind.PDF, e.getMessage(), e);
    }
  }
}
