package com.flamingo.ai.ragindex.api.rest;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.ragindex.exception.ExtractionFailedException;
import com.flamingo.ai.ragindex.exception.GlobalExceptionHandler;
import com.flamingo.ai.ragindex.exception.UnsupportedDocumentKindException;
import com.flamingo.ai.ragindex.service.rag.IndexingOrchestrator;
import com.flamingo.ai.ragindex.service.rag.model.IngestionReport;
import com.flamingo.ai.ragindex.service.rag.parsing.DocumentKind;
import com.flamingo.ai.ragindex.service.rag.parsing.DocumentSource;
import com.flamingo.ai.ragindex.service.rag.parsing.NormalizedText;
import com.flamingo.ai.ragindex.service.rag.parsing.TextNormalizer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@DisplayName("DocumentController Tests")
class DocumentControllerTest {

  @Mock private TextNormalizer textNormalizer;
  @Mock private IndexingOrchestrator indexingOrchestrator;

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    DocumentController controller =
        new DocumentController(textNormalizer, indexingOrchestrator, new ObjectMapper());
    mockMvc =
        MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new GlobalExceptionHandler(new SimpleMeterRegistry()))
            .build();
  }

  @Test
  @DisplayName("Should extract normalized text")
  void shouldExtractText() throws Exception {
    when(textNormalizer.normalize(any(DocumentSource.class)))
        .thenReturn(new NormalizedText(DocumentKind.PLAIN_TEXT, "hello world"));

    mockMvc
        .perform(multipart("/extract").file(textFile("hello\n\nworld")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.kind").value("PLAIN_TEXT"))
        .andExpect(jsonPath("$.text").value("hello world"));
  }

  @Test
  @DisplayName("Should map an unsupported upload to 415")
  void shouldRejectUnsupportedKind() throws Exception {
    when(textNormalizer.normalize(any(DocumentSource.class)))
        .thenThrow(new UnsupportedDocumentKindException("image/png"));

    mockMvc
        .perform(
            multipart("/extract")
                .file(new MockMultipartFile("file", "a.png", "image/png", new byte[] {1, 2})))
        .andExpect(status().isUnsupportedMediaType())
        .andExpect(jsonPath("$.code").value("DOCUMENT_001"));
  }

  @Test
  @DisplayName("Should map a parser failure to 422 with the diagnostic")
  void shouldReportExtractionFailure() throws Exception {
    when(textNormalizer.normalize(any(DocumentSource.class)))
        .thenThrow(new ExtractionFailedException(DocumentKind.PDF, "Header not found", null));

    mockMvc
        .perform(multipart("/extract").file(textFile("x")))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.code").value("DOCUMENT_002"));
  }

  @Test
  @DisplayName("Should ingest an uploaded document with JSON metadata")
  void shouldIngestDocument() throws Exception {
    when(indexingOrchestrator.ingest(
            eq("doc-1"), any(DocumentSource.class), eq(Map.of("lang", "en")), eq("ns")))
        .thenReturn(
            new IngestionReport("ns", "doc-1", DocumentKind.PLAIN_TEXT, List.of("doc-1#0"), 11));

    mockMvc
        .perform(
            multipart("/documents")
                .file(textFile("hello world"))
                .param("documentId", "doc-1")
                .param("namespace", "ns")
                .param("metadata", "{\"lang\": \"en\"}"))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.ok").value(true))
        .andExpect(jsonPath("$.document_id").value("doc-1"))
        .andExpect(jsonPath("$.count").value(1))
        .andExpect(jsonPath("$.ids[0]").value("doc-1#0"));
  }

  @Test
  @DisplayName("Should reject metadata that is not a JSON object")
  void shouldRejectBadMetadata() throws Exception {
    mockMvc
        .perform(
            multipart("/documents")
                .file(textFile("hello"))
                .param("documentId", "doc-1")
                .param("metadata", "not json"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_002"));

    verifyNoInteractions(indexingOrchestrator);
  }

  @Test
  @DisplayName("Should require a document id for uploads")
  void shouldRequireDocumentId() throws Exception {
    mockMvc
        .perform(multipart("/documents").file(textFile("hello")))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_001"));
  }

  @Test
  @DisplayName("Should ingest raw text")
  void shouldIngestText() throws Exception {
    when(indexingOrchestrator.ingestText(eq("doc-2"), eq("Some text."), isNull(), isNull()))
        .thenReturn(
            new IngestionReport(
                "default", "doc-2", DocumentKind.PLAIN_TEXT, List.of("doc-2#0"), 10));

    mockMvc
        .perform(
            post("/documents/text")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"document_id\": \"doc-2\", \"text\": \"Some text.\"}"))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.namespace").value("default"))
        .andExpect(jsonPath("$.kind").value("PLAIN_TEXT"));
  }

  private static MockMultipartFile textFile(String content) {
    return new MockMultipartFile(
        "file", "notes.txt", "text/plain", content.getBytes(StandardCharsets.UTF_8));
  }
}
