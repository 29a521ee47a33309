package com.flamingo.ai.ragindex.service.rag;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.ragindex.config.RagConfig;
import com.flamingo.ai.ragindex.service.rag.chunking.BoundaryAwareChunker;
import com.flamingo.ai.ragindex.service.rag.embedding.DimensionContract;
import com.flamingo.ai.ragindex.service.rag.embedding.EmbeddingService;
import com.flamingo.ai.ragindex.service.rag.embedding.HashingEmbeddingProvider;
import com.flamingo.ai.ragindex.service.rag.model.IngestionReport;
import com.flamingo.ai.ragindex.service.rag.model.QueryRequest;
import com.flamingo.ai.ragindex.service.rag.model.QueryResult;
import com.flamingo.ai.ragindex.service.rag.parsing.DocumentFixtures;
import com.flamingo.ai.ragindex.service.rag.parsing.DocumentKind;
import com.flamingo.ai.ragindex.service.rag.parsing.DocumentSource;
import com.flamingo.ai.ragindex.service.rag.parsing.OoxmlTextExtractor;
import com.flamingo.ai.ragindex.service.rag.parsing.PdfBoxTextExtractor;
import com.flamingo.ai.ragindex.service.rag.parsing.PlainTextExtractor;
import com.flamingo.ai.ragindex.service.rag.parsing.TextNormalizer;
import com.flamingo.ai.ragindex.vectorstore.InMemoryVectorStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Runs documents of every supported kind through ingestion and retrieval with the offline
 * embedding provider and the in-memory store.
 */
@DisplayName("Ingest and retrieve round trip")
class IngestRetrievalRoundTripTest {

  private static final String NS = "library";

  private IndexingOrchestrator indexing;
  private RetrievalOrchestrator retrieval;

  @BeforeEach
  void setUp() {
    RagConfig ragConfig = new RagConfig();
    ragConfig.getEmbedding().setDimension(256);

    SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    DimensionContract dimensionContract = new DimensionContract(ragConfig);
    EmbeddingService embeddingService =
        new EmbeddingService(new HashingEmbeddingProvider(), dimensionContract, ragConfig);
    InMemoryVectorStore vectorStore = new InMemoryVectorStore();
    TextNormalizer textNormalizer =
        new TextNormalizer(
            List.of(new PdfBoxTextExtractor(), new OoxmlTextExtractor(), new PlainTextExtractor()));

    indexing =
        new IndexingOrchestrator(
            textNormalizer,
            new BoundaryAwareChunker(),
            embeddingService,
            dimensionContract,
            vectorStore,
            ragConfig,
            meterRegistry);
    retrieval =
        new RetrievalOrchestrator(
            embeddingService, dimensionContract, vectorStore, ragConfig, meterRegistry);
  }

  @Test
  @DisplayName("should find each document by its own vocabulary")
  void shouldRetrieveEachKind() {
    IngestionReport pdf =
        indexing.ingest(
            "volcanoes",
            new DocumentSource(
                DocumentFixtures.pdf("Volcanoes erupt magma and ash", "Lava cools into basalt"),
                "application/pdf",
                "volcanoes.pdf"),
            Map.of("source", "pdf"),
            NS);
    IngestionReport docx =
        indexing.ingest(
            "orchids",
            new DocumentSource(
                DocumentFixtures.docx(
                    "Orchids bloom in humid greenhouses.", "Petals attract bees."),
                DocumentFixtures.DOCX_MIME_TYPE,
                "orchids.docx"),
            Map.of("source", "docx"),
            NS);
    IngestionReport text =
        indexing.ingest(
            "sailing",
            new DocumentSource(
                "Sailors trim the jib and reef the mainsail in strong wind."
                    .getBytes(StandardCharsets.UTF_8),
                "text/plain",
                "sailing.txt"),
            Map.of("source", "txt"),
            NS);

    assertThat(pdf.kind()).isEqualTo(DocumentKind.PDF);
    assertThat(docx.kind()).isEqualTo(DocumentKind.DOCX);
    assertThat(text.kind()).isEqualTo(DocumentKind.PLAIN_TEXT);

    assertThat(topDocument("magma basalt lava")).isEqualTo("volcanoes");
    assertThat(topDocument("orchids petals greenhouses")).isEqualTo("orchids");
    assertThat(topDocument("jib mainsail wind")).isEqualTo("sailing");
  }

  @Test
  @DisplayName("should stop returning a document once it is deleted")
  void shouldForgetDeletedDocument() {
    indexing.ingestText("tea", "Green tea leaves are steamed and rolled.", null, NS);
    indexing.ingestText("coffee", "Coffee beans are roasted and ground.", null, NS);

    indexing.deleteByDocument("tea", NS);

    QueryResult result =
        retrieval.query(QueryRequest.builder().namespace(NS).text("green tea leaves").build());
    assertThat(result.matches())
        .extracting(match -> match.metadata().get("document_id"))
        .containsOnly("coffee");
  }

  @Test
  @DisplayName("should rank a re-ingested document by its new text only")
  void shouldRankReingestedDocumentByNewText() {
    IngestionReport first =
        indexing.ingestText("desserts", "Chocolate cake with vanilla frosting.", null, NS);
    indexing.ingestText("bakery", "Chocolate cake and vanilla frosting recipes.", null, NS);
    assertThat(topDocument("chocolate cake vanilla frosting")).isEqualTo("desserts");

    IngestionReport second =
        indexing.ingestText("desserts", "Lemon tart under meringue peaks.", null, NS);

    assertThat(second.chunkIds()).isEqualTo(first.chunkIds());
    assertThat(topDocument("lemon tart meringue peaks")).isEqualTo("desserts");
    assertThat(topDocument("chocolate cake vanilla frosting")).isEqualTo("bakery");

    QueryResult all =
        retrieval.query(
            QueryRequest.builder()
                .namespace(NS)
                .text("lemon tart")
                .filter(Map.of("document_id", "desserts"))
                .build());
    assertThat(all.matches())
        .extracting(match -> match.metadata().get("text"))
        .containsExactly("Lemon tart under meringue peaks.");
  }

  @Test
  @DisplayName("should restrict matches with a metadata filter")
  void shouldFilterByMetadata() {
    indexing.ingestText("a", "Shared words about rivers.", Map.of("lang", "en"), NS);
    indexing.ingestText("b", "Shared words about rivers.", Map.of("lang", "de"), NS);

    QueryResult result =
        retrieval.query(
            QueryRequest.builder()
                .namespace(NS)
                .text("rivers")
                .filter(Map.of("lang", Map.of("$eq", "de")))
                .build());

    assertThat(result.matches()).hasSize(1);
    assertThat(result.matches().get(0).id()).isEqualTo("b#0");
  }

  private String topDocument(String query) {
    QueryResult result =
        retrieval.query(QueryRequest.builder().namespace(NS).text(query).topK(1).build());
    return (String) result.matches().get(0).metadata().get("document_id");
  }
}
