package com.flamingo.ai.ragindex.elasticsearch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.ErrorCause;
import co.elastic.clients.elasticsearch._types.KnnSearch;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.query_dsl.BoolQuery;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.bulk.BulkResponseItem;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.core.search.HitsMetadata;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import co.elastic.clients.elasticsearch.indices.ElasticsearchIndicesClient;
import co.elastic.clients.elasticsearch.indices.ExistsRequest;
import co.elastic.clients.elasticsearch.indices.GetMappingRequest;
import co.elastic.clients.elasticsearch.indices.GetMappingResponse;
import co.elastic.clients.elasticsearch.indices.get_mapping.IndexMappingRecord;
import co.elastic.clients.transport.endpoints.BooleanResponse;
import com.flamingo.ai.ragindex.config.RagConfig;
import com.flamingo.ai.ragindex.exception.StoreException;
import com.flamingo.ai.ragindex.vectorstore.MetadataFilter;
import com.flamingo.ai.ragindex.vectorstore.QueryMatch;
import com.flamingo.ai.ragindex.vectorstore.VectorRecord;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("ElasticsearchVectorStore Tests")
@SuppressWarnings({"rawtypes", "unchecked"})
class ElasticsearchVectorStoreTest {

  @Mock private ElasticsearchClient elasticsearchClient;
  @Mock private ElasticsearchIndicesClient indicesClient;
  @Mock private GetMappingResponse mappingResponse;
  @Mock private SearchResponse<Map> searchResponse;
  @Mock private HitsMetadata<Map> hitsMetadata;
  @Mock private BulkResponse bulkResponse;

  private ElasticsearchVectorStore store;

  @BeforeEach
  void setUp() {
    RagConfig ragConfig = new RagConfig();
    ragConfig.getEmbedding().setDimension(3);
    store = new ElasticsearchVectorStore(elasticsearchClient, ragConfig, new SimpleMeterRegistry());
  }

  @Nested
  @DisplayName("Index initialization")
  class IndexInitialization {

    @Test
    @DisplayName("should skip initialization when the client has no indices API")
    void shouldSkip_whenIndicesUnavailable() {
      when(elasticsearchClient.indices()).thenReturn(null);

      store.initIndex();

      verify(elasticsearchClient).indices();
    }

    @Test
    @DisplayName("should create the index with a length-capped metadata mapping")
    void shouldCreateIndex() throws Exception {
      when(elasticsearchClient.indices()).thenReturn(indicesClient);
      when(indicesClient.exists(any(ExistsRequest.class))).thenReturn(new BooleanResponse(false));

      store.initIndex();

      ArgumentCaptor<CreateIndexRequest> captor = ArgumentCaptor.forClass(CreateIndexRequest.class);
      verify(indicesClient).create(captor.capture());
      Map<String, Property> properties = captor.getValue().mappings().properties();
      assertThat(properties).containsKeys("namespace", "record_id", "embedding", "metadata");
      assertThat(properties.get("embedding").denseVector().dims()).isEqualTo(3);
      assertThat(properties.get("metadata").isFlattened()).isTrue();
      assertThat(properties.get("metadata").flattened().ignoreAbove())
          .isEqualTo(ElasticsearchVectorStore.METADATA_IGNORE_ABOVE);
    }

    @Test
    @DisplayName("should refuse an existing index with another dimension")
    void shouldFail_whenExistingDimensionDiffers() throws Exception {
      when(elasticsearchClient.indices()).thenReturn(indicesClient);
      when(indicesClient.exists(any(ExistsRequest.class))).thenReturn(new BooleanResponse(true));
      when(indicesClient.getMapping(any(GetMappingRequest.class))).thenReturn(mappingResponse);
      when(mappingResponse.get("rag-main"))
          .thenReturn(
              IndexMappingRecord.of(
                  m ->
                      m.mappings(
                          t ->
                              t.properties(
                                  "embedding",
                                  Property.of(p -> p.denseVector(d -> d.dims(256)))))));

      assertThatThrownBy(() -> store.initIndex())
          .isInstanceOf(IllegalStateException.class)
          .hasMessageContaining("256")
          .hasMessageContaining("3");
      verify(indicesClient, never()).create(any(CreateIndexRequest.class));
    }
  }

  @Nested
  @DisplayName("Query")
  class QueryTests {

    @Test
    @DisplayName("should map hits to matches and bound the candidate count")
    void shouldMapHits() throws Exception {
      Hit<Map> hit =
          Hit.of(
              h ->
                  h.index("rag-main")
                      .id("2:ns:doc#0")
                      .score(0.75)
                      .source(
                          Map.of(
                              "record_id", "doc#0",
                              "embedding", List.of(0.5, 0.25, 0.0),
                              "metadata", Map.of("lang", "en"))));
      when(elasticsearchClient.search(any(SearchRequest.class), eq(Map.class)))
          .thenReturn(searchResponse);
      when(searchResponse.hits()).thenReturn(hitsMetadata);
      when(hitsMetadata.hits()).thenReturn(List.of(hit));

      List<QueryMatch> matches =
          store.query("ns", List.of(1f, 0f, 0f), 5, MetadataFilter.equalTo("lang", "en"));

      assertThat(matches).hasSize(1);
      QueryMatch match = matches.get(0);
      assertThat(match.id()).isEqualTo("doc#0");
      assertThat(match.score()).isEqualTo(0.75);
      assertThat(match.values()).containsExactly(0.5f, 0.25f, 0.0f);
      assertThat(match.metadata()).containsEntry("lang", "en");

      ArgumentCaptor<SearchRequest> captor = ArgumentCaptor.forClass(SearchRequest.class);
      verify(elasticsearchClient).search(captor.capture(), eq(Map.class));
      KnnSearch knn = captor.getValue().knn().get(0);
      assertThat(knn.k().intValue()).isEqualTo(5);
      assertThat(knn.numCandidates().intValue()).isEqualTo(100);
    }

    @Test
    @DisplayName("should report search failures as store errors")
    void shouldWrapSearchFailure() throws Exception {
      when(elasticsearchClient.search(any(SearchRequest.class), eq(Map.class)))
          .thenThrow(new IOException("connection refused"));

      assertThatThrownBy(() -> store.query("ns", List.of(1f, 0f, 0f), 5, MetadataFilter.none()))
          .isInstanceOf(StoreException.class)
          .hasMessageContaining("connection refused");
    }
  }

  @Nested
  @DisplayName("Writes")
  class Writes {

    @Test
    @DisplayName("should fail the upsert when any bulk item fails")
    void shouldFailUpsert_onItemError() throws Exception {
      BulkResponseItem failed = mock(BulkResponseItem.class);
      when(failed.id()).thenReturn("2:ns:a");
      when(failed.error())
          .thenReturn(
              ErrorCause.of(e -> e.type("mapper_parsing_exception").reason("bad vector")));
      when(bulkResponse.errors()).thenReturn(true);
      when(bulkResponse.items()).thenReturn(List.of(failed));
      when(elasticsearchClient.bulk(any(BulkRequest.class))).thenReturn(bulkResponse);

      assertThatThrownBy(
              () -> store.upsert("ns", List.of(new VectorRecord("a", List.of(1f), Map.of()))))
          .isInstanceOf(StoreException.class)
          .hasMessageContaining("bad vector");
    }

    @Test
    @DisplayName("should count only items the store reports as deleted")
    void shouldCountDeletedItems() throws Exception {
      BulkResponseItem deleted = mock(BulkResponseItem.class);
      BulkResponseItem missing = mock(BulkResponseItem.class);
      when(deleted.result()).thenReturn("deleted");
      when(missing.result()).thenReturn("not_found");
      when(bulkResponse.items()).thenReturn(List.of(deleted, missing));
      when(elasticsearchClient.bulk(any(BulkRequest.class))).thenReturn(bulkResponse);

      assertThat(store.deleteByIds("ns", List.of("a", "b"))).isEqualTo(1);
    }

    @Test
    @DisplayName("should not call the store for an empty delete")
    void shouldSkipEmptyDelete() throws Exception {
      assertThat(store.deleteByIds("ns", List.of())).isZero();
      verify(elasticsearchClient, never()).bulk(any(BulkRequest.class));
    }
  }

  @Nested
  @DisplayName("Request building")
  class RequestBuilding {

    @Test
    @DisplayName("should length-prefix the namespace in document ids")
    void shouldPrefixNamespace() {
      assertThat(ElasticsearchVectorStore.documentId("a:b", "c"))
          .isNotEqualTo(ElasticsearchVectorStore.documentId("a", "b:c"));
      assertThat(ElasticsearchVectorStore.documentId("ns", "doc#1")).isEqualTo("2:ns:doc#1");
    }

    @Test
    @DisplayName("should keep candidates between 100 and 10000")
    void shouldBoundCandidates() {
      assertThat(ElasticsearchVectorStore.numCandidates(1)).isEqualTo(100);
      assertThat(ElasticsearchVectorStore.numCandidates(300)).isEqualTo(600);
      assertThat(ElasticsearchVectorStore.numCandidates(10_000)).isEqualTo(10_000);
    }

    @Test
    @DisplayName("should scope every filter to the namespace")
    void shouldBuildFilterQuery() {
      MetadataFilter filter =
          MetadataFilter.parse(Map.of("lang", "en", "page", Map.of("$nin", List.of(1, 2))));

      Query query = ElasticsearchVectorStore.buildFilterQuery("ns", filter);

      BoolQuery bool = query.bool();
      assertThat(bool.filter()).hasSize(2);
      assertThat(bool.filter().get(0).term().field()).isEqualTo("namespace");
      assertThat(bool.filter().get(1).term().field()).isEqualTo("metadata.lang");
      assertThat(bool.mustNot()).hasSize(1);
      assertThat(bool.mustNot().get(0).terms().field()).isEqualTo("metadata.page");
    }
  }
}
