package com.flamingo.ai.ragindex.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch._types.FieldValue;
import co.elastic.clients.elasticsearch._types.Refresh;
import co.elastic.clients.elasticsearch._types.SortOrder;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorProperty;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorSimilarity;
import co.elastic.clients.elasticsearch._types.mapping.DynamicMapping;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.query_dsl.BoolQuery;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.bulk.BulkResponseItem;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import co.elastic.clients.elasticsearch.indices.ElasticsearchIndicesClient;
import co.elastic.clients.elasticsearch.indices.ExistsRequest;
import co.elastic.clients.elasticsearch.indices.GetMappingRequest;
import co.elastic.clients.elasticsearch.indices.GetMappingResponse;
import co.elastic.clients.elasticsearch.indices.get_mapping.IndexMappingRecord;
import com.flamingo.ai.ragindex.config.RagConfig;
import com.flamingo.ai.ragindex.exception.StoreException;
import com.flamingo.ai.ragindex.vectorstore.IdPage;
import com.flamingo.ai.ragindex.vectorstore.MetadataFilter;
import com.flamingo.ai.ragindex.vectorstore.QueryMatch;
import com.flamingo.ai.ragindex.vectorstore.VectorRecord;
import com.flamingo.ai.ragindex.vectorstore.VectorStore;
import com.google.common.annotations.VisibleForTesting;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * {@link VectorStore} backed by a single Elasticsearch index.
 *
 * <p>Namespaces share the index and are separated by a {@code namespace} keyword field that every
 * request filters on. Vectors live in a cosine {@code dense_vector} field, so kNN scores are
 * {@code (1 + cos) / 2}. Metadata is stored in a {@code flattened} field: its values are indexed
 * as keywords and compared by their string form. Values longer than {@link #METADATA_IGNORE_ABOVE}
 * characters, typically chunk text, are kept in the source but not indexed, so they cannot be
 * filtered on. Writes wait for a refresh so that a following list or query sees them.
 */
@Service
@ConditionalOnProperty(
    name = "app.vector-store.provider",
    havingValue = "elasticsearch",
    matchIfMissing = true)
@Slf4j
public class ElasticsearchVectorStore implements VectorStore {

  static final String NAMESPACE_FIELD = "namespace";
  static final String RECORD_ID_FIELD = "record_id";
  static final String EMBEDDING_FIELD = "embedding";
  static final String METADATA_FIELD = "metadata";

  // Lucene caps a term at 32766 bytes; 8191 chars stays below it for any UTF-8 input
  static final int METADATA_IGNORE_ABOVE = 8191;

  // Elasticsearch rejects num_candidates above 10000
  private static final int MAX_CANDIDATES = 10_000;
  private static final int MIN_CANDIDATES = 100;

  private final ElasticsearchClient elasticsearchClient;
  private final MeterRegistry meterRegistry;
  private final String indexName;
  private final int vectorDimensions;

  public ElasticsearchVectorStore(
      ElasticsearchClient elasticsearchClient, RagConfig ragConfig, MeterRegistry meterRegistry) {
    this.elasticsearchClient = elasticsearchClient;
    this.meterRegistry = meterRegistry;
    this.indexName = ragConfig.getIndexName();
    this.vectorDimensions = ragConfig.getEmbedding().getDimension();
  }

  @PostConstruct
  public void initIndex() {
    ElasticsearchIndicesClient indices = elasticsearchClient.indices();
    if (indices == null) {
      log.warn("Elasticsearch client not available, skipping index initialization");
      return;
    }
    try {
      boolean exists = indices.exists(ExistsRequest.of(e -> e.index(indexName))).value();
      if (!exists) {
        createIndex(indices);
        log.info("Created Elasticsearch index '{}' with {} dims", indexName, vectorDimensions);
      } else {
        validateDimensions(indices);
      }
    } catch (IOException | ElasticsearchException e) {
      log.error("Failed to initialize Elasticsearch index '{}': {}", indexName, e.getMessage(), e);
      throw new IllegalStateException(
          "Failed to initialize Elasticsearch index '" + indexName + "'", e);
    }
  }

  private void createIndex(ElasticsearchIndicesClient indices) throws IOException {
    Map<String, Property> properties = new HashMap<>();
    properties.put(NAMESPACE_FIELD, Property.of(p -> p.keyword(k -> k)));
    properties.put(RECORD_ID_FIELD, Property.of(p -> p.keyword(k -> k)));
    properties.put(
        EMBEDDING_FIELD,
        Property.of(
            p ->
                p.denseVector(
                    DenseVectorProperty.of(
                        d ->
                            d.dims(vectorDimensions)
                                .index(true)
                                .similarity(DenseVectorSimilarity.Cosine)))));
    properties.put(
        METADATA_FIELD,
        Property.of(p -> p.flattened(f -> f.ignoreAbove(METADATA_IGNORE_ABOVE))));

    // dynamic=false keeps undeclared fields out of the mapping
    indices.create(
        CreateIndexRequest.of(
            c ->
                c.index(indexName)
                    .mappings(m -> m.dynamic(DynamicMapping.False).properties(properties))));
  }

  /**
   * Refuses to start against an index built for another embedding dimension. The dims of a
   * dense_vector field cannot be changed in place.
   */
  private void validateDimensions(ElasticsearchIndicesClient indices) throws IOException {
    GetMappingResponse response = indices.getMapping(GetMappingRequest.of(g -> g.index(indexName)));
    IndexMappingRecord indexMapping = response.get(indexName);
    if (indexMapping == null || indexMapping.mappings() == null) {
      return;
    }
    Property embedding = indexMapping.mappings().properties().get(EMBEDDING_FIELD);
    if (embedding == null || !embedding.isDenseVector()) {
      throw new IllegalStateException(
          "Index '" + indexName + "' has no dense_vector field '" + EMBEDDING_FIELD + "'");
    }
    Integer dims = embedding.denseVector().dims();
    if (dims != null && dims != vectorDimensions) {
      throw new IllegalStateException(
          String.format(
              "Index '%s' stores %d-dimensional vectors but rag.embedding.dimension is %d. "
                  + "Delete the index or change the dimension.",
              indexName, dims, vectorDimensions));
    }
    log.debug("Index '{}' mapping verified ({} dims)", indexName, vectorDimensions);
  }

  @Override
  @Timed(value = "vector_store.upsert", description = "Time to upsert vectors")
  @CircuitBreaker(name = "elasticsearch", fallbackMethod = "upsertFallback")
  public void upsert(String namespace, List<VectorRecord> records) {
    if (records.isEmpty()) {
      return;
    }

    BulkRequest.Builder bulkBuilder = new BulkRequest.Builder().refresh(Refresh.WaitFor);
    for (VectorRecord record : records) {
      Map<String, Object> document = new HashMap<>();
      document.put(NAMESPACE_FIELD, namespace);
      document.put(RECORD_ID_FIELD, record.id());
      document.put(EMBEDDING_FIELD, record.values());
      document.put(METADATA_FIELD, record.metadata());

      String docId = documentId(namespace, record.id());
      bulkBuilder.operations(
          op -> op.index(idx -> idx.index(indexName).id(docId).document(document)));
    }

    BulkResponse response = executeBulk(bulkBuilder.build(), "upsert");
    if (response.errors()) {
      meterRegistry.counter("vector_store.upsert.errors").increment();
      throw new StoreException(
          "Bulk upsert into namespace " + namespace + " failed: " + firstError(response));
    }
    log.debug("Upserted {} records into namespace '{}'", records.size(), namespace);
    meterRegistry.counter("vector_store.upserted").increment(records.size());
  }

  @SuppressWarnings("unused")
  private void upsertFallback(String namespace, List<VectorRecord> records, Throwable t) {
    throw toStoreException("upsert", t);
  }

  @Override
  @Timed(value = "vector_store.query", description = "Time for kNN vector search")
  @CircuitBreaker(name = "elasticsearch", fallbackMethod = "queryFallback")
  public List<QueryMatch> query(
      String namespace, List<Float> vector, int topK, MetadataFilter filter) {
    int k = Math.min(topK, MAX_CANDIDATES);
    int numCandidates = numCandidates(k);
    Query filterQuery = buildFilterQuery(namespace, filter);

    SearchRequest request =
        SearchRequest.of(
            s ->
                s.index(indexName)
                    .knn(
                        kn ->
                            kn.field(EMBEDDING_FIELD)
                                .queryVector(vector)
                                .k(k)
                                .numCandidates(numCandidates)
                                .filter(filterQuery))
                    .size(k));

    List<Hit<Map>> hits = search(request, "query").hits().hits();
    List<QueryMatch> matches = new ArrayList<>(hits.size());
    for (Hit<Map> hit : hits) {
      Map<String, Object> source = sourceOf(hit);
      matches.add(
          new QueryMatch(
              String.valueOf(source.get(RECORD_ID_FIELD)),
              hit.score() == null ? 0.0 : hit.score(),
              toFloatList(source.get(EMBEDDING_FIELD)),
              toMetadata(source.get(METADATA_FIELD))));
    }
    log.debug(
        "kNN query in namespace '{}' returned {} matches (k={}, candidates={})",
        namespace,
        matches.size(),
        k,
        numCandidates);
    return matches;
  }

  @SuppressWarnings("unused")
  private List<QueryMatch> queryFallback(
      String namespace, List<Float> vector, int topK, MetadataFilter filter, Throwable t) {
    throw toStoreException("query", t);
  }

  @Override
  @Timed(value = "vector_store.list_ids", description = "Time to list ids by metadata")
  @CircuitBreaker(name = "elasticsearch", fallbackMethod = "listIdsFallback")
  public IdPage listIdsByMetadata(
      String namespace, MetadataFilter filter, String pageToken, int pageSize) {
    Query filterQuery = buildFilterQuery(namespace, filter);

    SearchRequest request =
        SearchRequest.of(
            s -> {
              s.index(indexName)
                  .query(filterQuery)
                  .size(pageSize)
                  .sort(so -> so.field(f -> f.field(RECORD_ID_FIELD).order(SortOrder.Asc)))
                  .source(src -> src.filter(f -> f.includes(RECORD_ID_FIELD)));
              if (pageToken != null) {
                s.searchAfter(List.of(FieldValue.of(pageToken)));
              }
              return s;
            });

    List<Hit<Map>> hits = search(request, "list").hits().hits();
    List<String> ids = new ArrayList<>(hits.size());
    for (Hit<Map> hit : hits) {
      ids.add(String.valueOf(sourceOf(hit).get(RECORD_ID_FIELD)));
    }
    String next = ids.size() == pageSize && !ids.isEmpty() ? ids.get(ids.size() - 1) : null;
    return new IdPage(ids, next);
  }

  @SuppressWarnings("unused")
  private IdPage listIdsFallback(
      String namespace, MetadataFilter filter, String pageToken, int pageSize, Throwable t) {
    throw toStoreException("list", t);
  }

  @Override
  @Timed(value = "vector_store.delete", description = "Time to delete vectors by id")
  @CircuitBreaker(name = "elasticsearch", fallbackMethod = "deleteByIdsFallback")
  public int deleteByIds(String namespace, Collection<String> ids) {
    if (ids.isEmpty()) {
      return 0;
    }

    BulkRequest.Builder bulkBuilder = new BulkRequest.Builder().refresh(Refresh.WaitFor);
    for (String id : ids) {
      String docId = documentId(namespace, id);
      bulkBuilder.operations(op -> op.delete(d -> d.index(indexName).id(docId)));
    }

    BulkResponse response = executeBulk(bulkBuilder.build(), "delete");
    int deleted = 0;
    for (BulkResponseItem item : response.items()) {
      if (item.error() != null) {
        throw new StoreException(
            "Bulk delete in namespace " + namespace + " failed: " + item.error().reason());
      }
      if ("deleted".equals(item.result())) {
        deleted++;
      }
    }
    meterRegistry.counter("vector_store.deleted").increment(deleted);
    return deleted;
  }

  @SuppressWarnings("unused")
  private int deleteByIdsFallback(String namespace, Collection<String> ids, Throwable t) {
    throw toStoreException("delete", t);
  }

  @Override
  public String name() {
    return "elasticsearch";
  }

  /**
   * Elasticsearch document id for a record. The namespace is length-prefixed so that no
   * namespace/id pair can collide with another.
   */
  @VisibleForTesting
  static String documentId(String namespace, String recordId) {
    return namespace.length() + ":" + namespace + ":" + recordId;
  }

  @VisibleForTesting
  static int numCandidates(int k) {
    return Math.min(Math.max(k * 2, MIN_CANDIDATES), MAX_CANDIDATES);
  }

  @VisibleForTesting
  static Query buildFilterQuery(String namespace, MetadataFilter filter) {
    BoolQuery.Builder bool = new BoolQuery.Builder();
    bool.filter(Query.of(q -> q.term(t -> t.field(NAMESPACE_FIELD).value(namespace))));

    for (MetadataFilter.Condition condition : filter.getConditions()) {
      String field = METADATA_FIELD + "." + condition.field();
      List<FieldValue> values = condition.values().stream().map(FieldValue::of).toList();
      Query match =
          values.size() == 1
              ? Query.of(q -> q.term(t -> t.field(field).value(values.get(0))))
              : Query.of(q -> q.terms(t -> t.field(field).terms(v -> v.value(values))));
      switch (condition.operator()) {
        case EQ, IN -> bool.filter(match);
        case NE, NIN -> bool.mustNot(match);
      }
    }
    return Query.of(q -> q.bool(bool.build()));
  }

  private BulkResponse executeBulk(BulkRequest request, String operation) {
    try {
      return elasticsearchClient.bulk(request);
    } catch (IOException | ElasticsearchException e) {
      log.error("Bulk {} on {} failed: {}", operation, indexName, e.getMessage(), e);
      throw new StoreException("Bulk " + operation + " failed: " + e.getMessage(), e);
    }
  }

  @SuppressWarnings("rawtypes")
  private SearchResponse<Map> search(SearchRequest request, String operation) {
    try {
      return elasticsearchClient.search(request, Map.class);
    } catch (IOException | ElasticsearchException e) {
      log.error("Search ({}) on {} failed: {}", operation, indexName, e.getMessage(), e);
      throw new StoreException("Search (" + operation + ") failed: " + e.getMessage(), e);
    }
  }

  private StoreException toStoreException(String operation, Throwable t) {
    if (t instanceof StoreException storeException) {
      return storeException;
    }
    log.warn("Elasticsearch {} fallback triggered: {}", operation, t.getMessage());
    meterRegistry.counter("vector_store.fallback", "operation", operation).increment();
    return new StoreException("Vector store " + operation + " unavailable: " + t.getMessage(), t);
  }

  private static String firstError(BulkResponse response) {
    return response.items().stream()
        .filter(item -> item.error() != null)
        .map(item -> item.id() + ": " + item.error().reason())
        .findFirst()
        .orElse("unknown error");
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> sourceOf(Hit<Map> hit) {
    Map<String, Object> source = hit.source();
    return source == null ? Map.of() : source;
  }

  private static List<Float> toFloatList(Object value) {
    if (!(value instanceof List<?> list)) {
      return List.of();
    }
    List<Float> result = new ArrayList<>(list.size());
    for (Object element : list) {
      result.add(((Number) element).floatValue());
    }
    return result;
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> toMetadata(Object value) {
    return value instanceof Map<?, ?> map ? (Map<String, Object>) map : Map.of();
  }
}
