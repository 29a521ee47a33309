package com.flamingo.ai.ragindex.vectorstore;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * {@link VectorStore} held in process memory.
 *
 * <p>Queries scan the whole namespace with cosine similarity, reported as {@code (1 + cos) / 2}
 * to match the Elasticsearch store. Ids are listed in lexicographic order and the page token is
 * the last id of the page. Contents are lost on restart.
 */
@Component
@ConditionalOnProperty(name = "app.vector-store.provider", havingValue = "memory")
@Slf4j
public class InMemoryVectorStore implements VectorStore {

  private final Map<String, NavigableMap<String, VectorRecord>> namespaces =
      new ConcurrentHashMap<>();

  @Override
  public void upsert(String namespace, List<VectorRecord> records) {
    NavigableMap<String, VectorRecord> points =
        namespaces.computeIfAbsent(namespace, ns -> new ConcurrentSkipListMap<>());
    for (VectorRecord record : records) {
      points.put(record.id(), record);
    }
    log.debug("Upserted {} records into namespace '{}'", records.size(), namespace);
  }

  @Override
  public List<QueryMatch> query(
      String namespace, List<Float> vector, int topK, MetadataFilter filter) {
    NavigableMap<String, VectorRecord> points = namespaces.get(namespace);
    if (points == null || topK <= 0) {
      return List.of();
    }
    return points.values().stream()
        .filter(record -> filter.matches(record.metadata()))
        .map(
            record ->
                new QueryMatch(
                    record.id(),
                    score(vector, record.values()),
                    record.values(),
                    record.metadata()))
        .sorted(
            Comparator.comparingDouble(QueryMatch::score).reversed().thenComparing(QueryMatch::id))
        .limit(topK)
        .toList();
  }

  @Override
  public IdPage listIdsByMetadata(
      String namespace, MetadataFilter filter, String pageToken, int pageSize) {
    NavigableMap<String, VectorRecord> points = namespaces.get(namespace);
    if (points == null) {
      return new IdPage(List.of(), null);
    }
    NavigableMap<String, VectorRecord> remaining =
        pageToken == null ? points : points.tailMap(pageToken, false);

    List<String> ids = new ArrayList<>(pageSize);
    for (VectorRecord record : remaining.values()) {
      if (filter.matches(record.metadata())) {
        ids.add(record.id());
        if (ids.size() == pageSize) {
          break;
        }
      }
    }
    String next = ids.size() == pageSize ? ids.get(ids.size() - 1) : null;
    return new IdPage(ids, next);
  }

  @Override
  public int deleteByIds(String namespace, Collection<String> ids) {
    NavigableMap<String, VectorRecord> points = namespaces.get(namespace);
    if (points == null) {
      return 0;
    }
    int deleted = 0;
    for (String id : ids) {
      if (points.remove(id) != null) {
        deleted++;
      }
    }
    return deleted;
  }

  @Override
  public String name() {
    return "memory";
  }

  /** Number of records in a namespace. */
  public int count(String namespace) {
    NavigableMap<String, VectorRecord> points = namespaces.get(namespace);
    return points == null ? 0 : points.size();
  }

  static double score(List<Float> a, List<Float> b) {
    int n = Math.min(a.size(), b.size());
    double dot = 0;
    double normA = 0;
    double normB = 0;
    for (int i = 0; i < n; i++) {
      double x = a.get(i);
      double y = b.get(i);
      dot += x * y;
      normA += x * x;
      normB += y * y;
    }
    if (normA == 0 || normB == 0) {
      return 0.5;
    }
    double cosine = dot / (Math.sqrt(normA) * Math.sqrt(normB));
    return (1 + cosine) / 2;
  }
}
