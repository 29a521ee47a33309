package com.flamingo.ai.ragindex.vectorstore;

import java.util.Collection;
import java.util.List;

/**
 * Namespaced vector storage with metadata filtering.
 *
 * <p>Failures of the backing store surface as {@link
 * com.flamingo.ai.ragindex.exception.StoreException}. Implementations do not validate vector
 * dimensions; callers check them before writing or querying.
 */
public interface VectorStore {

  /**
   * Inserts or replaces records by id.
   *
   * @param namespace target namespace, created on first write
   * @param records records to write
   */
  void upsert(String namespace, List<VectorRecord> records);

  /**
   * Returns the records closest to {@code vector}, best first.
   *
   * @param namespace namespace to search
   * @param vector query vector
   * @param topK maximum number of matches
   * @param filter metadata conditions every match must satisfy
   * @return matches by descending score, including values and metadata
   */
  List<QueryMatch> query(String namespace, List<Float> vector, int topK, MetadataFilter filter);

  /**
   * Lists ids of records matching a filter, one page at a time, in a stable order.
   *
   * @param namespace namespace to list
   * @param filter metadata conditions
   * @param pageToken token from the previous page, or null for the first page
   * @param pageSize maximum ids per page
   * @return the page; its token is null when no further ids exist
   */
  IdPage listIdsByMetadata(String namespace, MetadataFilter filter, String pageToken, int pageSize);

  /**
   * Deletes records by id. Unknown ids are ignored.
   *
   * @param namespace namespace to delete from
   * @param ids ids to delete
   * @return number of records actually deleted
   */
  int deleteByIds(String namespace, Collection<String> ids);

  /** Short name of the backing store, reported by the health endpoint. */
  String name();
}
