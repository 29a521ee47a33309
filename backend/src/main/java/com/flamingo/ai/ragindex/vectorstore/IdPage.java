package com.flamingo.ai.ragindex.vectorstore;

import java.util.List;

/**
 * One page of record ids.
 *
 * @param ids ids on this page, in a stable order
 * @param nextPageToken token for the following page, or null when this is the last page
 */
public record IdPage(List<String> ids, String nextPageToken) {

  public IdPage {
    ids = ids == null ? List.of() : List.copyOf(ids);
  }

  public boolean hasNext() {
    return nextPageToken != null;
  }
}
