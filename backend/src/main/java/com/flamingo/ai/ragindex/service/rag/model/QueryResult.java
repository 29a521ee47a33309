package com.flamingo.ai.ragindex.service.rag.model;

import com.flamingo.ai.ragindex.vectorstore.QueryMatch;
import java.util.List;

/**
 * Matches of a similarity query, best first.
 *
 * @param namespace the namespace that was searched
 * @param matches matches by descending score
 */
public record QueryResult(String namespace, List<QueryMatch> matches) {}
