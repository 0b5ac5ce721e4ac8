// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.rpc.semantic;

import java.util.List;

import sh.scry.core.error.SemanticSearchException;

/**
 * Ranks agents by relevance to a free-text query.
 */
public interface SemanticSearchClient extends AutoCloseable {

    double DEFAULT_MIN_SCORE = 0.5;
    int DEFAULT_LIMIT = 5000;

    /**
     * @param query    free text; blank queries return no hits without a network call
     * @param minScore lowest score to return
     * @param limit    maximum number of hits
     * @return hits in service order, malformed entries dropped
     * @throws SemanticSearchException if the service is unreachable, fails, or returns non-JSON
     */
    List<SemanticHit> search(String query, double minScore, int limit) throws SemanticSearchException;

    default List<SemanticHit> search(final String query) throws SemanticSearchException {
        return search(query, DEFAULT_MIN_SCORE, DEFAULT_LIMIT);
    }

    static SemanticSearchClient http() {
        return HttpSemanticSearchClient.builder().build();
    }

    @Override
    default void close() {
        // default no-op
    }
}
