// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.search.semantic;

import java.util.List;
import java.util.Map;

/**
 * Relevance hits grouped by chain.
 *
 * @param idsByChain agent ids per resolved chain in service order; chains without hits map to an empty list
 * @param scoreById  relevance score per agent id
 */
public record SemanticCandidates(Map<Long, List<String>> idsByChain, Map<String, Double> scoreById) {

    public SemanticCandidates {
        idsByChain = Map.copyOf(idsByChain);
        scoreById = Map.copyOf(scoreById);
    }

    public List<String> idsFor(final long chainId) {
        return idsByChain.getOrDefault(chainId, List.of());
    }

    /**
     * @return the agent's score, or 0 when the service did not rank it
     */
    public double score(final String agentId) {
        return scoreById.getOrDefault(agentId, 0.0);
    }

    public int size() {
        return scoreById.size();
    }
}
