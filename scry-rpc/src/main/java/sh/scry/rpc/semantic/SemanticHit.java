// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.rpc.semantic;

import java.util.Map;
import java.util.Optional;

import sh.scry.core.erc8004.AgentId;

/**
 * One relevance hit from the semantic search service.
 *
 * @param chainId chain the agent lives on
 * @param agentId agent id in {@code chainId:tokenId} form
 * @param score   relevance score, higher is better
 */
public record SemanticHit(long chainId, String agentId, double score) {

    /**
     * Reads a hit from a decoded JSON object.
     *
     * <p>Entries that are not objects, lack a numeric {@code chainId} or {@code score},
     * or carry an {@code agentId} whose chain prefix is missing or differs from
 * {@code chainId} yield an empty result.
     */
    public static Optional<SemanticHit> fromJson(final Object entry) {
        if (!(entry instanceof Map<?, ?> map)) {
            return Optional.empty();
        }
        final Object rawChain = map.get("chainId");
        final Object rawAgent = map.get("agentId");
        final Object rawScore = map.get("score");
        if (rawChain == null || rawAgent == null || rawScore == null) {
            return Optional.empty();
        }
        try {
            final long chainId = rawChain instanceof Number n ? n.longValue() : Long.parseLong(rawChain.toString().trim());
            final double score = rawScore instanceof Number n ? n.doubleValue() : Double.parseDouble(rawScore.toString().trim());
            final String agentId = rawAgent.toString();
            final Optional<AgentId> parsed = AgentId.tryParse(agentId);
            if (parsed.isEmpty() || parsed.get().chainId() != chainId) {
                return Optional.empty();
            }
            return Optional.of(new SemanticHit(chainId, agentId, score));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
