// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.search.semantic;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import sh.scry.core.DebugLogger;
import sh.scry.core.erc8004.AgentId;
import sh.scry.core.error.SemanticSearchException;
import sh.scry.rpc.semantic.SemanticHit;
import sh.scry.rpc.semantic.SemanticSearchClient;

/**
 * Turns a keyword into per-chain candidate lists via the relevance service.
 *
 * <p>Hits on chains outside the search are discarded, as are hits whose agent id
 * prefix names a different chain than the hit's {@code chainId}. When the service
 * returns the same agent twice, the first occurrence wins.
 */
public final class SemanticSearchGateway {

    private final SemanticSearchClient client;

    public SemanticSearchGateway(final SemanticSearchClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    /**
     * @throws SemanticSearchException if the service call fails; the search cannot be ranked without it
     */
    public SemanticCandidates search(final String keyword, final List<Long> chains, final double minScore,
            final int limit) {
        final List<SemanticHit> hits = client.search(keyword.trim(), minScore, limit);
        final Map<Long, List<String>> idsByChain = new LinkedHashMap<>();
        for (Long chain : chains) {
            idsByChain.put(chain, new ArrayList<>());
        }
        final Map<String, Double> scoreById = new HashMap<>();
        int dropped = 0;
        for (SemanticHit hit : hits) {
            final List<String> ids = idsByChain.get(hit.chainId());
            if (ids == null || !onOwnChain(hit) || scoreById.containsKey(hit.agentId())) {
                dropped++;
                continue;
            }
            ids.add(hit.agentId());
            scoreById.put(hit.agentId(), hit.score());
        }
        DebugLogger.logSearch("[SEMANTIC] kept=%d dropped=%d chains=%s", scoreById.size(), dropped, chains);
        final Map<Long, List<String>> frozen = new LinkedHashMap<>();
        idsByChain.forEach((chain, ids) -> frozen.put(chain, List.copyOf(ids)));
        return new SemanticCandidates(frozen, scoreById);
    }

    private static boolean onOwnChain(final SemanticHit hit) {
        return AgentId.tryParse(hit.agentId())
                .map(id -> id.chainId() == hit.chainId())
                .orElse(false);
    }
}
