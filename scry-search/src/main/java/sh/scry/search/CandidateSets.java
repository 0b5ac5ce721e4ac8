// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.search;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.jspecify.annotations.Nullable;

import sh.scry.core.erc8004.AgentId;
import sh.scry.core.error.InvalidFilterException;

/**
 * Set algebra over per-chain candidate id lists.
 *
 * <p>A {@code null} list means the stage placed no constraint; an empty list
 * means it matched nothing. Intersections keep the order of the first operand.
 */
public final class CandidateSets {

    private CandidateSets() {
    }

    /**
     * Intersects two optional candidate lists; {@code null} acts as the universal set.
     */
    public static @Nullable List<String> intersect(final @Nullable List<String> a, final @Nullable List<String> b) {
        if (a == null && b == null) {
            return null;
        }
        if (a == null) {
            return List.copyOf(b);
        }
        if (b == null) {
            return List.copyOf(a);
        }
        final Set<String> keep = new HashSet<>(b);
        final List<String> out = new ArrayList<>(Math.min(a.size(), b.size()));
        for (String id : a) {
            if (keep.contains(id)) {
                out.add(id);
            }
        }
        return List.copyOf(out);
    }

    /**
     * @return the universe without the excluded ids, in universe order
     */
    public static List<String> subtract(final List<String> universe, final Collection<String> excluded) {
        final Set<String> drop = excluded instanceof Set<String> set ? set : new HashSet<>(excluded);
        final List<String> out = new ArrayList<>(universe.size());
        for (String id : universe) {
            if (!drop.contains(id)) {
                out.add(id);
            }
        }
        return List.copyOf(out);
    }

    /**
     * @return true when a stage produced a constraint that matches nothing
     */
    public static boolean isExhausted(final @Nullable List<String> candidates) {
        return candidates != null && candidates.isEmpty();
    }

    /**
     * Splits an agent id filter by chain.
     *
     * <p>Every resolved chain gets an entry, possibly empty. Ids naming a chain
     * outside {@code chains} are ignored, as are ids with a malformed prefix.
     * Unprefixed ids are only accepted when exactly one chain is searched.
     *
     * @throws InvalidFilterException if an unprefixed id is given for a multi-chain search
     */
    public static Map<Long, List<String>> partitionAgentIds(final List<String> agentIds, final List<Long> chains) {
        final Map<Long, List<String>> byChain = new LinkedHashMap<>();
        for (Long chain : chains) {
            byChain.put(chain, new ArrayList<>());
        }
        for (String raw : agentIds) {
            if (raw == null || raw.isBlank()) {
                continue;
            }
            final String id = raw.trim();
            if (AgentId.hasChainPrefix(id)) {
                final Long chain = chainPrefix(id);
                if (chain != null && byChain.containsKey(chain) && !byChain.get(chain).contains(id)) {
                    byChain.get(chain).add(id);
                }
                continue;
            }
            if (chains.size() != 1) {
                throw new InvalidFilterException("agentIds",
                        "ids without a chain prefix are only allowed when searching exactly one chain, got " + id);
            }
            final Long only = chains.get(0);
            final String prefixed = only + ":" + id;
            if (!byChain.get(only).contains(prefixed)) {
                byChain.get(only).add(prefixed);
            }
        }
        final Map<Long, List<String>> out = new LinkedHashMap<>();
        byChain.forEach((chain, ids) -> out.put(chain, List.copyOf(ids)));
        return out;
    }

    private static @Nullable Long chainPrefix(final String id) {
        try {
            return Long.parseLong(id.substring(0, id.indexOf(':')).trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
