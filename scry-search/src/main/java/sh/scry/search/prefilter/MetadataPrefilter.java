// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.search.prefilter;

import java.util.List;
import java.util.TreeSet;

import org.jspecify.annotations.Nullable;

import sh.scry.core.DebugLogger;
import sh.scry.core.query.Criterion;
import sh.scry.core.types.Hex;
import sh.scry.rpc.AgentBackend;
import sh.scry.rpc.Paginator;

/**
 * Candidate ids from on-chain metadata entries.
 *
 * <p>Metadata values are opaque bytes under arbitrary keys, so the filter cannot
 * be pushed into the agent query. Entries are scanned by key, and by the hex form
 * of the expected UTF-8 value when one is given; the owning agents form the
 * chain's candidate list, de-duplicated and sorted.
 */
public final class MetadataPrefilter {

    private final int pageSize;

    public MetadataPrefilter(final int pageSize) {
        this.pageSize = pageSize;
    }

    public List<String> scan(final long chainId, final AgentBackend backend, final String key,
            final @Nullable String value) {
        final Criterion where = value == null
                ? Criterion.eq("key", key)
                : Criterion.and(Criterion.eq("key", key), Criterion.eq("value", Hex.encodeUtf8(value)));
        final TreeSet<String> ids = new TreeSet<>();
        final long rows = Paginator.drain(pageSize,
                (first, skip) -> backend.queryMetadata(where, first, skip),
                row -> {
                    if (row.agentId() != null) {
                        ids.add(row.agentId());
                    }
                });
        DebugLogger.logSearch("[METADATA] chain=%d key=%s rows=%d agents=%d", chainId, key, rows, ids.size());
        return List.copyOf(ids);
    }
}
