// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.search.refresh;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;

import sh.scry.core.model.AgentSummary;

/**
 * Bounded, expiring store of refreshed agent summaries keyed by agent id.
 *
 * <p>Entries are evicted once {@code maxEntries} is exceeded and expire {@code ttl}
 * after they were last written. The cache is disposable: it only backs lookups for
 * chains without a configured backend.
 */
public final class SummaryCache {

    public static final int DEFAULT_MAX_ENTRIES = 10_000;
    public static final Duration DEFAULT_TTL = Duration.ofDays(7);

    private final Cache<String, AgentSummary> entries;

    public SummaryCache() {
        this(DEFAULT_MAX_ENTRIES, DEFAULT_TTL, Ticker.systemTicker());
    }

    public SummaryCache(final int maxEntries, final Duration ttl) {
        this(maxEntries, ttl, Ticker.systemTicker());
    }

    public SummaryCache(final int maxEntries, final Duration ttl, final Ticker ticker) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be at least 1, got: " + maxEntries);
        }
        Objects.requireNonNull(ttl, "ttl");
        Objects.requireNonNull(ticker, "ticker");
        this.entries = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .expireAfterWrite(ttl)
                .ticker(ticker)
                // maintenance on the caller so size() reflects evictions immediately
                .executor(Runnable::run)
                .build();
    }

    public void put(final AgentSummary summary) {
        entries.put(summary.agentId(), summary);
    }

    public Optional<AgentSummary> get(final String agentId) {
        return Optional.ofNullable(entries.getIfPresent(agentId));
    }

    public int size() {
        entries.cleanUp();
        return Math.toIntExact(entries.estimatedSize());
    }

    public void clear() {
        entries.invalidateAll();
        entries.cleanUp();
    }
}
