// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.search.refresh;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.scry.core.erc8004.AgentId;
import sh.scry.core.error.SearchInterruptedException;
import sh.scry.core.model.AgentSummary;

/**
 * Re-hydrates many agents with bounded concurrency.
 *
 * <p>Every id is submitted at once; a semaphore of {@code concurrency} permits
 * limits how many hydrations run simultaneously. All outcomes are gathered:
 * failures are logged and skipped, successes are cached and returned in input order.
 */
public final class AgentRefresher {

    private static final Logger LOG = LoggerFactory.getLogger(AgentRefresher.class);

    public static final int DEFAULT_CONCURRENCY = 8;

    private final AgentHydrator hydrator;
    private final SummaryCache cache;
    private final ExecutorService executor;
    private final long defaultChainId;

    public AgentRefresher(final AgentHydrator hydrator, final SummaryCache cache, final ExecutorService executor,
            final long defaultChainId) {
        this.hydrator = Objects.requireNonNull(hydrator, "hydrator");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.defaultChainId = defaultChainId;
    }

    /**
     * @param agentIds    ids to refresh; unprefixed ids belong to the default chain
     * @param concurrency maximum simultaneous hydrations
     * @return refreshed summaries, failures omitted
     * @throws SearchInterruptedException if the calling thread is interrupted while waiting
     */
    public List<AgentSummary> refresh(final List<String> agentIds, final int concurrency) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be at least 1, got: " + concurrency);
        }
        final Semaphore permits = new Semaphore(concurrency);
        final List<Future<AgentSummary>> futures = new ArrayList<>(agentIds.size());
        for (String raw : agentIds) {
            futures.add(executor.submit(() -> {
                permits.acquire();
                try {
                    return hydrator.hydrate(AgentId.parse(raw, defaultChainId));
                } finally {
                    permits.release();
                }
            }));
        }

        final List<AgentSummary> refreshed = new ArrayList<>(futures.size());
        for (int i = 0; i < futures.size(); i++) {
            try {
                final AgentSummary summary = futures.get(i).get();
                cache.put(summary);
                refreshed.add(summary);
            } catch (InterruptedException e) {
                for (Future<AgentSummary> future : futures) {
                    future.cancel(true);
                }
                Thread.currentThread().interrupt();
                throw new SearchInterruptedException("Interrupted while refreshing agents", e);
            } catch (ExecutionException e) {
                LOG.warn("Failed to refresh agent {}: {}", agentIds.get(i), e.getCause().toString());
            }
        }
        LOG.debug("Refreshed {} of {} agents", refreshed.size(), agentIds.size());
        return refreshed;
    }
}
