// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.search;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import sh.scry.core.error.BackendException;
import sh.scry.core.error.SearchInterruptedException;

/**
 * Runs one task per chain on a shared executor and collects the results in chain order.
 *
 * <p>Results never depend on completion order. Tasks are observed as they complete,
 * so the first chain to fail cancels
 * the outstanding tasks and its exception is rethrown on the calling thread,
 * tagged with the chain when it is a {@link BackendException}. Interrupting the
 * caller cancels every task.
 */
final class ChainFanOut {

    /**
     * Per-chain unit of work.
     */
    @FunctionalInterface
    interface ChainTask<T> {
        T run(long chainId);
    }

    private final ExecutorService executor;

    ChainFanOut(final ExecutorService executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    <T> List<T> run(final List<Long> chains, final ChainTask<T> task) {
        final CompletionService<T> completion = new ExecutorCompletionService<>(executor);
        final Map<Future<T>, Integer> positions = new HashMap<>();
        for (int i = 0; i < chains.size(); i++) {
            final long chain = chains.get(i);
            positions.put(completion.submit(() -> task.run(chain)), i);
        }
        final List<T> results = new ArrayList<>(Collections.nCopies(chains.size(), null));
        for (int done = 0; done < chains.size(); done++) {
            Future<T> future = null;
            try {
                future = completion.take();
                results.set(positions.get(future), future.get());
            } catch (InterruptedException e) {
                cancel(positions.keySet());
                Thread.currentThread().interrupt();
                throw new SearchInterruptedException("Interrupted while searching chains " + chains, e);
            } catch (ExecutionException e) {
                cancel(positions.keySet());
                throw rethrow(chains.get(positions.get(future)), e.getCause());
            } catch (CancellationException e) {
                cancel(positions.keySet());
                throw e;
            }
        }
        return results;
    }

    private static void cancel(final Collection<? extends Future<?>> futures) {
        for (Future<?> future : futures) {
            future.cancel(true);
        }
    }

    private static RuntimeException rethrow(final long chainId, final Throwable cause) {
        if (cause instanceof BackendException backend) {
            return backend.onChain(chainId);
        }
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new IllegalStateException("Search failed on chain " + chainId, cause);
    }
}
