// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.rpc;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory methods for executors used to fan queries out across chains.
 *
 * <p>Per-chain work is almost entirely blocking HTTP, so pools are sized by the
 * number of concurrent backends rather than by core count. Threads are daemons so an
 * unclosed engine never keeps the JVM alive.
 */
public final class ScryExecutors {

    private static final AtomicInteger IO_THREAD_ID = new AtomicInteger(0);

    private ScryExecutors() {
        // Utility class
    }

    /**
     * Creates a fixed pool for blocking network calls. Threads are named {@code scry-io-N}.
     *
     * @param threads the number of threads in the pool
     * @throws IllegalArgumentException if threads is less than 1
     */
    public static ExecutorService newIoBoundExecutor(int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be at least 1, got: " + threads);
        }
        return Executors.newFixedThreadPool(threads, r -> {
            // Mask off sign bit to ensure non-negative thread IDs even after integer overflow
            int id = IO_THREAD_ID.getAndIncrement() & 0x7FFFFFFF;
            Thread t = new Thread(r, "scry-io-" + id);
            t.setDaemon(true);
            return t;
        });
    }
}
