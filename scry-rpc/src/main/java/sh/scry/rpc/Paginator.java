// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.rpc;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Drives {@code first}/{@code skip} pagination until a short page signals exhaustion.
 */
public final class Paginator {

    /** Page size used across the engine; the subgraph caps {@code first} at 1000. */
    public static final int DEFAULT_PAGE_SIZE = 1000;

    private Paginator() {
    }

    /**
     * Fetches one page.
     */
    @FunctionalInterface
    public interface PageFetcher<T> {
        List<T> fetch(int first, int skip);
    }

    /**
     * Streams every row to {@code sink}.
     *
     * @return the number of rows seen
     */
    public static <T> long drain(final int pageSize, final PageFetcher<T> fetcher, final Consumer<? super T> sink) {
        if (pageSize < 1) {
            throw new IllegalArgumentException("pageSize must be at least 1, got: " + pageSize);
        }
        long total = 0;
        int skip = 0;
        while (true) {
            final List<T> page = fetcher.fetch(pageSize, skip);
            for (T row : page) {
                sink.accept(row);
            }
            total += page.size();
            if (page.size() < pageSize) {
                return total;
            }
            skip += pageSize;
        }
    }

    /**
     * Collects every row into a list.
     */
    public static <T> List<T> exhaust(final int pageSize, final PageFetcher<T> fetcher) {
        final List<T> rows = new ArrayList<>();
        drain(pageSize, fetcher, rows::add);
        return rows;
    }
}
