// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.core;

/**
 * Global toggle for enabling verbose debug logging across scry modules.
 *
 * <p>Two channels exist: query logging covers backend GraphQL calls and the
 * semantic relevance service, search logging covers planning and per-chain
 * execution inside the indexer.
 *
 * <p>Thread safety: the individual flags are volatile. The compound check in
 * {@link #isEnabled()} is not atomic, which is acceptable for best-effort logging.
 */
public final class ScryDebug {

    private static volatile boolean queryLogging = false;
    private static volatile boolean searchLogging = false;

    private ScryDebug() {
    }

    /**
     * Checks if any debug logging is enabled.
     *
     * @return true if either query or search logging is enabled
     */
    public static boolean isEnabled() {
        return queryLogging || searchLogging;
    }

    public static void setEnabled(final boolean enabled) {
        queryLogging = enabled;
        searchLogging = enabled;
    }

    public static void setQueryLogging(final boolean enabled) {
        queryLogging = enabled;
    }

    public static boolean isQueryLoggingEnabled() {
        return queryLogging;
    }

    public static void setSearchLogging(final boolean enabled) {
        searchLogging = enabled;
    }

    public static boolean isSearchLoggingEnabled() {
        return searchLogging;
    }
}
