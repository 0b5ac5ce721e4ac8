// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.search.prefilter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import sh.scry.core.model.FeedbackStats;

/**
 * Running per-agent aggregate over scanned feedback rows.
 *
 * <p>An agent is <em>matched</em> as soon as one row for it passes the row
 * constraints; only rows with a numeric value contribute to its statistics.
 * Not thread-safe: one tally per chain scan.
 */
final class FeedbackTally {

    private final Set<String> matched = new LinkedHashSet<>();
    private final Map<String, FeedbackStats> stats = new LinkedHashMap<>();

    void match(final String agentId) {
        matched.add(agentId);
    }

    void add(final String agentId, final double value) {
        stats.merge(agentId, FeedbackStats.EMPTY.add(value), (a, b) -> a.add(value));
    }

    Set<String> matched() {
        return Collections.unmodifiableSet(matched);
    }

    FeedbackStats statsFor(final String agentId) {
        return stats.getOrDefault(agentId, FeedbackStats.EMPTY);
    }

    Map<String, FeedbackStats> stats() {
        return Collections.unmodifiableMap(stats);
    }
}
