// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.search.prefilter;

import java.util.List;
import java.util.Map;

import sh.scry.core.model.FeedbackStats;

/**
 * Outcome of a feedback prefilter scan on one chain.
 *
 * @param candidates agents that satisfy the feedback constraints
 * @param stats      aggregates for every agent with at least one valued matching row,
 *                   whether or not it passed the thresholds
 */
public record FeedbackScan(List<String> candidates, Map<String, FeedbackStats> stats) {

    public FeedbackScan {
        candidates = List.copyOf(candidates);
        stats = Map.copyOf(stats);
    }
}
