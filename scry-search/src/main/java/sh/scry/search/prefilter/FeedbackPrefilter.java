// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.search.prefilter;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.jspecify.annotations.Nullable;

import sh.scry.core.DebugLogger;
import sh.scry.core.error.InvalidFilterException;
import sh.scry.core.model.FeedbackFilters;
import sh.scry.core.model.FeedbackStats;
import sh.scry.core.query.Criterion;
import sh.scry.rpc.AgentBackend;
import sh.scry.rpc.Paginator;
import sh.scry.rpc.model.FeedbackRow;
import sh.scry.search.CandidateSets;

/**
 * Candidate ids and reputation aggregates from feedback rows.
 *
 * <p>Rows are selected by revocation, reviewer, endpoint substring, tags and the
 * incoming candidate universe, then tallied per agent. The policy applied to the
 * tally, in priority order:
 * <ol>
 * <li>{@code hasNoFeedback}: the universe minus every agent with a matching row</li>
 * <li>any count or value threshold: agents whose aggregate passes every bound (closed intervals)</li>
 * <li>otherwise: agents with at least one valued matching row</li>
 * </ol>
 * The result is finally intersected with the universe. A universe is scanned in
 * chunks of {@code idChunkSize} ids; the policy runs once over the combined tally.
 */
public final class FeedbackPrefilter {

    private final int pageSize;
    private final int idChunkSize;

    public FeedbackPrefilter(final int pageSize, final int idChunkSize) {
        if (idChunkSize < 1) {
            throw new IllegalArgumentException("idChunkSize must be at least 1, got: " + idChunkSize);
        }
        this.pageSize = pageSize;
        this.idChunkSize = idChunkSize;
    }

    /**
     * @param universe candidate ids from earlier stages, or null when unconstrained
     * @throws InvalidFilterException if {@code hasNoFeedback} is requested without a universe
     */
    public FeedbackScan scan(final long chainId, final AgentBackend backend, final FeedbackFilters filters,
            final @Nullable List<String> universe) {
        if (filters.wantsNoFeedback() && universe == null) {
            throw new InvalidFilterException("feedback.hasNoFeedback",
                    "requires a candidate set from agentIds, keyword or a metadata filter");
        }
        final boolean needsResponse = Boolean.TRUE.equals(filters.hasResponse());
        final FeedbackTally tally = new FeedbackTally();

        long rows = 0;
        if (universe == null) {
            rows = drain(backend, rowPredicate(filters, null), needsResponse, tally);
        } else {
            for (int from = 0; from < universe.size(); from += idChunkSize) {
                final List<String> chunk = universe.subList(from, Math.min(universe.size(), from + idChunkSize));
                rows += drain(backend, rowPredicate(filters, chunk), needsResponse, tally);
            }
        }

        final List<String> candidates = CandidateSets.intersect(select(filters, tally, universe), universe);
        DebugLogger.logSearch("[FEEDBACK] chain=%d rows=%d matched=%d candidates=%d",
                chainId, rows, tally.matched().size(), candidates.size());
        return new FeedbackScan(candidates, tally.stats());
    }

    private long drain(final AgentBackend backend, final Criterion where, final boolean needsResponse,
            final FeedbackTally tally) {
        return Paginator.drain(pageSize,
                (first, skip) -> backend.queryFeedback(where, first, skip),
                row -> accept(row, needsResponse, tally));
    }

    static Criterion rowPredicate(final FeedbackFilters filters, final @Nullable List<String> universe) {
        final List<Criterion> terms = new ArrayList<>();
        if (!filters.includeRevoked()) {
            terms.add(Criterion.eq("isRevoked", false));
        }
        if (filters.fromReviewers() != null) {
            final List<String> reviewers = new ArrayList<>(filters.fromReviewers().size());
            for (String reviewer : filters.fromReviewers()) {
                reviewers.add(reviewer.toLowerCase(Locale.ROOT));
            }
            terms.add(Criterion.in("clientAddress", reviewers));
        }
        if (notBlank(filters.endpoint())) {
            terms.add(Criterion.containsNoCase("endpoint", filters.endpoint()));
        }
        if (universe != null) {
            terms.add(Criterion.in("agent", universe));
        }
        if (notBlank(filters.tag1())) {
            terms.add(Criterion.eq("tag1", filters.tag1()));
        }
        if (notBlank(filters.tag2())) {
            terms.add(Criterion.eq("tag2", filters.tag2()));
        }
        if (notBlank(filters.tag())) {
            terms.add(Criterion.or(Criterion.eq("tag1", filters.tag()), Criterion.eq("tag2", filters.tag())));
        }
        return Criterion.and(terms);
    }

    private static void accept(final FeedbackRow row, final boolean needsResponse, final FeedbackTally tally) {
        final String agentId = row.agentId();
        if (agentId == null) {
            return;
        }
        if (needsResponse && !row.hasResponses()) {
            return;
        }
        tally.match(agentId);
        if (row.value() == null) {
            return;
        }
        try {
            tally.add(agentId, Double.parseDouble(row.value().trim()));
        } catch (NumberFormatException e) {
            DebugLogger.logSearch("[FEEDBACK] ignoring non-numeric value on %s", row.id());
        }
    }

    private static List<String> select(final FeedbackFilters filters, final FeedbackTally tally,
            final @Nullable List<String> universe) {
        if (filters.wantsNoFeedback()) {
            return CandidateSets.subtract(universe, tally.matched());
        }
        final List<String> out = new ArrayList<>();
        for (String agentId : tally.matched()) {
            final FeedbackStats stats = tally.statsFor(agentId);
            final boolean keep = filters.hasThreshold() ? filters.passesThresholds(stats) : stats.count() > 0;
            if (keep) {
                out.add(agentId);
            }
        }
        return out;
    }

    private static boolean notBlank(final @Nullable String value) {
        return value != null && !value.isBlank();
    }
}
