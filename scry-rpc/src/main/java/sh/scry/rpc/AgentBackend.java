// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.rpc;

import java.util.List;
import java.util.Optional;

import sh.scry.core.error.BackendException;
import sh.scry.core.model.SortDirection;
import sh.scry.core.query.Criterion;
import sh.scry.rpc.model.AgentRow;
import sh.scry.rpc.model.FeedbackRow;
import sh.scry.rpc.model.MetadataRow;

/**
 * Structured query access to one chain's agent index.
 *
 * <p>Every list method returns one page; callers drive pagination with
 * {@code first}/{@code skip} (see {@link Paginator}). Filters are
 * backend-neutral {@link Criterion} trees.
 */
public interface AgentBackend extends AutoCloseable {

    List<AgentRow> queryAgents(Criterion where, int first, int skip, String orderBy, SortDirection direction)
            throws BackendException;

    List<MetadataRow> queryMetadata(Criterion where, int first, int skip) throws BackendException;

    /**
     * Minimal feedback rows for aggregation, newest first. Responses are limited to the first id.
     */
    List<FeedbackRow> queryFeedback(Criterion where, int first, int skip) throws BackendException;

    /**
     * Fully populated feedback rows, newest first.
     */
    List<FeedbackRow> searchFeedback(Criterion where, int first, int skip) throws BackendException;

    Optional<AgentRow> agentById(String id) throws BackendException;

    Optional<FeedbackRow> feedbackById(String id) throws BackendException;

    @Override
    default void close() {
        // default no-op
    }
}
