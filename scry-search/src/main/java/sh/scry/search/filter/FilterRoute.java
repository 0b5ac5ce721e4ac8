// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.search.filter;

/**
 * Where a filter field is evaluated.
 */
public enum FilterRoute {
    /** Expressed directly in the backend {@code where} predicate. */
    PUSHDOWN,
    /** Restricts the per-chain candidate id set. */
    CANDIDATE_IDS,
    /** Answered by scanning metadata entries. */
    METADATA_PREFILTER,
    /** Answered by scanning feedback rows. */
    FEEDBACK_PREFILTER,
    /** Answered by the semantic relevance service. */
    SEMANTIC,
    /** Consumed by chain resolution. */
    CHAINS
}
