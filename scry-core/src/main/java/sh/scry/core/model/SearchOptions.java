// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.core.model;

import java.util.List;

import org.jspecify.annotations.Nullable;

/**
 * Result shaping for a search.
 *
 * @param sort             sort keys as {@code field:direction}; only the first is used, empty means default
 * @param semanticMinScore minimum relevance score, or null for the engine default
 * @param semanticLimit    relevance result cap, or null for the engine default
 */
public record SearchOptions(
        List<String> sort,
        @Nullable Double semanticMinScore,
        @Nullable Integer semanticLimit) {

    private static final SearchOptions DEFAULTS = new SearchOptions(List.of(), null, null);

    public SearchOptions {
        sort = sort == null ? List.of() : List.copyOf(sort);
    }

    public static SearchOptions defaults() {
        return DEFAULTS;
    }

    public static SearchOptions sortedBy(String... sort) {
        return new SearchOptions(List.of(sort), null, null);
    }

    public SearchOptions withSemantic(@Nullable Double minScore, @Nullable Integer limit) {
        return new SearchOptions(sort, minScore, limit);
    }
}
