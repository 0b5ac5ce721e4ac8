// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.search.filter;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import sh.scry.core.error.InvalidFilterException;
import sh.scry.core.model.FeedbackFilters;
import sh.scry.core.model.SearchFilters;
import sh.scry.core.query.Criterion;

/**
 * Compiles {@link SearchFilters} into a backend-neutral predicate.
 *
 * <p>The compiler is a fold over {@link FilterField}: every present push-down
 * field contributes its predicate and the contributions are conjoined. Fields
 * routed elsewhere are reported by {@link #plan(SearchFilters)} and handled by
 * the prefilter stages.
 *
 * <pre>{@code
 * Criterion where = FilterCompiler.compile(filters);
 * Criterion page = FilterCompiler.restrictTo(where, List.of("1:7", "1:9"));
 * }</pre>
 */
public final class FilterCompiler {

    private FilterCompiler() {
    }

    /**
     * @throws InvalidFilterException if a date bound does not parse
     */
    public static Criterion compile(final SearchFilters filters) {
        final List<Criterion> terms = new ArrayList<>();
        for (FilterField field : FilterField.values()) {
            field.pushdown(filters).ifPresent(terms::add);
        }
        return Criterion.and(terms);
    }

    /**
     * Adds an id membership constraint for one candidate chunk.
     */
    public static Criterion restrictTo(final Criterion where, final List<String> ids) {
        return Criterion.and(where, Criterion.in("id", ids));
    }

    /**
     * @return every present field with the stage that evaluates it, in table order
     */
    public static Map<FilterField, FilterRoute> plan(final SearchFilters filters) {
        final Map<FilterField, FilterRoute> routes = new EnumMap<>(FilterField.class);
        for (FilterField field : FilterField.values()) {
            if (field.isPresent(filters)) {
                routes.put(field, field.route());
            }
        }
        return routes;
    }

    /**
     * Rejects filter combinations that are not well defined.
     *
     * <p>{@code hasNoFeedback} subtracts agents with feedback from a candidate set, so one
     * of {@code agentIds}, {@code keyword} or a metadata filter must bound the universe.
     *
     * @throws InvalidFilterException if the combination is ill-defined
     */
    public static void validate(final SearchFilters filters) {
        final FeedbackFilters feedback = filters.feedback();
        if (feedback == null || !feedback.wantsNoFeedback()) {
            return;
        }
        final boolean bounded = filters.agentIds() != null || filters.hasKeyword() || filters.metadataKey() != null;
        if (!bounded) {
            throw new InvalidFilterException("feedback.hasNoFeedback",
                    "requires a candidate set from agentIds, keyword or a metadata filter");
        }
    }
}
