// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.search;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.function.ToDoubleFunction;

import org.jspecify.annotations.Nullable;

import sh.scry.core.model.AgentSummary;
import sh.scry.core.model.SortDirection;

/**
 * Final in-memory ordering of merged cross-chain results.
 *
 * <p>{@code name} compares case-insensitively. Every other field is coerced to a
 * double, with {@code 0.0} for missing or unparsable values; unknown fields
 * therefore leave the input order untouched. The sort is stable, so ties keep
 * chain order and, within a chain, backend order.
 */
public final class ResultSorter {

    private ResultSorter() {
    }

    public static List<AgentSummary> sort(final List<AgentSummary> results, final SortSpec spec) {
        final List<AgentSummary> out = new ArrayList<>(results);
        Comparator<AgentSummary> comparator = comparator(spec.field());
        if (spec.direction() == SortDirection.DESC) {
            comparator = comparator.reversed();
        }
        out.sort(comparator);
        return out;
    }

    static Comparator<AgentSummary> comparator(final String field) {
        if ("name".equals(field)) {
            return Comparator.comparing(s -> s.name() == null ? "" : s.name().toLowerCase(Locale.ROOT));
        }
        return Comparator.comparingDouble(numeric(field));
    }

    private static ToDoubleFunction<AgentSummary> numeric(final String field) {
        switch (field) {
            case "createdAt":
                return s -> coerce(s.createdAt());
            case "updatedAt":
                return s -> coerce(s.updatedAt());
            case "lastActivity":
                return s -> coerce(s.lastActivity());
            case "chainId":
                return AgentSummary::chainId;
            case "totalFeedback":
                return s -> coerce(s.feedbackCount());
            case "semanticScore":
                return s -> s.semanticScore() == null ? 0.0 : s.semanticScore();
            case "averageValue":
                return s -> s.averageValue() == null ? 0.0 : s.averageValue();
            default:
                return s -> 0.0;
        }
    }

    static double coerce(final @Nullable String value) {
        if (value == null) {
            return 0.0;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            return 0.0;
        }
    }
}
