// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.search;

import java.util.List;
import java.util.Set;

import sh.scry.core.model.SortDirection;

/**
 * The effective ordering of a search.
 *
 * <p>Only the first sort key is honoured. Without one, keyword searches order by
 * {@code semanticScore:desc} and all others by {@code updatedAt:desc}. Any direction
 * other than {@code asc} means descending. {@code feedbackCount} is an alias for
 * {@code totalFeedback}.
 *
 * @param field     the sort field, alias resolved
 * @param direction the sort direction
 */
public record SortSpec(String field, SortDirection direction) {

    static final String SEMANTIC_SCORE = "semanticScore";
    static final String UPDATED_AT = "updatedAt";

    private static final Set<String> BACKEND_FIELDS =
            Set.of("createdAt", "updatedAt", "name", "chainId", "lastActivity", "totalFeedback");

    public static SortSpec parse(final List<String> sort, final boolean keyword) {
        final String fallbackField = keyword ? SEMANTIC_SCORE : UPDATED_AT;
        final String spec = sort == null || sort.isEmpty() || sort.get(0) == null || sort.get(0).isBlank()
                ? fallbackField + ":desc"
                : sort.get(0).trim();
        final int sep = spec.indexOf(':');
        String field = sep < 0 ? spec : spec.substring(0, sep).trim();
        final String direction = sep < 0 ? "desc" : spec.substring(sep + 1);
        if (field.isEmpty()) {
            field = fallbackField;
        }
        if ("feedbackCount".equals(field)) {
            field = "totalFeedback";
        }
        return new SortSpec(field, SortDirection.parse(direction));
    }

    /**
     * The field the backend can order by natively; unknown fields fall back to {@code updatedAt}.
     */
    public String backendField() {
        return BACKEND_FIELDS.contains(field) ? field : UPDATED_AT;
    }
}
