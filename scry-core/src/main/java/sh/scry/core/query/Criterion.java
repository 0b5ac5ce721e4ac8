// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.core.query;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

/**
 * Backend-agnostic predicate tree over agent, metadata and feedback entities.
 *
 * <p>A tree is built from {@link And}, {@link Or} and {@link Field} nodes. Field
 * paths use dots for nested entities, e.g. {@code registrationFile.mcpEndpoint}.
 * An empty {@code And} matches everything. Encoding into a concrete wire format
 * is the job of the backend client.
 *
 * <pre>{@code
 * Criterion where = Criterion.and(
 *     Criterion.notNull("registrationFile"),
 *     Criterion.containsNoCase("registrationFile.name", "oracle"),
 *     Criterion.or(
 *         Criterion.contains("registrationFile.mcpTools", "search"),
 *         Criterion.contains("registrationFile.mcpTools", "fetch")));
 * }</pre>
 */
public sealed interface Criterion permits Criterion.And, Criterion.Or, Criterion.Field {

    /** Matches everything. */
    Criterion ALWAYS = new And(List.of());

    /**
     * Comparison applied by a {@link Field} node.
     */
    enum Operator {
        /** Equal to the value. */
        EQ,
        /** Equal to any element of a collection value. */
        IN,
        GT,
        GTE,
        LT,
        LTE,
        /** A list-valued field contains the value as an element. */
        CONTAINS,
        /** A string field contains the value as a case-insensitive substring. */
        CONTAINS_NOCASE,
        IS_NULL,
        NOT_NULL
    }

    record And(List<Criterion> terms) implements Criterion {
        public And {
            terms = List.copyOf(terms);
        }
    }

    record Or(List<Criterion> terms) implements Criterion {
        public Or {
            terms = List.copyOf(terms);
            if (terms.isEmpty()) {
                throw new IllegalArgumentException("or requires at least one term");
            }
        }
    }

    /**
     * Leaf condition on a single field.
     *
     * @param path  dotted field path
     * @param op    comparison operator
     * @param value operand; null only for {@link Operator#IS_NULL} and {@link Operator#NOT_NULL},
     *              an immutable list for {@link Operator#IN}
     */
    record Field(String path, Operator op, @Nullable Object value) implements Criterion {
        public Field {
            Objects.requireNonNull(path, "path");
            Objects.requireNonNull(op, "op");
            if (op == Operator.IS_NULL || op == Operator.NOT_NULL) {
                value = null;
            } else {
                Objects.requireNonNull(value, "value for " + op);
            }
            if (op == Operator.IN) {
                if (!(value instanceof Collection<?> values)) {
                    throw new IllegalArgumentException("IN requires a collection value");
                }
                value = List.copyOf(values);
            }
        }

        /**
         * @return the path segments, e.g. {@code [registrationFile, name]}
         */
        public List<String> segments() {
            return Arrays.asList(path.split("\\."));
        }

        public boolean isNested() {
            return path.indexOf('.') >= 0;
        }

        public Field withPath(String newPath) {
            return new Field(newPath, op, value);
        }
    }

    static Criterion and(Criterion... terms) {
        return and(Arrays.asList(terms));
    }

    /**
     * Builds a conjunction, flattening nested {@code And}s and collapsing single terms.
     */
    static Criterion and(List<? extends Criterion> terms) {
        final List<Criterion> flat = new ArrayList<>();
        for (Criterion term : terms) {
            if (term instanceof And nested) {
                flat.addAll(nested.terms());
            } else {
                flat.add(term);
            }
        }
        return flat.size() == 1 ? flat.get(0) : new And(flat);
    }

    static Criterion or(Criterion... terms) {
        return new Or(Arrays.asList(terms));
    }

    static Criterion or(List<? extends Criterion> terms) {
        return new Or(new ArrayList<>(terms));
    }

    static Field eq(String path, Object value) {
        return new Field(path, Operator.EQ, value);
    }

    static Field in(String path, Collection<?> values) {
        return new Field(path, Operator.IN, values);
    }

    static Field gt(String path, Object value) {
        return new Field(path, Operator.GT, value);
    }

    static Field gte(String path, Object value) {
        return new Field(path, Operator.GTE, value);
    }

    static Field lt(String path, Object value) {
        return new Field(path, Operator.LT, value);
    }

    static Field lte(String path, Object value) {
        return new Field(path, Operator.LTE, value);
    }

    static Field contains(String path, Object element) {
        return new Field(path, Operator.CONTAINS, element);
    }

    static Field containsNoCase(String path, String substring) {
        return new Field(path, Operator.CONTAINS_NOCASE, substring);
    }

    static Field isNull(String path) {
        return new Field(path, Operator.IS_NULL, null);
    }

    static Field notNull(String path) {
        return new Field(path, Operator.NOT_NULL, null);
    }
}
