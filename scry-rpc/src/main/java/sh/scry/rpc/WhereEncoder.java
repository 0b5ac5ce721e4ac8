// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.rpc;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import sh.scry.core.query.Criterion;

/**
 * Encodes a {@link Criterion} tree as a subgraph {@code where} object.
 *
 * <p>Mapping:
 * <ul>
 * <li>{@code EQ} → {@code field}, {@code IN} → {@code field_in}, {@code GT/GTE/LT/LTE} → {@code field_gt...}</li>
 * <li>{@code CONTAINS} → {@code field_contains: [value]} (list membership)</li>
 * <li>{@code CONTAINS_NOCASE} → {@code field_contains_nocase}</li>
 * <li>{@code IS_NULL} → {@code field: null}, {@code NOT_NULL} → {@code field_not: null}</li>
 * <li>nested paths → {@code parent_: {...}}</li>
 * <li>{@code And} → conditions merged into one object; nested {@code And}/{@code Or} terms and key
 *     collisions go into {@code and: [base, ...]}</li>
 * <li>{@code Or} → {@code or: [...]}</li>
 * </ul>
 * Top-level {@code and}/{@code or} never share an object with plain field keys, which graph-node rejects.
 *
 * <p>Maps are {@link LinkedHashMap}s so that null operands survive and key order is stable.
 */
public final class WhereEncoder {

    private final SchemaProfile profile;

    public WhereEncoder(SchemaProfile profile) {
        this.profile = profile;
    }

    public Map<String, Object> encode(Criterion criterion) {
        if (criterion instanceof Criterion.And and) {
            return encodeAnd(and);
        }
        if (criterion instanceof Criterion.Or or) {
            final List<Object> alternatives = new ArrayList<>(or.terms().size());
            for (Criterion term : or.terms()) {
                alternatives.add(encode(term));
            }
            final Map<String, Object> out = new LinkedHashMap<>();
            out.put("or", alternatives);
            return out;
        }
        final Map<String, Object> out = new LinkedHashMap<>();
        put(out, (Criterion.Field) criterion);
        return out;
    }

    private Map<String, Object> encodeAnd(Criterion.And and) {
        final Map<String, Object> base = new LinkedHashMap<>();
        final List<Object> extra = new ArrayList<>();
        for (Criterion term : and.terms()) {
            if (term instanceof Criterion.Field field && put(base, field)) {
                continue;
            }
            extra.add(encode(term));
        }
        if (extra.isEmpty()) {
            return base;
        }
        final List<Object> conjuncts = new ArrayList<>(extra.size() + 1);
        if (!base.isEmpty()) {
            conjuncts.add(base);
        }
        conjuncts.addAll(extra);
        final Map<String, Object> out = new LinkedHashMap<>();
        out.put("and", conjuncts);
        return out;
    }

    /**
     * Adds the condition to {@code target}; returns false when its key is already taken.
     */
    @SuppressWarnings("unchecked")
    private boolean put(Map<String, Object> target, Criterion.Field condition) {
        final Criterion.Field field = profile.rewrite(condition);
        final List<String> segments = field.segments();
        Map<String, Object> node = target;
        for (int i = 0; i < segments.size() - 1; i++) {
            final String key = segments.get(i) + "_";
            final Object existing = node.get(key);
            if (existing == null) {
                final Map<String, Object> child = new LinkedHashMap<>();
                node.put(key, child);
                node = child;
            } else {
                node = (Map<String, Object>) existing;
            }
        }
        final String leaf = segments.get(segments.size() - 1) + suffix(field.op());
        if (node.containsKey(leaf)) {
            return false;
        }
        node.put(leaf, operand(field));
        return true;
    }

    private static String suffix(Criterion.Operator op) {
        switch (op) {
            case EQ:
            case IS_NULL:
                return "";
            case IN:
                return "_in";
            case GT:
                return "_gt";
            case GTE:
                return "_gte";
            case LT:
                return "_lt";
            case LTE:
                return "_lte";
            case CONTAINS:
                return "_contains";
            case CONTAINS_NOCASE:
                return "_contains_nocase";
            case NOT_NULL:
                return "_not";
            default:
                throw new IllegalArgumentException("Unsupported operator: " + op);
        }
    }

    private static Object operand(Criterion.Field field) {
        if (field.op() == Criterion.Operator.CONTAINS) {
            return List.of(field.value());
        }
        return field.value();
    }
}
