// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.rpc;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.StringJoiner;

import sh.scry.core.query.Criterion;

/**
 * The set of {@link SchemaRule}s active for one backend deployment.
 *
 * <p>Profiles are immutable; widening returns a new instance. The canonical
 * profile has no active rules and produces queries for the newest schema.
 */
public final class SchemaProfile {

    private static final SchemaProfile CANONICAL = new SchemaProfile(EnumSet.noneOf(SchemaRule.class));

    private static final String REGISTRATION_FILE = "registrationFile";

    private final Set<SchemaRule> active;

    private SchemaProfile(Set<SchemaRule> active) {
        this.active = Collections.unmodifiableSet(active);
    }

    public static SchemaProfile canonical() {
        return CANONICAL;
    }

    public static SchemaProfile of(Collection<SchemaRule> rules) {
        return rules.isEmpty() ? CANONICAL : new SchemaProfile(EnumSet.copyOf(rules));
    }

    /**
     * Derives the profile from introspected field names, keyed by GraphQL type name.
     *
     * <p>A rule is activated only when its type was introspected and lacks the
     * canonical field. Types missing from the map are assumed canonical.
     * {@code AgentRegistrationFile_filter} input fields are consulted for the OASF rule too.
     */
    public static SchemaProfile fromIntrospection(Map<String, Set<String>> fieldsByType) {
        final Set<SchemaRule> rules = EnumSet.noneOf(SchemaRule.class);
        for (SchemaRule rule : SchemaRule.values()) {
            final Set<String> fields = fieldsByType.get(rule.typeName());
            if (fields != null && !fields.contains(rule.field())) {
                rules.add(rule);
            }
        }
        final Set<String> filterInputs = fieldsByType.get("AgentRegistrationFile_filter");
        if (filterInputs != null && !filterInputs.contains("hasOASF")) {
            rules.add(SchemaRule.OASF_ENDPOINT_FALLBACK);
        }
        return of(rules);
    }

    public Set<SchemaRule> rules() {
        return active;
    }

    public boolean has(SchemaRule rule) {
        return active.contains(rule);
    }

    public SchemaProfile with(Collection<SchemaRule> rules) {
        final Set<SchemaRule> merged = EnumSet.noneOf(SchemaRule.class);
        merged.addAll(active);
        merged.addAll(rules);
        return of(merged);
    }

    /**
     * Resolves the deployed name of a field, empty if the field is dropped.
     */
    public Optional<String> field(String typeName, String field) {
        for (SchemaRule rule : active) {
            if (rule.typeName().equals(typeName) && rule.field().equals(field)) {
                return Optional.ofNullable(rule.replacement());
            }
        }
        return Optional.of(field);
    }

    /**
     * Renders a selection set body for {@code typeName}, applying renames and drops.
     */
    public String selection(String typeName, List<String> fields) {
        final StringJoiner joiner = new StringJoiner(" ");
        for (String field : fields) {
            field(typeName, field).ifPresent(joiner::add);
        }
        return joiner.toString();
    }

    /**
     * Rewrites a filter condition on the registration file into the deployed schema.
     */
    public Criterion.Field rewrite(Criterion.Field condition) {
        final List<String> segments = condition.segments();
        if (segments.size() != 2 || !REGISTRATION_FILE.equals(segments.get(0))) {
            return condition;
        }
        final String name = segments.get(1);
        if ("hasOASF".equals(name) && has(SchemaRule.OASF_ENDPOINT_FALLBACK)
                && condition.op() == Criterion.Operator.EQ) {
            final String path = REGISTRATION_FILE + ".oasfEndpoint";
            return Boolean.TRUE.equals(condition.value()) ? Criterion.notNull(path) : Criterion.isNull(path);
        }
        return field("AgentRegistrationFile", name)
                .map(deployed -> deployed.equals(name) ? condition : condition.withPath(REGISTRATION_FILE + "." + deployed))
                .orElse(condition);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SchemaProfile other && active.equals(other.active);
    }

    @Override
    public int hashCode() {
        return active.hashCode();
    }

    @Override
    public String toString() {
        return "SchemaProfile" + active;
    }
}
