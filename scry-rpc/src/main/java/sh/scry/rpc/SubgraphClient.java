// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.rpc;

import java.time.Duration;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.scry.core.DebugLogger;
import sh.scry.core.LogFormatter;
import sh.scry.core.error.BackendException;
import sh.scry.core.model.SortDirection;
import sh.scry.core.query.Criterion;
import sh.scry.rpc.model.AgentRow;
import sh.scry.rpc.model.FeedbackRow;
import sh.scry.rpc.model.MetadataRow;

/**
 * {@link AgentBackend} over an ERC-8004 subgraph.
 *
 * <p>Deployments drift: fields get renamed or are missing on older indexers. The
 * client probes the schema once, lazily, with an introspection query and renders
 * every query through the resulting {@link SchemaProfile}. When introspection is
 * disabled on the endpoint the profile starts canonical; a query that then fails
 * because a known field is missing activates the matching {@link SchemaRule}s and
 * is retried exactly once. Any other failure propagates.
 *
 * <pre>{@code
 * try (SubgraphClient client = SubgraphClient.connect(url)) {
 *     List<AgentRow> page = client.queryAgents(
 *         Criterion.notNull("registrationFile"), 100, 0, "updatedAt", SortDirection.DESC);
 * }
 * }</pre>
 */
public final class SubgraphClient implements AgentBackend {

    private static final Logger LOG = LoggerFactory.getLogger(SubgraphClient.class);

    private final GraphQlTransport transport;
    private final boolean probeSchema;
    private final Object profileLock = new Object();
    private volatile SchemaProfile profile;

    public SubgraphClient(final GraphQlTransport transport) {
        this(transport, true);
    }

    public SubgraphClient(final GraphQlTransport transport, final boolean probeSchema) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.probeSchema = probeSchema;
    }

    public static SubgraphClient connect(final String url) {
        return builder(url).build();
    }

    public static Builder builder(final String url) {
        return new Builder(url);
    }

    public String endpoint() {
        return transport.endpoint();
    }

    /**
     * Returns the active profile, probing the deployment on first use.
     */
    public SchemaProfile schemaProfile() {
        SchemaProfile current = profile;
        if (current != null) {
            return current;
        }
        synchronized (profileLock) {
            if (profile == null) {
                profile = probeSchema ? probe() : SchemaProfile.canonical();
            }
            return profile;
        }
    }

    @Override
    public List<AgentRow> queryAgents(
            final Criterion where, final int first, final int skip, final String orderBy, final SortDirection direction) {
        return run(SubgraphQueries.SEARCH_AGENTS,
                p -> new GraphQlRequest(SubgraphQueries.searchAgents(p),
                        pageVariables(p, where, first, skip, orderBy, direction), SubgraphQueries.SEARCH_AGENTS),
                r -> r.list("agents", AgentRow.class));
    }

    @Override
    public List<MetadataRow> queryMetadata(final Criterion where, final int first, final int skip) {
        return run(SubgraphQueries.AGENT_METADATA,
                p -> new GraphQlRequest(SubgraphQueries.agentMetadata(p),
                        pageVariables(p, where, first, skip, null, null), SubgraphQueries.AGENT_METADATA),
                r -> r.list("rows", MetadataRow.class));
    }

    @Override
    public List<FeedbackRow> queryFeedback(final Criterion where, final int first, final int skip) {
        return run(SubgraphQueries.FEEDBACK_ROWS,
                p -> new GraphQlRequest(SubgraphQueries.feedbackRows(),
                        pageVariables(p, where, first, skip, null, null), SubgraphQueries.FEEDBACK_ROWS),
                r -> r.list("feedbacks", FeedbackRow.class));
    }

    @Override
    public List<FeedbackRow> searchFeedback(final Criterion where, final int first, final int skip) {
        return run(SubgraphQueries.SEARCH_FEEDBACK,
                p -> new GraphQlRequest(SubgraphQueries.searchFeedback(p),
                        pageVariables(p, where, first, skip, null, null), SubgraphQueries.SEARCH_FEEDBACK),
                r -> r.list("feedbacks", FeedbackRow.class));
    }

    @Override
    public Optional<AgentRow> agentById(final String id) {
        return run(SubgraphQueries.AGENT_BY_ID,
                p -> new GraphQlRequest(SubgraphQueries.agentById(p), Map.of("id", id), SubgraphQueries.AGENT_BY_ID),
                r -> r.object("agent", AgentRow.class));
    }

    @Override
    public Optional<FeedbackRow> feedbackById(final String id) {
        return run(SubgraphQueries.FEEDBACK_BY_ID,
                p -> new GraphQlRequest(SubgraphQueries.feedbackById(p), Map.of("id", id),
                        SubgraphQueries.FEEDBACK_BY_ID),
                r -> r.object("feedback", FeedbackRow.class));
    }

    @Override
    public void close() {
        try {
            transport.close();
        } catch (Exception e) {
            LOG.warn("Failed to close transport for {}", transport.endpoint(), e);
        }
    }

    private <T> T run(
            final String operation,
            final Function<SchemaProfile, GraphQlRequest> request,
            final Function<GraphQlResponse, T> extract) {
        final SchemaProfile current = schemaProfile();
        try {
            return extract.apply(transport.execute(request.apply(current)));
        } catch (BackendException e) {
            final Set<SchemaRule> fixes = SchemaRule.fixesFor(e, current.rules());
            if (fixes.isEmpty()) {
                throw e;
            }
            final SchemaProfile widened = widen(fixes);
            for (SchemaRule rule : fixes) {
                LOG.debug("Subgraph {} lacks {}.{}; retrying {} with {}",
                        transport.endpoint(), rule.typeName(), rule.field(), operation, rule);
                DebugLogger.logQuery(LogFormatter.formatShim(rule.name(), operation));
            }
            return extract.apply(transport.execute(request.apply(widened)));
        }
    }

    private SchemaProfile widen(final Set<SchemaRule> rules) {
        synchronized (profileLock) {
            profile = schemaProfile().with(rules);
            return profile;
        }
    }

    private SchemaProfile probe() {
        try {
            final GraphQlResponse response = transport.execute(
                    new GraphQlRequest(SubgraphQueries.SCHEMA_PROBE_QUERY, Map.of(), SubgraphQueries.SCHEMA_PROBE));
            final Map<String, Set<String>> fieldsByType = new HashMap<>();
            collect(response, "queryType", "Query", fieldsByType);
            collect(response, "agent", "Agent", fieldsByType);
            collect(response, "registrationFile", "AgentRegistrationFile", fieldsByType);
            collect(response, "registrationFileFilter", "AgentRegistrationFile_filter", fieldsByType);
            collect(response, "feedbackResponse", "FeedbackResponse", fieldsByType);
            final SchemaProfile probed = SchemaProfile.fromIntrospection(fieldsByType);
            if (!probed.rules().isEmpty()) {
                LOG.info("Subgraph {} uses schema variants {}", transport.endpoint(), probed.rules());
            }
            return probed;
        } catch (BackendException e) {
            LOG.debug("Schema introspection unavailable on {}: {}", transport.endpoint(), e.getMessage());
            return SchemaProfile.canonical();
        }
    }

    private static void collect(
            final GraphQlResponse response, final String alias, final String typeName,
            final Map<String, Set<String>> out) {
        response.object(alias, IntrospectedType.class).ifPresent(type -> out.put(typeName, type.names()));
    }

    private static Map<String, Object> pageVariables(
            final SchemaProfile profile, final Criterion where, final int first, final int skip,
            final String orderBy, final SortDirection direction) {
        final Map<String, Object> variables = new LinkedHashMap<>();
        variables.put("where", new WhereEncoder(profile).encode(where));
        variables.put("first", first);
        variables.put("skip", skip);
        if (orderBy != null) {
            variables.put("orderBy", orderBy);
            variables.put("orderDirection", (direction == null ? SortDirection.DESC : direction).wireValue());
        }
        return variables;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record IntrospectedType(List<NamedField> fields, List<NamedField> inputFields) {
        Set<String> names() {
            final List<NamedField> source = fields != null ? fields : inputFields;
            if (source == null) {
                return Set.of();
            }
            final Set<String> names = new HashSet<>();
            for (NamedField field : source) {
                if (field != null && field.name() != null) {
                    names.add(field.name());
                }
            }
            return names;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record NamedField(String name) {
    }

    public static final class Builder {
        private final HttpGraphQlTransport.Builder transport;
        private boolean probeSchema = true;

        private Builder(final String url) {
            this.transport = HttpGraphQlTransport.builder(url);
        }

        public Builder connectTimeout(final Duration connectTimeout) {
            transport.connectTimeout(connectTimeout);
            return this;
        }

        public Builder readTimeout(final Duration readTimeout) {
            transport.readTimeout(readTimeout);
            return this;
        }

        public Builder header(final String key, final String value) {
            transport.header(key, value);
            return this;
        }

        /**
         * Disables the introspection probe; schema variants are then learned from errors only.
         */
        public Builder probeSchema(final boolean probeSchema) {
            this.probeSchema = probeSchema;
            return this;
        }

        public SubgraphClient build() {
            return new SubgraphClient(transport.build(), probeSchema);
        }
    }
}
