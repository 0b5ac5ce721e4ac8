// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.search;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.scry.core.DebugLogger;
import sh.scry.core.LogFormatter;
import sh.scry.core.erc8004.AgentId;
import sh.scry.core.error.AgentNotFoundException;
import sh.scry.core.error.BackendException;
import sh.scry.core.error.InvalidFilterException;
import sh.scry.core.error.SearchInterruptedException;
import sh.scry.core.error.SemanticSearchException;
import sh.scry.core.model.AgentSummary;
import sh.scry.core.model.Feedback;
import sh.scry.core.model.FeedbackFilters;
import sh.scry.core.model.FeedbackSearchParams;
import sh.scry.core.model.FeedbackStats;
import sh.scry.core.model.SearchFilters;
import sh.scry.core.model.SearchOptions;
import sh.scry.core.model.SortDirection;
import sh.scry.core.query.Criterion;
import sh.scry.rpc.AgentBackend;
import sh.scry.rpc.Paginator;
import sh.scry.rpc.ScryExecutors;
import sh.scry.rpc.model.AgentRow;
import sh.scry.rpc.semantic.SemanticSearchClient;
import sh.scry.search.filter.FilterCompiler;
import sh.scry.search.prefilter.FeedbackPrefilter;
import sh.scry.search.prefilter.FeedbackScan;
import sh.scry.search.prefilter.MetadataPrefilter;
import sh.scry.search.refresh.AgentHydrator;
import sh.scry.search.refresh.AgentRefresher;
import sh.scry.search.refresh.SummaryCache;
import sh.scry.search.semantic.SemanticCandidates;
import sh.scry.search.semantic.SemanticSearchGateway;

/**
 * Cross-chain discovery over ERC-8004 agent registries.
 *
 * <p>A search runs in stages. Filters are validated and compiled into one backend
 * predicate; the participating chains are resolved; a keyword is sent to the
 * relevance service once. Each chain then narrows its candidate ids (relevance
 * hits, explicit ids, metadata entries, feedback aggregates, in that order), skips
 * the structured query entirely when the candidates run out, and otherwise pages
 * agents matching the predicate, restricted to the candidates in fixed-size chunks.
 * Chains run in parallel; the merged list is sorted once all chains complete.
 *
 * <pre>{@code
 * try (AgentIndexer indexer = AgentIndexer.builder()
 *         .registry(ConfiguredBackendRegistry.builder().override(1, url).build())
 *         .build()) {
 *     List<AgentSummary> agents = indexer.search(
 *             SearchFilters.builder().keyword("price oracle").hasMcp(true).build(),
 *             SearchOptions.sortedBy("semanticScore:desc"));
 * }
 * }</pre>
 *
 * <p>Instances are thread-safe.
 */
public final class AgentIndexer implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(AgentIndexer.class);

    public static final int DEFAULT_PARALLELISM = 4;
    public static final int DEFAULT_ID_CHUNK_SIZE = 500;

    private final long defaultChainId;
    private final BackendRegistry registry;
    private final ChainResolver chainResolver;
    private final SemanticSearchClient semanticClient;
    private final SemanticSearchGateway semanticGateway;
    private final double semanticMinScore;
    private final int semanticLimit;
    private final int pageSize;
    private final int idChunkSize;
    private final MetadataPrefilter metadataPrefilter;
    private final FeedbackPrefilter feedbackPrefilter;
    private final ExecutorService executor;
    private final boolean ownsExecutor;
    private final ChainFanOut fanOut;
    private final SummaryCache cache;
    private final @Nullable AgentRefresher refresher;

    private AgentIndexer(final Builder b) {
        this.defaultChainId = b.defaultChainId;
        this.registry = b.registry != null ? b.registry : ConfiguredBackendRegistry.builder().build();
        final List<Long> defaults = b.defaultChains != null
                ? b.defaultChains
                : ChainResolver.defaultChainsFor(b.defaultChainId);
        this.chainResolver = new ChainResolver(defaults, registry::configuredChains);
        this.semanticClient = b.semanticClient != null ? b.semanticClient : SemanticSearchClient.http();
        this.semanticGateway = new SemanticSearchGateway(semanticClient);
        this.semanticMinScore = b.semanticMinScore;
        this.semanticLimit = b.semanticLimit;
        this.pageSize = b.pageSize;
        this.idChunkSize = b.idChunkSize;
        this.metadataPrefilter = new MetadataPrefilter(b.pageSize);
        this.feedbackPrefilter = new FeedbackPrefilter(b.pageSize, b.idChunkSize);
        this.ownsExecutor = b.executor == null;
        this.executor = b.executor != null ? b.executor : ScryExecutors.newIoBoundExecutor(b.parallelism);
        this.fanOut = new ChainFanOut(executor);
        this.cache = b.cache != null ? b.cache : new SummaryCache();
        this.refresher = b.hydrator == null ? null : new AgentRefresher(b.hydrator, cache, executor, defaultChainId);
    }

    public static Builder builder() {
        return new Builder();
    }

    public long defaultChainId() {
        return defaultChainId;
    }

    public SummaryCache cache() {
        return cache;
    }

    // ═══════════════════════════════════════════════════════════════════
    // Search
    // ═══════════════════════════════════════════════════════════════════

    public List<AgentSummary> search(final SearchFilters filters) {
        return search(filters, SearchOptions.defaults());
    }

    /**
     * Finds agents matching every present filter across the resolved chains.
     *
     * @throws InvalidFilterException    if the filters are ill-defined or a value does not parse
     * @throws SemanticSearchException   if a keyword is given and the relevance service fails
     * @throws BackendException          if any chain's backend fails
     * @throws SearchInterruptedException if the calling thread is interrupted
     */
    public List<AgentSummary> search(final SearchFilters filters, final SearchOptions options) {
        Objects.requireNonNull(filters, "filters");
        Objects.requireNonNull(options, "options");
        final long start = System.nanoTime();

        FilterCompiler.validate(filters);
        final boolean keyword = filters.hasKeyword();
        final SortSpec sort = SortSpec.parse(options.sort(), keyword);
        final List<Long> chains = chainResolver.resolve(filters.chains());
        final Criterion where = FilterCompiler.compile(filters);
        final Map<Long, List<String>> idsByChain = filters.agentIds() == null
                ? null
                : CandidateSets.partitionAgentIds(filters.agentIds(), chains);
        final SemanticCandidates semantic = keyword
                ? semanticGateway.search(filters.keyword(), chains,
                        options.semanticMinScore() != null ? options.semanticMinScore() : semanticMinScore,
                        options.semanticLimit() != null ? options.semanticLimit() : semanticLimit)
                : null;
        DebugLogger.logSearch(LogFormatter.formatPlan(FilterCompiler.plan(filters)));

        final ChainSearch plan = new ChainSearch(filters, where, sort, idsByChain, semantic);
        final List<List<AgentSummary>> perChain = fanOut.run(chains, chain -> searchChain(chain, plan));

        final List<AgentSummary> merged = new ArrayList<>();
        perChain.forEach(merged::addAll);
        final List<AgentSummary> sorted = ResultSorter.sort(merged, sort);
        DebugLogger.logSearch(LogFormatter.formatSearch(chains, keyword, sorted.size(),
                (System.nanoTime() - start) / 1_000L));
        return sorted;
    }

    private List<AgentSummary> searchChain(final long chainId, final ChainSearch plan) {
        final Optional<AgentBackend> found = registry.backendFor(chainId);
        if (found.isEmpty()) {
            LOG.warn("No backend configured for chain {}; skipping", chainId);
            DebugLogger.logSearch(LogFormatter.formatChainSkip(chainId, "no backend configured"));
            return List.of();
        }
        final AgentBackend backend = found.get();
        final SearchFilters filters = plan.filters();

        List<String> universe = plan.semantic() == null ? null : plan.semantic().idsFor(chainId);
        if (plan.idsByChain() != null) {
            universe = CandidateSets.intersect(universe, plan.idsByChain().getOrDefault(chainId, List.of()));
        }
        if (CandidateSets.isExhausted(universe)) {
            return skip(chainId, "no candidates");
        }

        final String metadataKey = filters.metadataKey();
        if (metadataKey != null) {
            universe = CandidateSets.intersect(universe,
                    metadataPrefilter.scan(chainId, backend, metadataKey, filters.metadataExpectedValue()));
            if (CandidateSets.isExhausted(universe)) {
                return skip(chainId, "no metadata matches");
            }
        }

        Map<String, FeedbackStats> stats = Map.of();
        final FeedbackFilters feedback = filters.feedback();
        if (feedback != null && feedback.requiresScan()) {
            final FeedbackScan scan = feedbackPrefilter.scan(chainId, backend, feedback, universe);
            universe = CandidateSets.intersect(universe, scan.candidates());
            stats = scan.stats();
            if (CandidateSets.isExhausted(universe)) {
                return skip(chainId, "no feedback matches");
            }
        }

        final List<AgentRow> rows = fetchAgents(backend, plan, universe);
        final List<AgentSummary> results = new ArrayList<>(rows.size());
        for (AgentRow row : rows) {
            AgentSummary summary = SummaryMapper.fromRow(chainId, row);
            final FeedbackStats agentStats = stats.get(summary.agentId());
            if (agentStats != null && agentStats.count() > 0) {
                summary = summary.withAverageValue(agentStats.average());
            }
            if (plan.semantic() != null) {
                summary = summary.withSemanticScore(plan.semantic().score(summary.agentId()));
            }
            results.add(summary);
        }
        return results;
    }

    private List<AgentRow> fetchAgents(final AgentBackend backend, final ChainSearch plan,
            final @Nullable List<String> universe) {
        // Relevance order is unknown to the backend; keyword pages come newest first and are re-sorted later.
        final boolean keyword = plan.semantic() != null;
        final String orderBy = keyword ? SortSpec.UPDATED_AT : plan.sort().backendField();
        final SortDirection direction = keyword ? SortDirection.DESC : plan.sort().direction();
        if (universe == null) {
            return Paginator.exhaust(pageSize,
                    (first, skip) -> backend.queryAgents(plan.where(), first, skip, orderBy, direction));
        }
        final List<AgentRow> rows = new ArrayList<>();
        for (int from = 0; from < universe.size(); from += idChunkSize) {
            final Criterion chunk = FilterCompiler.restrictTo(plan.where(),
                    universe.subList(from, Math.min(universe.size(), from + idChunkSize)));
            rows.addAll(Paginator.exhaust(pageSize,
                    (first, skip) -> backend.queryAgents(chunk, first, skip, orderBy, direction)));
        }
        return rows;
    }

    private static List<AgentSummary> skip(final long chainId, final String reason) {
        DebugLogger.logSearch(LogFormatter.formatChainSkip(chainId, reason));
        return List.of();
    }

    // ═══════════════════════════════════════════════════════════════════
    // Lookups
    // ═══════════════════════════════════════════════════════════════════

    /**
     * Loads one agent from its chain's backend, or from the refresh cache when the
     * chain has no backend.
     *
     * @param agentId {@code chainId:tokenId}, or a bare token id on the default chain
     * @throws InvalidFilterException  if the id does not parse
     * @throws AgentNotFoundException  if the agent does not exist
     */
    public AgentSummary getAgent(final String agentId) {
        final AgentId id = parseAgentId("agentId", agentId);
        final Optional<AgentBackend> backend = registry.backendFor(id.chainId());
        if (backend.isPresent()) {
            return backend.get().agentById(id.toString())
                    .map(row -> SummaryMapper.fromRow(id.chainId(), row))
                    .orElseThrow(() -> new AgentNotFoundException(id.toString()));
        }
        return cache.get(id.toString()).orElseThrow(() -> new AgentNotFoundException(id.toString()));
    }

    /**
     * Lists feedback entries, newest first.
     *
     * <p>The query runs on the chain of the first agent, or the default chain when
     * no agent is given; it returns nothing when that chain has no backend.
     */
    public List<Feedback> searchFeedback(final FeedbackSearchParams params) {
        Objects.requireNonNull(params, "params");
        final List<String> agents = new ArrayList<>(params.agents().size());
        for (String agent : params.agents()) {
            agents.add(parseAgentId("agents", agent).toString());
        }
        final long chainId = agents.isEmpty() ? defaultChainId : AgentId.parse(agents.get(0)).chainId();
        final Optional<AgentBackend> backend = registry.backendFor(chainId);
        if (backend.isEmpty()) {
            DebugLogger.logSearch(LogFormatter.formatChainSkip(chainId, "no backend configured"));
            return List.of();
        }

        final List<Criterion> terms = new ArrayList<>();
        if (!agents.isEmpty()) {
            terms.add(Criterion.in("agent", agents));
        }
        if (!params.reviewers().isEmpty()) {
            final List<String> reviewers = new ArrayList<>(params.reviewers().size());
            for (String reviewer : params.reviewers()) {
                reviewers.add(reviewer.toLowerCase(Locale.ROOT));
            }
            terms.add(Criterion.in("clientAddress", reviewers));
        }
        if (!params.tags().isEmpty()) {
            terms.add(Criterion.or(Criterion.in("tag1", params.tags()), Criterion.in("tag2", params.tags())));
        }
        if (params.minValue() != null) {
            terms.add(Criterion.gte("value", decimal(params.minValue())));
        }
        if (params.maxValue() != null) {
            terms.add(Criterion.lte("value", decimal(params.maxValue())));
        }
        if (!params.includeRevoked()) {
            terms.add(Criterion.eq("isRevoked", false));
        }
        final Criterion where = Criterion.and(terms);

        final List<Feedback> out = new ArrayList<>();
        Paginator.drain(pageSize, (first, skip) -> backend.get().searchFeedback(where, first, skip),
                row -> out.add(FeedbackMapper.fromRow(row)));
        return out;
    }

    /**
     * @return the feedback entry, or empty when it does not exist or the chain has no backend
     */
    public Optional<Feedback> getFeedback(final String agentId, final String reviewer, final long feedbackIndex) {
        final AgentId id = parseAgentId("agentId", agentId);
        Objects.requireNonNull(reviewer, "reviewer");
        return registry.backendFor(id.chainId())
                .flatMap(backend -> backend.feedbackById(
                        Feedback.idOf(id.toString(), reviewer.toLowerCase(Locale.ROOT), feedbackIndex)))
                .map(FeedbackMapper::fromRow);
    }

    // ═══════════════════════════════════════════════════════════════════
    // Refresh
    // ═══════════════════════════════════════════════════════════════════

    /**
     * Re-hydrates agents from their registries and caches the results.
     *
     * @return the refreshed summaries; agents that failed are logged and omitted
     * @throws IllegalStateException if no hydrator was configured
     */
    public List<AgentSummary> refreshAgents(final List<String> agentIds, final int concurrency) {
        if (refresher == null) {
            throw new IllegalStateException("No AgentHydrator configured; pass one to AgentIndexer.Builder#hydrator");
        }
        return refresher.refresh(agentIds, concurrency);
    }

    public List<AgentSummary> refreshAgents(final List<String> agentIds) {
        return refreshAgents(agentIds, AgentRefresher.DEFAULT_CONCURRENCY);
    }

    @Override
    public void close() {
        if (ownsExecutor) {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        try {
            semanticClient.close();
        } catch (Exception e) {
            LOG.warn("Failed to close semantic search client", e);
        }
        try {
            registry.close();
        } catch (Exception e) {
            LOG.warn("Failed to close backend registry", e);
        }
    }

    private AgentId parseAgentId(final String field, final String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidFilterException(field, "agent id must not be blank");
        }
        try {
            return AgentId.parse(value.trim(), defaultChainId);
        } catch (IllegalArgumentException e) {
            throw new InvalidFilterException(field, e.getMessage(), e);
        }
    }

    private static String decimal(final double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    /**
     * Everything a per-chain task needs, computed once per search.
     */
    private record ChainSearch(
            SearchFilters filters,
            Criterion where,
            SortSpec sort,
            @Nullable Map<Long, List<String>> idsByChain,
            @Nullable SemanticCandidates semantic) {
    }

    public static final class Builder {
        private long defaultChainId = 1L;
        private List<Long> defaultChains;
        private BackendRegistry registry;
        private SemanticSearchClient semanticClient;
        private ExecutorService executor;
        private int parallelism = DEFAULT_PARALLELISM;
        private double semanticMinScore = SemanticSearchClient.DEFAULT_MIN_SCORE;
        private int semanticLimit = SemanticSearchClient.DEFAULT_LIMIT;
        private int pageSize = Paginator.DEFAULT_PAGE_SIZE;
        private int idChunkSize = DEFAULT_ID_CHUNK_SIZE;
        private AgentHydrator hydrator;
        private SummaryCache cache;

        private Builder() {
        }

        /**
         * Chain for unprefixed agent ids; also part of the default chain list.
         */
        public Builder defaultChainId(final long defaultChainId) {
            if (defaultChainId <= 0) {
                throw new IllegalArgumentException("defaultChainId must be positive, got: " + defaultChainId);
            }
            this.defaultChainId = defaultChainId;
            return this;
        }

        /**
         * Chains searched when the filters name none. Defaults to {@code {1, defaultChainId}}.
         */
        public Builder defaultChains(final List<Long> defaultChains) {
            this.defaultChains = List.copyOf(defaultChains);
            return this;
        }

        public Builder registry(final BackendRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder semanticClient(final SemanticSearchClient semanticClient) {
            this.semanticClient = semanticClient;
            return this;
        }

        /**
         * Executor for per-chain work and refreshes. Not shut down by {@link AgentIndexer#close()}.
         */
        public Builder executor(final ExecutorService executor) {
            this.executor = executor;
            return this;
        }

        /**
         * Size of the internally created executor; ignored when {@link #executor} is set.
         */
        public Builder parallelism(final int parallelism) {
            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be at least 1, got: " + parallelism);
            }
            this.parallelism = parallelism;
            return this;
        }

        public Builder semanticMinScore(final double semanticMinScore) {
            this.semanticMinScore = semanticMinScore;
            return this;
        }

        public Builder semanticLimit(final int semanticLimit) {
            if (semanticLimit < 1) {
                throw new IllegalArgumentException("semanticLimit must be at least 1, got: " + semanticLimit);
            }
            this.semanticLimit = semanticLimit;
            return this;
        }

        public Builder pageSize(final int pageSize) {
            if (pageSize < 1) {
                throw new IllegalArgumentException("pageSize must be at least 1, got: " + pageSize);
            }
            this.pageSize = pageSize;
            return this;
        }

        public Builder idChunkSize(final int idChunkSize) {
            if (idChunkSize < 1) {
                throw new IllegalArgumentException("idChunkSize must be at least 1, got: " + idChunkSize);
            }
            this.idChunkSize = idChunkSize;
            return this;
        }

        public Builder hydrator(final AgentHydrator hydrator) {
            this.hydrator = hydrator;
            return this;
        }

        public Builder cache(final SummaryCache cache) {
            this.cache = cache;
            return this;
        }

        public AgentIndexer build() {
            return new AgentIndexer(this);
        }
    }
}
