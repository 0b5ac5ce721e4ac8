// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.search;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static sh.scry.search.InMemoryAgentBackend.agentRow;
import static sh.scry.search.InMemoryAgentBackend.feedbackRow;
import static sh.scry.search.InMemoryAgentBackend.file;
import static sh.scry.search.InMemoryAgentBackend.metadataRow;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import sh.scry.core.error.AgentNotFoundException;
import sh.scry.core.error.BackendException;
import sh.scry.core.error.InvalidFilterException;
import sh.scry.core.error.SemanticSearchException;
import sh.scry.core.model.AgentSummary;
import sh.scry.core.model.ChainSelector;
import sh.scry.core.model.Feedback;
import sh.scry.core.model.FeedbackFilters;
import sh.scry.core.model.FeedbackSearchParams;
import sh.scry.core.model.MetadataFilter;
import sh.scry.core.model.SearchFilters;
import sh.scry.core.model.SearchOptions;
import sh.scry.core.model.SortDirection;
import sh.scry.core.types.Hex;
import sh.scry.rpc.AgentBackend;
import sh.scry.rpc.semantic.SemanticHit;
import sh.scry.rpc.semantic.SemanticSearchClient;

class AgentIndexerTest {

    private final List<AgentIndexer> opened = new ArrayList<>();

    @AfterEach
    void closeIndexers() {
        opened.forEach(AgentIndexer::close);
    }

    private AgentIndexer indexer(final Map<Long, ? extends AgentBackend> backends, final SemanticSearchClient semantic) {
        return indexer(AgentIndexer.builder().registry(BackendRegistry.of(backends)).semanticClient(semantic));
    }

    private AgentIndexer indexer(final AgentIndexer.Builder builder) {
        final AgentIndexer indexer = builder.parallelism(2).build();
        opened.add(indexer);
        return indexer;
    }

    private static SemanticSearchClient noSemantic() {
        return (query, minScore, limit) -> {
            throw new AssertionError("relevance service must not be called");
        };
    }

    private static SemanticSearchClient hits(final SemanticHit... hits) {
        return (query, minScore, limit) -> List.of(hits);
    }

    private static List<String> ids(final List<AgentSummary> results) {
        return results.stream().map(AgentSummary::agentId).collect(Collectors.toList());
    }

    // ═══════════════════════════════════════════════════════════════════
    // Structured search
    // ═══════════════════════════════════════════════════════════════════

    @Test
    void nameFilterMatchesCaseInsensitivelyAndSortsByUpdatedAt() {
        final InMemoryAgentBackend chain1 = new InMemoryAgentBackend()
                .agent(agentRow("1:1", "Demo Bot", 300))
                .agent(agentRow("1:2", "demo helper", 500))
                .agent(agentRow("1:3", "Other", 400));
        final AgentIndexer indexer = indexer(Map.of(1L, chain1), noSemantic());

        final List<AgentSummary> results = indexer.search(
                SearchFilters.builder().name("Demo").chains(ChainSelector.of(1)).build());

        assertEquals(List.of("1:2", "1:1"), ids(results));
        assertAll(
                () -> assertEquals("demo helper", results.get(0).name()),
                () -> assertNull(results.get(0).semanticScore()),
                () -> assertEquals("updatedAt", chain1.calls("agents").get(0).orderBy()));
    }

    @Test
    void defaultChainsAreMainnetAndDefaultChain() {
        final InMemoryAgentBackend chain1 = new InMemoryAgentBackend().agent(agentRow("1:1", "a", 1));
        final InMemoryAgentBackend chain8453 = new InMemoryAgentBackend().agent(agentRow("8453:1", "b", 2));
        final InMemoryAgentBackend chain137 = new InMemoryAgentBackend().agent(agentRow("137:1", "c", 3));
        final AgentIndexer indexer = indexer(AgentIndexer.builder()
                .defaultChainId(8453)
                .registry(BackendRegistry.of(Map.of(1L, chain1, 8453L, chain8453, 137L, chain137)))
                .semanticClient(noSemantic()));

        assertEquals(List.of("8453:1", "1:1"), ids(indexer.search(SearchFilters.none())));
        assertTrue(chain137.calls().isEmpty());
    }

    @Test
    void allChainsSpansEveryConfiguredBackend() {
        final AgentIndexer indexer = indexer(Map.of(
                1L, new InMemoryAgentBackend().agent(agentRow("1:1", "a", 1)),
                137L, new InMemoryAgentBackend().agent(agentRow("137:1", "c", 3))), noSemantic());

        final List<AgentSummary> results = indexer.search(
                SearchFilters.builder().chains(ChainSelector.allChains()).build(),
                SearchOptions.sortedBy("chainId:asc"));

        assertEquals(List.of("1:1", "137:1"), ids(results));
    }

    @Test
    void chainWithoutBackendIsSkipped() {
        final AgentIndexer indexer = indexer(
                Map.of(1L, new InMemoryAgentBackend().agent(agentRow("1:1", "a", 1))), noSemantic());

        final List<AgentSummary> results = indexer.search(
                SearchFilters.builder().chains(ChainSelector.of(1, 59144)).build());

        assertEquals(List.of("1:1"), ids(results));
    }

    @Test
    void sortsByNameAcrossChains() {
        final AgentIndexer indexer = indexer(Map.of(
                1L, new InMemoryAgentBackend().agent(agentRow("1:1", "bravo", 1)).agent(agentRow("1:2", "Delta", 2)),
                10L, new InMemoryAgentBackend().agent(agentRow("10:1", "alpha", 3)).agent(agentRow("10:2", "Charlie", 4))),
                noSemantic());

        final List<AgentSummary> results = indexer.search(
                SearchFilters.builder().chains(ChainSelector.of(1, 10)).build(),
                SearchOptions.sortedBy("name:asc"));

        assertEquals(List.of("10:1", "1:1", "10:2", "1:2"), ids(results));
    }

    @Test
    void feedbackCountSortUsesBackendCounter() {
        final Map<String, Object> few = agentRow("1:1", "few", 1);
        few.put("totalFeedback", "2");
        final Map<String, Object> many = agentRow("1:2", "many", 2);
        many.put("totalFeedback", "12");
        final InMemoryAgentBackend chain1 = new InMemoryAgentBackend().agent(few).agent(many);
        final AgentIndexer indexer = indexer(Map.of(1L, chain1), noSemantic());

        final List<AgentSummary> results = indexer.search(
                SearchFilters.builder().chains(ChainSelector.of(1)).build(),
                SearchOptions.sortedBy("feedbackCount:desc"));

        assertEquals(List.of("1:2", "1:1"), ids(results));
        assertEquals("totalFeedback", chain1.calls("agents").get(0).orderBy());
    }

    @Test
    void pushesDownEndpointAndListFilters() {
        final Map<String, Object> mcp = agentRow("1:1", "tools", 1);
        file(mcp).put("mcpEndpoint", "https://mcp.example/sse");
        file(mcp).put("mcpTools", List.of("search", "fetch"));
        final Map<String, Object> bare = agentRow("1:2", "bare", 2);
        final Map<String, Object> noFile = agentRow("1:3", "none", 3);
        noFile.remove("registrationFile");
        final AgentIndexer indexer = indexer(Map.of(1L,
                new InMemoryAgentBackend().agent(mcp).agent(bare).agent(noFile)), noSemantic());

        assertAll(
                () -> assertEquals(List.of("1:1"), ids(indexer.search(SearchFilters.builder()
                        .chains(ChainSelector.of(1)).hasMcp(true).build()))),
                () -> assertEquals(List.of("1:1"), ids(indexer.search(SearchFilters.builder()
                        .chains(ChainSelector.of(1)).mcpTools(List.of("fetch", "missing")).build()))),
                () -> assertEquals(List.of("1:2", "1:1"), ids(indexer.search(SearchFilters.builder()
                        .chains(ChainSelector.of(1)).build()))),
                () -> assertEquals(List.of("1:3"), ids(indexer.search(SearchFilters.builder()
                        .chains(ChainSelector.of(1)).hasRegistrationFile(false).build()))));
    }

    @Test
    void hasFeedbackAloneUsesTheCounterWithoutScanningRows() {
        final Map<String, Object> reviewed = agentRow("1:1", "reviewed", 1);
        reviewed.put("totalFeedback", "3");
        final InMemoryAgentBackend chain1 = new InMemoryAgentBackend()
                .agent(reviewed)
                .agent(agentRow("1:2", "quiet", 2));
        final AgentIndexer indexer = indexer(Map.of(1L, chain1), noSemantic());

        final List<AgentSummary> results = indexer.search(SearchFilters.builder()
                .chains(ChainSelector.of(1))
                .feedback(FeedbackFilters.builder().hasFeedback(true).build())
                .build());

        assertEquals(List.of("1:1"), ids(results));
        assertTrue(chain1.calls("feedback").isEmpty());
    }

    // ═══════════════════════════════════════════════════════════════════
    // Candidate narrowing
    // ═══════════════════════════════════════════════════════════════════

    @Test
    void feedbackThresholdsApplyToCountAndAverage() {
        final InMemoryAgentBackend chain1 = new InMemoryAgentBackend()
                .agent(agentRow("1:1", "four rows", 1))
                .agent(agentRow("1:2", "six rows", 2));
        for (int i = 1; i <= 4; i++) {
            chain1.feedback(feedbackRow("1:1", "0xr" + i, i, "90"));
        }
        for (int i = 1; i <= 6; i++) {
            chain1.feedback(feedbackRow("1:2", "0xr" + i, i, i % 2 == 0 ? "90" : "80"));
        }
        final AgentIndexer indexer = indexer(Map.of(1L, chain1), noSemantic());

        final List<AgentSummary> results = indexer.search(SearchFilters.builder()
                .chains(ChainSelector.of(1))
                .feedback(FeedbackFilters.builder().minCount(5).minValue(80.0).build())
                .build());

        assertEquals(List.of("1:2"), ids(results));
        assertEquals(85.0, results.get(0).averageValue(), 1e-9);
    }

    @Test
    void hasNoFeedbackWithoutCandidateSetIsRejected() {
        final InMemoryAgentBackend chain1 = new InMemoryAgentBackend().agent(agentRow("1:1", "a", 1));
        final AgentIndexer indexer = indexer(Map.of(1L, chain1), noSemantic());

        final InvalidFilterException e = assertThrows(InvalidFilterException.class, () -> indexer.search(
                SearchFilters.builder()
                        .feedback(FeedbackFilters.builder().hasNoFeedback(true).build())
                        .build()));

        assertEquals("feedback.hasNoFeedback", e.field());
        assertTrue(chain1.calls().isEmpty());
    }

    @Test
    void hasNoFeedbackSubtractsReviewedAgentsFromCandidates() {
        final Map<String, Object> revoked = feedbackRow("1:3", "0xr1", 1, "10");
        revoked.put("isRevoked", true);
        final InMemoryAgentBackend chain1 = new InMemoryAgentBackend()
                .agent(agentRow("1:1", "reviewed", 1))
                .agent(agentRow("1:2", "quiet", 2))
                .agent(agentRow("1:3", "revoked only", 3))
                .agent(agentRow("1:4", "not a candidate", 4))
                .feedback(feedbackRow("1:1", "0xr1", 1, "70"))
                .feedback(revoked);
        final AgentIndexer indexer = indexer(Map.of(1L, chain1), noSemantic());

        final List<AgentSummary> results = indexer.search(SearchFilters.builder()
                .chains(ChainSelector.of(1))
                .agentIds("1:1", "1:2", "1:3")
                .feedback(FeedbackFilters.builder().hasNoFeedback(true).build())
                .build());

        assertEquals(List.of("1:3", "1:2"), ids(results));
    }

    @Test
    void includeRevokedCountsRevokedRows() {
        final Map<String, Object> revoked = feedbackRow("1:3", "0xr1", 1, "10");
        revoked.put("isRevoked", true);
        final InMemoryAgentBackend chain1 = new InMemoryAgentBackend()
                .agent(agentRow("1:2", "quiet", 2))
                .agent(agentRow("1:3", "revoked only", 3))
                .feedback(revoked);
        final AgentIndexer indexer = indexer(Map.of(1L, chain1), noSemantic());

        final List<AgentSummary> results = indexer.search(SearchFilters.builder()
                .chains(ChainSelector.of(1))
                .agentIds("1:2", "1:3")
                .feedback(FeedbackFilters.builder().hasNoFeedback(true).includeRevoked(true).build())
                .build());

        assertEquals(List.of("1:2"), ids(results));
    }

    @Test
    void unprefixedAgentIdsNeedASingleChain() {
        final InMemoryAgentBackend chain1 = new InMemoryAgentBackend()
                .agent(agentRow("1:7", "seven", 1))
                .agent(agentRow("1:8", "eight", 2));
        final AgentIndexer indexer = indexer(Map.of(1L, chain1, 10L, new InMemoryAgentBackend()), noSemantic());

        assertEquals(List.of("1:7"), ids(indexer.search(SearchFilters.builder()
                .chains(ChainSelector.of(1)).agentIds("7").build())));
        final InvalidFilterException e = assertThrows(InvalidFilterException.class, () -> indexer.search(
                SearchFilters.builder().chains(ChainSelector.of(1, 10)).agentIds("7").build()));
        assertEquals("agentIds", e.field());
    }

    @Test
    void candidateIdsAreQueriedInChunks() {
        final InMemoryAgentBackend chain1 = new InMemoryAgentBackend();
        final List<String> wanted = new ArrayList<>();
        for (int i = 1; i <= 5; i++) {
            chain1.agent(agentRow("1:" + i, "agent " + i, i));
            wanted.add("1:" + i);
        }
        final AgentIndexer indexer = indexer(AgentIndexer.builder()
                .registry(BackendRegistry.of(Map.of(1L, chain1)))
                .semanticClient(noSemantic())
                .idChunkSize(2));

        final List<AgentSummary> results = indexer.search(SearchFilters.builder()
                .chains(ChainSelector.of(1)).agentIds(wanted).build());

        assertEquals(List.of("1:5", "1:4", "1:3", "1:2", "1:1"), ids(results));
        assertEquals(3, chain1.calls("agents").size());
    }

    @Test
    void metadataValueNarrowsCandidates() {
        final InMemoryAgentBackend chain1 = new InMemoryAgentBackend()
                .agent(agentRow("1:1", "defi", 1))
                .agent(agentRow("1:2", "gaming", 2))
                .metadata(metadataRow("1:1", "category", Hex.encodeUtf8("defi")))
                .metadata(metadataRow("1:2", "category", Hex.encodeUtf8("gaming")));
        final AgentIndexer indexer = indexer(Map.of(1L, chain1), noSemantic());

        final List<AgentSummary> byValue = indexer.search(SearchFilters.builder()
                .chains(ChainSelector.of(1))
                .metadataValue(new MetadataFilter("category", "defi"))
                .build());
        final List<AgentSummary> byKey = indexer.search(SearchFilters.builder()
                .chains(ChainSelector.of(1))
                .hasMetadataKey("category")
                .build());

        assertEquals(List.of("1:1"), ids(byValue));
        assertEquals(List.of("1:2", "1:1"), ids(byKey));
    }

    @Test
    void emptyMetadataMatchSkipsTheAgentQuery() {
        final InMemoryAgentBackend chain1 = new InMemoryAgentBackend().agent(agentRow("1:1", "a", 1));
        final AgentIndexer indexer = indexer(Map.of(1L, chain1), noSemantic());

        final List<AgentSummary> results = indexer.search(SearchFilters.builder()
                .chains(ChainSelector.of(1)).hasMetadataKey("absent").build());

        assertTrue(results.isEmpty());
        assertTrue(chain1.calls("agents").isEmpty());
    }

    // ═══════════════════════════════════════════════════════════════════
    // Keyword search
    // ═══════════════════════════════════════════════════════════════════

    @Test
    void keywordHitsAreRestrictedToResolvedChains() {
        final InMemoryAgentBackend chain1 = new InMemoryAgentBackend().agent(agentRow("1:10", "oracle", 1));
        final InMemoryAgentBackend chain2 = new InMemoryAgentBackend().agent(agentRow("2:5", "oracle two", 2));
        final AgentIndexer indexer = indexer(Map.of(1L, chain1, 2L, chain2),
                hits(new SemanticHit(1, "1:10", 0.9), new SemanticHit(2, "2:5", 0.4)));

        final List<AgentSummary> results = indexer.search(SearchFilters.builder()
                .keyword("oracle").chains(ChainSelector.of(1)).build());

        assertEquals(List.of("1:10"), ids(results));
        assertEquals(0.9, results.get(0).semanticScore(), 1e-9);
        assertTrue(chain2.calls().isEmpty());
    }

    @Test
    void keywordResultsSortBySemanticScoreByDefault() {
        final InMemoryAgentBackend chain1 = new InMemoryAgentBackend()
                .agent(agentRow("1:1", "low", 900))
                .agent(agentRow("1:2", "high", 100));
        final AgentIndexer indexer = indexer(Map.of(1L, chain1),
                hits(new SemanticHit(1, "1:1", 0.55), new SemanticHit(1, "1:2", 0.95)));

        final List<AgentSummary> results = indexer.search(SearchFilters.builder()
                .keyword("agent").chains(ChainSelector.of(1)).build());

        assertEquals(List.of("1:2", "1:1"), ids(results));
        assertEquals("updatedAt", chain1.calls("agents").get(0).orderBy());
    }

    @Test
    void disjointKeywordAndIdsSkipTheAgentQuery() {
        final InMemoryAgentBackend chain1 = new InMemoryAgentBackend().agent(agentRow("1:1", "a", 1));
        final AgentIndexer indexer = indexer(Map.of(1L, chain1), hits(new SemanticHit(1, "1:10", 0.9)));

        final List<AgentSummary> results = indexer.search(SearchFilters.builder()
                .keyword("a").chains(ChainSelector.of(1)).agentIds("1:1").build());

        assertTrue(results.isEmpty());
        assertTrue(chain1.calls().isEmpty());
    }

    @Test
    void semanticOptionsOverrideEngineDefaults() {
        final List<Object> seen = new ArrayList<>();
        final SemanticSearchClient client = (query, minScore, limit) -> {
            seen.add(query);
            seen.add(minScore);
            seen.add(limit);
            return List.of();
        };
        final AgentIndexer indexer = indexer(Map.of(1L, new InMemoryAgentBackend()), client);

        indexer.search(SearchFilters.builder().keyword("  spaced  ").chains(ChainSelector.of(1)).build(),
                new SearchOptions(List.of(), 0.8, 10));
        indexer.search(SearchFilters.builder().keyword("plain").chains(ChainSelector.of(1)).build());

        assertEquals(List.of("spaced", 0.8, 10, "plain", 0.5, 5000), seen);
    }

    @Test
    void semanticFailureFailsTheSearch() {
        final AgentIndexer indexer = indexer(Map.of(1L, new InMemoryAgentBackend()), (query, minScore, limit) -> {
            throw new SemanticSearchException(503, "unavailable", null);
        });

        final SemanticSearchException e = assertThrows(SemanticSearchException.class, () -> indexer.search(
                SearchFilters.builder().keyword("x").chains(ChainSelector.of(1)).build()));
        assertEquals(503, e.status());
    }

    // ═══════════════════════════════════════════════════════════════════
    // Failures
    // ═══════════════════════════════════════════════════════════════════

    @Test
    void backendFailureIsTaggedWithItsChain() {
        final AgentBackend broken = mock(AgentBackend.class);
        when(broken.queryAgents(any(), anyInt(), anyInt(), anyString(), any(SortDirection.class)))
                .thenThrow(new BackendException("SearchAgents", List.of("indexer unavailable")));
        final AgentIndexer indexer = indexer(Map.of(1L, new InMemoryAgentBackend(), 137L, broken), noSemantic());

        final BackendException e = assertThrows(BackendException.class, () -> indexer.search(
                SearchFilters.builder().chains(ChainSelector.of(1, 137)).build()));

        assertEquals(137L, e.chainId());
        assertEquals(List.of("indexer unavailable"), e.graphqlErrors());
    }

    @Test
    void invalidDateIsRejectedBeforeAnyQuery() {
        final InMemoryAgentBackend chain1 = new InMemoryAgentBackend();
        final AgentIndexer indexer = indexer(Map.of(1L, chain1), noSemantic());

        final InvalidFilterException e = assertThrows(InvalidFilterException.class, () -> indexer.search(
                SearchFilters.builder().chains(ChainSelector.of(1)).updatedAtFrom("last tuesday").build()));

        assertEquals("updatedAtFrom", e.field());
        assertTrue(chain1.calls().isEmpty());
    }

    // ═══════════════════════════════════════════════════════════════════
    // Lookups
    // ═══════════════════════════════════════════════════════════════════

    @Test
    void getAgentReadsFromTheAgentsChain() {
        final AgentIndexer indexer = indexer(AgentIndexer.builder()
                .defaultChainId(8453)
                .registry(BackendRegistry.of(Map.of(
                        1L, new InMemoryAgentBackend().agent(agentRow("1:4", "mainnet four", 1)),
                        8453L, new InMemoryAgentBackend().agent(agentRow("8453:4", "base four", 1)))))
                .semanticClient(noSemantic()));

        assertAll(
                () -> assertEquals("mainnet four", indexer.getAgent("1:4").name()),
                () -> assertEquals("base four", indexer.getAgent("4").name()),
                () -> assertEquals(List.of("0xowner"), indexer.getAgent("1:4").owners()),
                () -> assertThrows(AgentNotFoundException.class, () -> indexer.getAgent("1:5")),
                () -> assertThrows(InvalidFilterException.class, () -> indexer.getAgent("abc:def")));
    }

    @Test
    void getAgentFallsBackToCacheWithoutBackend() {
        final AgentIndexer indexer = indexer(Map.of(1L, new InMemoryAgentBackend()), noSemantic());
        indexer.cache().put(AgentSummary.builder(59144, "59144:3").name("cached").build());

        assertEquals("cached", indexer.getAgent("59144:3").name());
        assertThrows(AgentNotFoundException.class, () -> indexer.getAgent("59144:4"));
    }

    @Test
    void searchFeedbackFiltersAndDecodesTags() {
        final Map<String, Object> tagged = feedbackRow("1:1", "0xaaa", 1, "95");
        tagged.put("tag1", Hex.encodeUtf8("quality") + "00000000");
        tagged.put("tag2", "speed");
        final Map<String, Object> low = feedbackRow("1:1", "0xbbb", 2, "20");
        low.put("tag1", "quality");
        final Map<String, Object> revoked = feedbackRow("1:1", "0xccc", 3, "99");
        revoked.put("tag1", "speed");
        revoked.put("isRevoked", true);
        final Map<String, Object> other = feedbackRow("1:2", "0xaaa", 1, "90");
        other.put("tag1", "speed");
        final InMemoryAgentBackend chain1 = new InMemoryAgentBackend()
                .feedback(tagged).feedback(low).feedback(revoked).feedback(other);
        final AgentIndexer indexer = indexer(Map.of(1L, chain1), noSemantic());

        final List<Feedback> results = indexer.searchFeedback(FeedbackSearchParams.builder()
                .agent("1")
                .tags(List.of("speed", "quality"))
                .minValue(50.0)
                .build());

        assertEquals(1, results.size());
        final Feedback feedback = results.get(0);
        assertAll(
                () -> assertEquals("1:1", feedback.agentId()),
                () -> assertEquals("0xaaa", feedback.reviewer()),
                () -> assertEquals(1L, feedback.feedbackIndex()),
                () -> assertEquals(95.0, feedback.value()),
                () -> assertEquals(List.of("quality", "speed"), feedback.tags()));
    }

    @Test
    void searchFeedbackWithoutBackendReturnsNothing() {
        final AgentIndexer indexer = indexer(Map.of(1L, new InMemoryAgentBackend()), noSemantic());

        assertTrue(indexer.searchFeedback(FeedbackSearchParams.builder().agent("137:1").build()).isEmpty());
    }

    @Test
    void getFeedbackBuildsTheCompositeId() {
        final InMemoryAgentBackend chain1 = new InMemoryAgentBackend()
                .feedback(feedbackRow("1:1", "0xabc", 2, "77"));
        final AgentIndexer indexer = indexer(Map.of(1L, chain1), noSemantic());

        final Optional<Feedback> found = indexer.getFeedback("1:1", "0xABC", 2);

        assertTrue(found.isPresent());
        assertEquals("1:1:0xabc:2", found.get().id());
        assertEquals(77.0, found.get().value());
        assertTrue(indexer.getFeedback("1:1", "0xabc", 3).isEmpty());
    }

    // ═══════════════════════════════════════════════════════════════════
    // Refresh
    // ═══════════════════════════════════════════════════════════════════

    @Test
    void refreshCachesSuccessesAndSkipsFailures() {
        final Map<String, String> names = new LinkedHashMap<>();
        names.put("1:1", "one");
        names.put("1:3", "three");
        final AgentIndexer indexer = indexer(AgentIndexer.builder()
                .registry(BackendRegistry.of(Map.of()))
                .semanticClient(noSemantic())
                .hydrator(id -> {
                    final String name = names.get(id.toString());
                    if (name == null) {
                        throw new IllegalStateException("registration file unavailable");
                    }
                    return AgentSummary.builder(id.chainId(), id.toString()).name(name).build();
                }));

        final List<AgentSummary> refreshed = indexer.refreshAgents(List.of("1:1", "1:2", "3"), 2);

        assertEquals(List.of("1:1", "1:3"), ids(refreshed));
        assertEquals("three", indexer.getAgent("1:3").name());
        assertEquals(2, indexer.cache().size());
    }

    @Test
    void refreshWithoutHydratorIsAnError() {
        final AgentIndexer indexer = indexer(Map.of(), noSemantic());

        assertThrows(IllegalStateException.class, () -> indexer.refreshAgents(List.of("1:1")));
    }
}
