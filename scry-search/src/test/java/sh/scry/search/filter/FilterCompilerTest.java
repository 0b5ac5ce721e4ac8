// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.search.filter;

import static org.junit.jupiter.api.Assertions.*;
import static sh.scry.core.query.Criterion.and;
import static sh.scry.core.query.Criterion.contains;
import static sh.scry.core.query.Criterion.containsNoCase;
import static sh.scry.core.query.Criterion.eq;
import static sh.scry.core.query.Criterion.gt;
import static sh.scry.core.query.Criterion.gte;
import static sh.scry.core.query.Criterion.in;
import static sh.scry.core.query.Criterion.isNull;
import static sh.scry.core.query.Criterion.lte;
import static sh.scry.core.query.Criterion.notNull;
import static sh.scry.core.query.Criterion.or;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import sh.scry.core.error.InvalidFilterException;
import sh.scry.core.model.ChainSelector;
import sh.scry.core.model.FeedbackFilters;
import sh.scry.core.model.MetadataFilter;
import sh.scry.core.model.SearchFilters;
import sh.scry.core.query.Criterion;

class FilterCompilerTest {

    // ═══════════════════════════════════════════════════════════════════
    // compile
    // ═══════════════════════════════════════════════════════════════════

    @Test
    void emptyFiltersRequireARegistrationFile() {
        assertEquals(notNull("registrationFile"), FilterCompiler.compile(SearchFilters.none()));
    }

    @Test
    void registrationFileCanBeExplicitlyAbsent() {
        final SearchFilters filters = SearchFilters.builder().hasRegistrationFile(false).build();

        assertEquals(isNull("registrationFile"), FilterCompiler.compile(filters));
    }

    @Test
    void fieldsAreConjoinedInTableOrder() {
        final SearchFilters filters = SearchFilters.builder()
                .name("Alpha")
                .owners(List.of("0xABC"))
                .walletAddress("0xDEF")
                .active(true)
                .build();

        assertEquals(and(
                notNull("registrationFile"),
                eq("agentWallet", "0xdef"),
                in("owner", List.of("0xabc")),
                containsNoCase("registrationFile.name", "Alpha"),
                eq("registrationFile.active", true)), FilterCompiler.compile(filters));
    }

    @Test
    void listFieldsMatchAnyElement() {
        final SearchFilters filters = SearchFilters.builder()
                .operators(List.of("0xA", "0xB"))
                .mcpTools(List.of("search"))
                .build();

        assertEquals(and(
                notNull("registrationFile"),
                or(contains("operators", "0xa"), contains("operators", "0xb")),
                or(contains("registrationFile.mcpTools", "search"))), FilterCompiler.compile(filters));
    }

    @Test
    void endpointPresenceAndAggregate() {
        final SearchFilters some = SearchFilters.builder().hasMcp(true).hasWeb(false).hasEndpoints(true).build();
        final SearchFilters none = SearchFilters.builder().hasEndpoints(false).build();

        assertEquals(and(
                notNull("registrationFile"),
                notNull("registrationFile.mcpEndpoint"),
                isNull("registrationFile.webEndpoint"),
                or(notNull("registrationFile.webEndpoint"), notNull("registrationFile.mcpEndpoint"),
                        notNull("registrationFile.a2aEndpoint"))), FilterCompiler.compile(some));
        assertEquals(and(
                notNull("registrationFile"),
                isNull("registrationFile.webEndpoint"),
                isNull("registrationFile.mcpEndpoint"),
                isNull("registrationFile.a2aEndpoint")), FilterCompiler.compile(none));
    }

    @Test
    void datesBecomeEpochSecondBounds() {
        final SearchFilters filters = SearchFilters.builder()
                .registeredAtFrom("2025-01-01")
                .updatedAtTo("1735689600")
                .build();

        assertEquals(and(
                notNull("registrationFile"),
                gte("createdAt", "1735689600"),
                lte("updatedAt", "1735689600")), FilterCompiler.compile(filters));
    }

    @Test
    void badDateFailsCompilation() {
        final SearchFilters filters = SearchFilters.builder().updatedAtFrom("last tuesday").build();

        final InvalidFilterException e = assertThrows(InvalidFilterException.class,
                () -> FilterCompiler.compile(filters));
        assertEquals("updatedAtFrom", e.field());
    }

    @Test
    void pureHasFeedbackUsesTheCounter() {
        final SearchFilters filters = SearchFilters.builder()
                .feedback(FeedbackFilters.builder().hasFeedback(true).build())
                .build();

        assertEquals(and(notNull("registrationFile"), gt("totalFeedback", "0")), FilterCompiler.compile(filters));
    }

    @Test
    void scannedFeedbackAndPrefilterFieldsDoNotPushDown() {
        final SearchFilters filters = SearchFilters.builder()
                .keyword("weather")
                .agentIds("1:1")
                .hasMetadataKey("agentWallet")
                .feedback(FeedbackFilters.builder().hasFeedback(true).minValue(50.0).build())
                .build();

        assertEquals(notNull("registrationFile"), FilterCompiler.compile(filters));
    }

    @Test
    void blankStringsAreIgnored() {
        final SearchFilters filters = SearchFilters.builder().name("  ").description("").build();

        assertEquals(notNull("registrationFile"), FilterCompiler.compile(filters));
    }

    @Test
    void restrictToAddsIdMembership() {
        final Criterion where = and(notNull("registrationFile"), eq("registrationFile.active", true));

        assertEquals(and(notNull("registrationFile"), eq("registrationFile.active", true), in("id", List.of("1:1", "1:2"))),
                FilterCompiler.restrictTo(where, List.of("1:1", "1:2")));
    }

    // ═══════════════════════════════════════════════════════════════════
    // plan / validate
    // ═══════════════════════════════════════════════════════════════════

    @Test
    void planRoutesEveryPresentField() {
        final SearchFilters filters = SearchFilters.builder()
                .keyword("weather")
                .chains(ChainSelector.allChains())
                .agentIds("1:1")
                .metadataValue(new MetadataFilter("agentWallet", "0x1"))
                .feedback(FeedbackFilters.builder().minCount(2).build())
                .name("bot")
                .build();

        final Map<FilterField, FilterRoute> plan = FilterCompiler.plan(filters);

        assertAll(
                () -> assertEquals(FilterRoute.SEMANTIC, plan.get(FilterField.KEYWORD)),
                () -> assertEquals(FilterRoute.CHAINS, plan.get(FilterField.CHAINS)),
                () -> assertEquals(FilterRoute.CANDIDATE_IDS, plan.get(FilterField.AGENT_IDS)),
                () -> assertEquals(FilterRoute.METADATA_PREFILTER, plan.get(FilterField.METADATA)),
                () -> assertEquals(FilterRoute.FEEDBACK_PREFILTER, plan.get(FilterField.FEEDBACK_SCAN)),
                () -> assertEquals(FilterRoute.PUSHDOWN, plan.get(FilterField.NAME)),
                () -> assertEquals(FilterRoute.PUSHDOWN, plan.get(FilterField.HAS_REGISTRATION_FILE)),
                () -> assertFalse(plan.containsKey(FilterField.FEEDBACK_EXISTENCE)),
                () -> assertFalse(plan.containsKey(FilterField.DESCRIPTION)));
    }

    @Test
    void hasNoFeedbackNeedsABoundedUniverse() {
        final FeedbackFilters noFeedback = FeedbackFilters.builder().hasNoFeedback(true).build();

        final InvalidFilterException e = assertThrows(InvalidFilterException.class,
                () -> FilterCompiler.validate(SearchFilters.builder().feedback(noFeedback).build()));
        assertEquals("feedback.hasNoFeedback", e.field());

        assertDoesNotThrow(() -> FilterCompiler.validate(
                SearchFilters.builder().feedback(noFeedback).agentIds("1:1").build()));
        assertDoesNotThrow(() -> FilterCompiler.validate(
                SearchFilters.builder().feedback(noFeedback).keyword("weather").build()));
        assertDoesNotThrow(() -> FilterCompiler.validate(
                SearchFilters.builder().feedback(noFeedback).hasMetadataKey("k").build()));
    }
}
