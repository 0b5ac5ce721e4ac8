// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.search;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import sh.scry.core.model.AgentSummary;
import sh.scry.core.model.SortDirection;

class ResultSorterTest {

    private static AgentSummary agent(final String id, final String name, final String updatedAt) {
        return AgentSummary.builder(Long.parseLong(id.substring(0, id.indexOf(':'))), id)
                .name(name)
                .updatedAt(updatedAt)
                .build();
    }

    private static List<String> ids(final List<AgentSummary> results) {
        return results.stream().map(AgentSummary::agentId).collect(Collectors.toList());
    }

    @Test
    void nameIsCaseInsensitive() {
        final List<AgentSummary> sorted = ResultSorter.sort(List.of(
                agent("1:1", "beta", "1"),
                agent("1:2", "Alpha", "1"),
                agent("1:3", "alpha two", "1")), new SortSpec("name", SortDirection.ASC));

        assertEquals(List.of("1:2", "1:3", "1:1"), ids(sorted));
    }

    @Test
    void numericFieldsFallBackToZero() {
        final List<AgentSummary> sorted = ResultSorter.sort(List.of(
                agent("1:1", "a", "not-a-number"),
                agent("1:2", "b", "20"),
                agent("1:3", "c", "-5"),
                agent("1:4", "d", null)), new SortSpec("updatedAt", SortDirection.DESC));

        assertEquals(List.of("1:2", "1:1", "1:4", "1:3"), ids(sorted));
    }

    @Test
    void timestampsCompareNumericallyNotLexically() {
        final List<AgentSummary> sorted = ResultSorter.sort(List.of(
                agent("1:1", "a", "9"),
                agent("1:2", "b", "10")), new SortSpec("updatedAt", SortDirection.DESC));

        assertEquals(List.of("1:2", "1:1"), ids(sorted));
    }

    @Test
    void tiesKeepInputOrder() {
        final List<AgentSummary> input = List.of(
                agent("1:1", "same", "5"),
                agent("137:1", "same", "5"),
                agent("10:1", "same", "5"));

        assertEquals(List.of("1:1", "137:1", "10:1"), ids(ResultSorter.sort(input, new SortSpec("updatedAt", SortDirection.DESC))));
        assertEquals(List.of("1:1", "137:1", "10:1"), ids(ResultSorter.sort(input, new SortSpec("unknown", SortDirection.ASC))));
    }

    @Test
    void semanticScoreMissingCountsAsZero() {
        final List<AgentSummary> sorted = ResultSorter.sort(List.of(
                agent("1:1", "a", "1"),
                agent("1:2", "b", "1").withSemanticScore(0.7)), new SortSpec("semanticScore", SortDirection.DESC));

        assertEquals(List.of("1:2", "1:1"), ids(sorted));
    }

    @Test
    void coerceParsesDecimalStrings() {
        assertAll(
                () -> assertEquals(1_700_000_000.0, ResultSorter.coerce("1700000000")),
                () -> assertEquals(0.0, ResultSorter.coerce("")),
                () -> assertEquals(0.0, ResultSorter.coerce(null)));
    }
}
