// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.rpc;

import static org.junit.jupiter.api.Assertions.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;
import sh.scry.core.query.Criterion;

class WhereEncoderTest {

    private final WhereEncoder canonical = new WhereEncoder(SchemaProfile.canonical());

    @Test
    void emptyConjunctionEncodesToEmptyObject() {
        assertEquals(Map.of(), canonical.encode(Criterion.ALWAYS));
    }

    @Test
    void flatConditionsShareOneObject() {
        final Map<String, Object> where = canonical.encode(Criterion.and(
                Criterion.in("owner", List.of("0xabc")),
                Criterion.gt("totalFeedback", "0"),
                Criterion.gte("createdAt", "100"),
                Criterion.lte("createdAt", "200")));

        assertEquals(Map.of(
                "owner_in", List.of("0xabc"),
                "totalFeedback_gt", "0",
                "createdAt_gte", "100",
                "createdAt_lte", "200"), where);
    }

    @Test
    void nestedPathsBecomeUnderscoreObjects() {
        final Map<String, Object> where = canonical.encode(Criterion.and(
                Criterion.containsNoCase("registrationFile.name", "bot"),
                Criterion.contains("registrationFile.a2aSkills", "search"),
                Criterion.notNull("registrationFile.mcpEndpoint")));

        final Map<String, Object> nested = new LinkedHashMap<>();
        nested.put("name_contains_nocase", "bot");
        nested.put("a2aSkills_contains", List.of("search"));
        nested.put("mcpEndpoint_not", null);
        assertEquals(Map.of("registrationFile_", nested), where);
    }

    @Test
    void isNullKeepsExplicitNull() {
        final Map<String, Object> where = canonical.encode(Criterion.isNull("registrationFile"));

        assertTrue(where.containsKey("registrationFile"));
        assertNull(where.get("registrationFile"));
    }

    @Test
    void disjunctionNestsUnderAnd() {
        final Map<String, Object> where = canonical.encode(Criterion.and(
                Criterion.eq("isRevoked", false),
                Criterion.or(Criterion.eq("tag1", "fast"), Criterion.eq("tag2", "fast"))));

        assertEquals(Map.of("and", List.of(
                Map.of("isRevoked", false),
                Map.of("or", List.of(Map.of("tag1", "fast"), Map.of("tag2", "fast"))))), where);
    }

    @Test
    void collidingKeysMoveIntoAnd() {
        final Map<String, Object> where = canonical.encode(Criterion.and(
                Criterion.contains("registrationFile.mcpTools", "a"),
                Criterion.contains("registrationFile.mcpTools", "b")));

        assertEquals(Map.of("and", List.of(
                Map.of("registrationFile_", Map.of("mcpTools_contains", List.of("a"))),
                Map.of("registrationFile_", Map.of("mcpTools_contains", List.of("b"))))), where);
    }

    @Test
    void profileRewritesRenamedAndFallbackFields() {
        final WhereEncoder legacy = new WhereEncoder(
                SchemaProfile.of(Set.of(SchemaRule.X402_SUPPORT_LOWERCASE, SchemaRule.OASF_ENDPOINT_FALLBACK)));

        final Map<String, Object> where = legacy.encode(Criterion.and(
                Criterion.eq("registrationFile.x402Support", true),
                Criterion.eq("registrationFile.hasOASF", true)));

        final Map<String, Object> nested = new LinkedHashMap<>();
        nested.put("x402support", true);
        nested.put("oasfEndpoint_not", null);
        assertEquals(Map.of("registrationFile_", nested), where);
    }
}
