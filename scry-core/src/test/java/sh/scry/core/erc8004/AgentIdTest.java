// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.core.erc8004;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;

import org.junit.jupiter.api.Test;

class AgentIdTest {

    @Test
    void parse_readsChainAndToken() {
        var id = AgentId.parse("11155111:42");

        assertEquals(11155111L, id.chainId());
        assertEquals(BigInteger.valueOf(42), id.tokenId());
        assertEquals("11155111:42", id.toString());
    }

    @Test
    void parse_usesDefaultChainWhenUnprefixed() {
        assertEquals(AgentId.of(8453, 7), AgentId.parse("7", 8453));
        assertEquals(AgentId.of(1, 7), AgentId.parse("1:7", 8453));
    }

    @Test
    void parse_rejectsMissingPrefix() {
        assertThrows(IllegalArgumentException.class, () -> AgentId.parse("42"));
    }

    @Test
    void parse_rejectsGarbage() {
        assertThrows(IllegalArgumentException.class, () -> AgentId.parse("mainnet:42"));
        assertThrows(IllegalArgumentException.class, () -> AgentId.parse("1:abc"));
        assertThrows(IllegalArgumentException.class, () -> AgentId.parse("0:1"));
        assertThrows(IllegalArgumentException.class, () -> AgentId.parse("1:-1"));
    }

    @Test
    void tryParse_returnsEmptyOnFailure() {
        assertTrue(AgentId.tryParse("x:1").isEmpty());
        assertTrue(AgentId.tryParse(null).isEmpty());
        assertEquals("2:5", AgentId.tryParse("2:5").orElseThrow().toString());
    }

    @Test
    void supportsTokenIdsBeyondLong() {
        var big = "1:" + BigInteger.TWO.pow(200);
        assertEquals(big, AgentId.parse(big).toString());
    }
}
