// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.core.erc8004;

import java.math.BigInteger;
import java.util.Objects;
import java.util.Optional;

/**
 * Chain-scoped ERC-8004 agent identifier.
 *
 * <p>Agents are ERC-721 tokens in a per-chain Identity Registry, so a token id
 * is only unique together with its chain. The canonical text form is
 * {@code "<chainId>:<tokenId>"}, which is also the entity id the subgraph uses.
 *
 * <pre>{@code
 * AgentId id = AgentId.parse("11155111:42");
 * id.chainId();   // 11155111
 * id.toString();  // "11155111:42"
 * AgentId.parse("42", 1L).toString(); // "1:42"
 * }</pre>
 *
 * @param chainId the chain hosting the registry (must be positive)
 * @param tokenId the ERC-721 token id (must be non-negative)
 * @see <a href="https://eips.ethereum.org/EIPS/eip-8004">EIP-8004</a>
 */
public record AgentId(long chainId, BigInteger tokenId) {

    public AgentId {
        Objects.requireNonNull(tokenId, "tokenId");
        if (chainId <= 0) {
            throw new IllegalArgumentException("chainId must be positive, got: " + chainId);
        }
        if (tokenId.signum() < 0) {
            throw new IllegalArgumentException("tokenId must be non-negative");
        }
    }

    public static AgentId of(long chainId, long tokenId) {
        return new AgentId(chainId, BigInteger.valueOf(tokenId));
    }

    /**
     * Parses a chain-prefixed id such as {@code "1:42"}.
     *
     * @throws IllegalArgumentException if the value has no chain prefix or either part is malformed
     */
    public static AgentId parse(String value) {
        Objects.requireNonNull(value, "agentId");
        final int sep = value.indexOf(':');
        if (sep < 0) {
            throw new IllegalArgumentException("agentId must be '<chainId>:<tokenId>', got: " + value);
        }
        return new AgentId(parseChain(value.substring(0, sep), value), parseToken(value.substring(sep + 1), value));
    }

    /**
     * Parses an id that may omit its chain prefix, in which case {@code defaultChainId} is used.
     */
    public static AgentId parse(String value, long defaultChainId) {
        Objects.requireNonNull(value, "agentId");
        if (hasChainPrefix(value)) {
            return parse(value);
        }
        return new AgentId(defaultChainId, parseToken(value, value));
    }

    /**
     * Lenient variant of {@link #parse(String)} that returns empty instead of throwing.
     */
    public static Optional<AgentId> tryParse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(parse(value));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    public static boolean hasChainPrefix(String value) {
        return value != null && value.indexOf(':') >= 0;
    }

    @Override
    public String toString() {
        return chainId + ":" + tokenId;
    }

    private static long parseChain(String chain, String original) {
        try {
            return Long.parseLong(chain.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid chain prefix in agentId: " + original, e);
        }
    }

    private static BigInteger parseToken(String token, String original) {
        try {
            return new BigInteger(token.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid token id in agentId: " + original, e);
        }
    }
}
