// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.search.refresh;

import org.jspecify.annotations.Nullable;

import sh.scry.core.erc8004.AgentId;

/**
 * Read access to an ERC-8004 Identity Registry.
 *
 * <p>Implementations wrap whatever contract client the application already uses.
 */
public interface RegistryReader {

    /**
     * @return the agent URI stored for the token ({@code tokenURI})
     */
    String tokenUri(AgentId agentId);

    /**
     * @return the token owner ({@code ownerOf}), or null when unknown
     */
    @Nullable String ownerOf(AgentId agentId);
}
