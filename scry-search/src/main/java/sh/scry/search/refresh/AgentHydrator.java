// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.search.refresh;

import sh.scry.core.erc8004.AgentId;
import sh.scry.core.model.AgentSummary;

/**
 * Builds a fresh summary for one agent from its primary sources.
 */
@FunctionalInterface
public interface AgentHydrator {

    /**
     * @throws RuntimeException if the agent cannot be hydrated; bulk refresh logs and skips it
     */
    AgentSummary hydrate(AgentId agentId);
}
