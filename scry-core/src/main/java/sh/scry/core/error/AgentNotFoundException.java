// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.core.error;

/**
 * Exception thrown when an agent lookup finds nothing in the backend or the
 * local summary cache.
 */
public final class AgentNotFoundException extends ScryException {

    private final String agentId;

    public AgentNotFoundException(final String agentId) {
        super("Agent not found: " + agentId);
        this.agentId = agentId;
    }

    public String agentId() {
        return agentId;
    }
}
