// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.core.erc8004.registration;

import java.util.List;
import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A service endpoint exposed by an ERC-8004 agent.
 *
 * <p>Older registration files call the array {@code endpoints} and some
 * services list their capabilities as {@code tools}, {@code prompts} and
 * {@code resources} (MCP) rather than {@code skills}.
 *
 * @param name      service type: "a2a", "mcp", "web", "ens", "did", "email", "oasf"
 * @param endpoint  service URL or identifier
 * @param version   protocol version (may be null)
 * @param skills    capability tags (may be null)
 * @param domains   domain categories (may be null)
 * @param tools     MCP tool names (may be null)
 * @param prompts   MCP prompt names (may be null)
 * @param resources MCP resource names (may be null)
 * @see <a href="https://eips.ethereum.org/EIPS/eip-8004">EIP-8004</a>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentService(
    String name,
    @JsonAlias("url") String endpoint,
    String version,
    @JsonAlias("a2aSkills") List<String> skills,
    List<String> domains,
    @JsonAlias("mcpTools") List<String> tools,
    @JsonAlias("mcpPrompts") List<String> prompts,
    @JsonAlias("mcpResources") List<String> resources
) {

    /**
     * Case-insensitive check of the service type.
     */
    public boolean is(String type) {
        return name != null && name.toLowerCase(Locale.ROOT).equals(type);
    }
}
