// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.core.erc8004.registration;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * ERC-8004 Agent Registration File (the "Agent Card").
 *
 * <p>Parsed from the JSON document at the agent's {@code tokenURI}. Refreshing
 * an agent reads this document and projects it onto a search summary.
 *
 * <pre>{@code
 * AgentRegistration card = AgentRegistration.fromJson(jsonString);
 * card.service("mcp").map(AgentService::endpoint).ifPresent(System.out::println);
 * }</pre>
 *
 * @param type           schema version URI
 * @param name           human-readable agent name
 * @param description    natural language description of capabilities
 * @param image          avatar/logo URL
 * @param services       network endpoints the agent exposes
 * @param x402Support    whether the agent accepts x402 HTTP payments
 * @param active         whether the agent is currently operational
 * @param supportedTrust trust model categories
 * @param agentWallet    payment wallet declared by the agent, if any
 * @see <a href="https://eips.ethereum.org/EIPS/eip-8004">EIP-8004</a>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentRegistration(
    String type,
    String name,
    String description,
    String image,
    @JsonAlias("endpoints") List<AgentService> services,
    @JsonAlias("x402support") Boolean x402Support,
    Boolean active,
    @JsonAlias("supportedTrusts") List<String> supportedTrust,
    @JsonAlias("walletAddress") String agentWallet
) {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public AgentRegistration {
        services = services == null ? List.of() : List.copyOf(services);
        supportedTrust = supportedTrust == null ? List.of() : List.copyOf(supportedTrust);
    }

    /**
     * Returns the first service of the given type, matched case-insensitively.
     */
    public Optional<AgentService> service(String type) {
        return services.stream().filter(s -> s.is(type)).findFirst();
    }

    /**
     * Parses an Agent Registration File from JSON.
     *
     * @param json the JSON string
     * @return the parsed registration
     * @throws IllegalArgumentException if the JSON is invalid or null
     */
    public static AgentRegistration fromJson(String json) {
        Objects.requireNonNull(json, "json");
        try {
            return MAPPER.readValue(json, AgentRegistration.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                "Invalid agent registration JSON: " + e.getMessage(), e);
        }
    }
}
