// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.search.refresh;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.jspecify.annotations.Nullable;

import sh.scry.core.erc8004.AgentId;
import sh.scry.core.erc8004.registration.AgentRegistration;
import sh.scry.core.erc8004.registration.AgentService;
import sh.scry.core.model.AgentSummary;

/**
 * Hydrates an agent from the registry and its registration file.
 *
 * <p>Reads {@code tokenURI} and {@code ownerOf}, fetches and parses the file, then
 * projects services onto summary fields by name: {@code mcp}, {@code a2a},
 * {@code web}, {@code email}, {@code ens}, {@code did}. Capability lists come from
 * the matching service ({@code oasf} for skills and domains). A file without an
 * {@code active} flag counts as active.
 */
public final class RegistrationHydrator implements AgentHydrator {

    private final RegistryReader registry;
    private final RegistrationFetcher fetcher;

    public RegistrationHydrator(final RegistryReader registry, final RegistrationFetcher fetcher) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
    }

    @Override
    public AgentSummary hydrate(final AgentId agentId) {
        final String uri = registry.tokenUri(agentId);
        if (uri == null || uri.isBlank()) {
            throw new IllegalStateException("Agent " + agentId + " has no agent URI");
        }
        final String json;
        try {
            json = fetcher.fetch(uri);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load registration file for " + agentId + " from " + uri, e);
        }
        return summarize(agentId, uri, registry.ownerOf(agentId), AgentRegistration.fromJson(json));
    }

    static AgentSummary summarize(final AgentId agentId, final String uri, final @Nullable String owner,
            final AgentRegistration card) {
        final Optional<AgentService> mcp = card.service("mcp");
        final Optional<AgentService> a2a = card.service("a2a");
        final Optional<AgentService> oasf = card.service("oasf");
        return AgentSummary.builder(agentId.chainId(), agentId.toString())
                .name(card.name())
                .image(card.image())
                .description(card.description())
                .owners(owner == null || owner.isEmpty() ? List.of() : List.of(owner))
                .mcp(endpoint(card, "mcp"))
                .a2a(endpoint(card, "a2a"))
                .web(endpoint(card, "web"))
                .email(endpoint(card, "email"))
                .ens(endpoint(card, "ens"))
                .did(endpoint(card, "did"))
                .walletAddress(card.agentWallet())
                .supportedTrusts(card.supportedTrust())
                .a2aSkills(a2a.map(AgentService::skills).orElse(null))
                .mcpTools(mcp.map(AgentService::tools).orElse(null))
                .mcpPrompts(mcp.map(AgentService::prompts).orElse(null))
                .mcpResources(mcp.map(AgentService::resources).orElse(null))
                .oasfSkills(oasf.map(AgentService::skills).orElse(null))
                .oasfDomains(oasf.map(AgentService::domains).orElse(null))
                .active(card.active() == null || card.active())
                .x402Support(Boolean.TRUE.equals(card.x402Support()))
                .agentUri(uri)
                .agentUriType(UriTypes.detect(uri))
                .build();
    }

    private static @Nullable String endpoint(final AgentRegistration card, final String type) {
        return card.service(type)
                .map(AgentService::endpoint)
                .filter(value -> !value.isBlank())
                .orElse(null);
    }
}
