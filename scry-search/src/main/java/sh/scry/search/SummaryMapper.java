// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.search;

import java.util.List;

import org.jspecify.annotations.Nullable;

import sh.scry.core.model.AgentSummary;
import sh.scry.rpc.model.AgentRow;
import sh.scry.rpc.model.RegistrationFileRow;

/**
 * Maps backend agent rows to {@link AgentSummary} results.
 */
final class SummaryMapper {

    private SummaryMapper() {
    }

    /**
     * @param chainId chain the row was read from, used when the row does not carry a parsable chain id
     */
    static AgentSummary fromRow(final long chainId, final AgentRow row) {
        final RegistrationFileRow file = row.registrationFile();
        final AgentSummary.Builder builder = AgentSummary.builder(chainOf(chainId, row), row.id())
                .owners(blank(row.owner()) ? List.of() : List.of(row.owner()))
                .operators(row.operators())
                .walletAddress(row.agentWallet())
                .createdAt(row.createdAt())
                .updatedAt(row.updatedAt())
                .lastActivity(row.lastActivity())
                .agentUri(row.agentUri())
                .agentUriType(row.agentUriType())
                .feedbackCount(row.totalFeedback());
        if (file == null) {
            return builder.build();
        }
        return builder
                .name(file.name())
                .image(file.image())
                .description(file.description())
                .mcp(orNull(file.mcpEndpoint()))
                .a2a(orNull(file.a2aEndpoint()))
                .web(orNull(file.webEndpoint()))
                .email(orNull(file.emailEndpoint()))
                .ens(file.ens())
                .did(file.did())
                .supportedTrusts(file.supportedTrusts())
                .a2aSkills(file.a2aSkills())
                .mcpTools(file.mcpTools())
                .mcpPrompts(file.mcpPrompts())
                .mcpResources(file.mcpResources())
                .oasfSkills(file.oasfSkills())
                .oasfDomains(file.oasfDomains())
                .active(Boolean.TRUE.equals(file.active()))
                .x402Support(Boolean.TRUE.equals(file.x402Support()))
                .build();
    }

    private static long chainOf(final long fallback, final AgentRow row) {
        if (row.chainId() != null) {
            try {
                return Long.parseLong(row.chainId().trim());
            } catch (NumberFormatException e) {
                return fallback;
            }
        }
        return fallback;
    }

    private static @Nullable String orNull(final @Nullable String value) {
        return blank(value) ? null : value;
    }

    private static boolean blank(final @Nullable String value) {
        return value == null || value.isEmpty();
    }
}
