// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.rpc.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

/**
 * {@code Agent} entity as selected by the search and lookup queries.
 *
 * <p>{@code BigInt} fields (chain id, counters, timestamps) arrive as decimal
 * strings and are kept that way.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentRow(
        String id,
        @Nullable String chainId,
        @Nullable String agentId,
        @JsonProperty("agentURI") @Nullable String agentUri,
        @JsonProperty("agentURIType") @Nullable String agentUriType,
        @Nullable String owner,
        @Nullable List<String> operators,
        @Nullable String agentWallet,
        @Nullable String totalFeedback,
        @Nullable String createdAt,
        @Nullable String updatedAt,
        @Nullable String lastActivity,
        @Nullable RegistrationFileRow registrationFile) {
}
