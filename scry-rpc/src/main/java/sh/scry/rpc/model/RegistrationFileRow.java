// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.rpc.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.jspecify.annotations.Nullable;

/**
 * Indexed copy of an agent's registration file.
 *
 * <p>Deployments differ slightly: {@code x402support} is accepted as an alias and
 * {@code hasOASF} may be absent, in which case {@code oasfEndpoint} stands in for it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RegistrationFileRow(
        @Nullable String id,
        @Nullable String name,
        @Nullable String description,
        @Nullable String image,
        @Nullable Boolean active,
        @JsonAlias("x402support") @Nullable Boolean x402Support,
        @Nullable List<String> supportedTrusts,
        @Nullable String mcpEndpoint,
        @Nullable String mcpVersion,
        @Nullable String a2aEndpoint,
        @Nullable String a2aVersion,
        @Nullable String webEndpoint,
        @Nullable String emailEndpoint,
        @Nullable Boolean hasOASF,
        @Nullable String oasfEndpoint,
        @Nullable List<String> oasfSkills,
        @Nullable List<String> oasfDomains,
        @Nullable String ens,
        @Nullable String did,
        @Nullable String agentWallet,
        @Nullable String agentWalletChainId,
        @Nullable List<String> mcpTools,
        @Nullable List<String> mcpPrompts,
        @Nullable List<String> mcpResources,
        @Nullable List<String> a2aSkills,
        @Nullable String createdAt) {

    /**
     * @return whether the agent advertises an OASF record, derived from the legacy endpoint when needed
     */
    public boolean advertisesOasf() {
        if (hasOASF != null) {
            return hasOASF;
        }
        return oasfEndpoint != null;
    }
}
