// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.core.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.jspecify.annotations.Nullable;

/**
 * One search result: agent identity, registration-file attributes, feedback
 * counter and optional scoring decorations.
 *
 * <p>Timestamps and {@code feedbackCount} are kept exactly as the backend returns
 * them (decimal strings of unbounded integers); sorting coerces them numerically.
 * {@code semanticScore} is set on every keyword-mode result and
 * {@code averageValue} whenever feedback rows were scanned for the agent.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AgentSummary(
        long chainId,
        String agentId,
        String name,
        @Nullable String image,
        @Nullable String description,
        List<String> owners,
        List<String> operators,
        @Nullable String mcp,
        @Nullable String a2a,
        @Nullable String web,
        @Nullable String email,
        @Nullable String ens,
        @Nullable String did,
        @Nullable String walletAddress,
        List<String> supportedTrusts,
        List<String> a2aSkills,
        List<String> mcpTools,
        List<String> mcpPrompts,
        List<String> mcpResources,
        List<String> oasfSkills,
        List<String> oasfDomains,
        boolean active,
        @JsonAlias("x402support") boolean x402Support,
        @Nullable String createdAt,
        @Nullable String updatedAt,
        @Nullable String lastActivity,
        @Nullable String agentUri,
        @Nullable String agentUriType,
        @Nullable String feedbackCount,
        @Nullable Double semanticScore,
        @Nullable Double averageValue) {

    public AgentSummary {
        owners = immutable(owners);
        operators = immutable(operators);
        supportedTrusts = immutable(supportedTrusts);
        a2aSkills = immutable(a2aSkills);
        mcpTools = immutable(mcpTools);
        mcpPrompts = immutable(mcpPrompts);
        mcpResources = immutable(mcpResources);
        oasfSkills = immutable(oasfSkills);
        oasfDomains = immutable(oasfDomains);
        name = name == null || name.isEmpty() ? agentId : name;
    }

    public static Builder builder(long chainId, String agentId) {
        return new Builder(chainId, agentId);
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public AgentSummary withSemanticScore(double score) {
        return toBuilder().semanticScore(score).build();
    }

    public AgentSummary withAverageValue(@Nullable Double average) {
        return toBuilder().averageValue(average).build();
    }

    private static List<String> immutable(@Nullable List<String> values) {
        return values == null ? List.of() : List.copyOf(values);
    }

    public static final class Builder {
        private final long chainId;
        private final String agentId;
        private String name;
        private String image;
        private String description;
        private List<String> owners;
        private List<String> operators;
        private String mcp;
        private String a2a;
        private String web;
        private String email;
        private String ens;
        private String did;
        private String walletAddress;
        private List<String> supportedTrusts;
        private List<String> a2aSkills;
        private List<String> mcpTools;
        private List<String> mcpPrompts;
        private List<String> mcpResources;
        private List<String> oasfSkills;
        private List<String> oasfDomains;
        private boolean active;
        private boolean x402Support;
        private String createdAt;
        private String updatedAt;
        private String lastActivity;
        private String agentUri;
        private String agentUriType;
        private String feedbackCount;
        private Double semanticScore;
        private Double averageValue;

        private Builder(long chainId, String agentId) {
            this.chainId = chainId;
            this.agentId = agentId;
        }

        private Builder(AgentSummary s) {
            this.chainId = s.chainId;
            this.agentId = s.agentId;
            this.name = s.name;
            this.image = s.image;
            this.description = s.description;
            this.owners = s.owners;
            this.operators = s.operators;
            this.mcp = s.mcp;
            this.a2a = s.a2a;
            this.web = s.web;
            this.email = s.email;
            this.ens = s.ens;
            this.did = s.did;
            this.walletAddress = s.walletAddress;
            this.supportedTrusts = s.supportedTrusts;
            this.a2aSkills = s.a2aSkills;
            this.mcpTools = s.mcpTools;
            this.mcpPrompts = s.mcpPrompts;
            this.mcpResources = s.mcpResources;
            this.oasfSkills = s.oasfSkills;
            this.oasfDomains = s.oasfDomains;
            this.active = s.active;
            this.x402Support = s.x402Support;
            this.createdAt = s.createdAt;
            this.updatedAt = s.updatedAt;
            this.lastActivity = s.lastActivity;
            this.agentUri = s.agentUri;
            this.agentUriType = s.agentUriType;
            this.feedbackCount = s.feedbackCount;
            this.semanticScore = s.semanticScore;
            this.averageValue = s.averageValue;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder image(String image) {
            this.image = image;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder owners(List<String> owners) {
            this.owners = owners;
            return this;
        }

        public Builder operators(List<String> operators) {
            this.operators = operators;
            return this;
        }

        public Builder mcp(String mcp) {
            this.mcp = mcp;
            return this;
        }

        public Builder a2a(String a2a) {
            this.a2a = a2a;
            return this;
        }

        public Builder web(String web) {
            this.web = web;
            return this;
        }

        public Builder email(String email) {
            this.email = email;
            return this;
        }

        public Builder ens(String ens) {
            this.ens = ens;
            return this;
        }

        public Builder did(String did) {
            this.did = did;
            return this;
        }

        public Builder walletAddress(String walletAddress) {
            this.walletAddress = walletAddress;
            return this;
        }

        public Builder supportedTrusts(List<String> supportedTrusts) {
            this.supportedTrusts = supportedTrusts;
            return this;
        }

        public Builder a2aSkills(List<String> a2aSkills) {
            this.a2aSkills = a2aSkills;
            return this;
        }

        public Builder mcpTools(List<String> mcpTools) {
            this.mcpTools = mcpTools;
            return this;
        }

        public Builder mcpPrompts(List<String> mcpPrompts) {
            this.mcpPrompts = mcpPrompts;
            return this;
        }

        public Builder mcpResources(List<String> mcpResources) {
            this.mcpResources = mcpResources;
            return this;
        }

        public Builder oasfSkills(List<String> oasfSkills) {
            this.oasfSkills = oasfSkills;
            return this;
        }

        public Builder oasfDomains(List<String> oasfDomains) {
            this.oasfDomains = oasfDomains;
            return this;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public Builder x402Support(boolean x402Support) {
            this.x402Support = x402Support;
            return this;
        }

        public Builder createdAt(String createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(String updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder lastActivity(String lastActivity) {
            this.lastActivity = lastActivity;
            return this;
        }

        public Builder agentUri(String agentUri) {
            this.agentUri = agentUri;
            return this;
        }

        public Builder agentUriType(String agentUriType) {
            this.agentUriType = agentUriType;
            return this;
        }

        public Builder feedbackCount(String feedbackCount) {
            this.feedbackCount = feedbackCount;
            return this;
        }

        public Builder semanticScore(Double semanticScore) {
            this.semanticScore = semanticScore;
            return this;
        }

        public Builder averageValue(Double averageValue) {
            this.averageValue = averageValue;
            return this;
        }

        public AgentSummary build() {
            return new AgentSummary(chainId, agentId, name, image, description, owners, operators,
                    mcp, a2a, web, email, ens, did, walletAddress, supportedTrusts, a2aSkills,
                    mcpTools, mcpPrompts, mcpResources, oasfSkills, oasfDomains, active, x402Support,
                    createdAt, updatedAt, lastActivity, agentUri, agentUriType, feedbackCount,
                    semanticScore, averageValue);
        }
    }
}
