// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.core.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import org.jspecify.annotations.Nullable;

/**
 * Independent, all-optional predicates for an agent search.
 *
 * <p>Every field is nullable; null means "not constrained". Empty lists are
 * normalised to null. All present predicates are combined with AND.
 *
 * <pre>{@code
 * SearchFilters filters = SearchFilters.builder()
 *     .keyword("price oracle")
 *     .chains(ChainSelector.of(1, 8453))
 *     .hasMcp(true)
 *     .feedback(FeedbackFilters.builder().minCount(3).minValue(70.0).build())
 *     .build();
 * }</pre>
 *
 * <p>Date bounds accept epoch seconds, ISO-8601 instants, local date-times
 * (interpreted as UTC) and bare dates (UTC midnight).
 */
public final class SearchFilters {

    private static final SearchFilters NONE = builder().build();

    private final @Nullable String keyword;
    private final @Nullable ChainSelector chains;
    private final @Nullable List<String> agentIds;
    private final @Nullable List<String> owners;
    private final @Nullable List<String> operators;
    private final @Nullable String walletAddress;
    private final @Nullable Boolean hasRegistrationFile;
    private final @Nullable String registeredAtFrom;
    private final @Nullable String registeredAtTo;
    private final @Nullable String updatedAtFrom;
    private final @Nullable String updatedAtTo;
    private final @Nullable String name;
    private final @Nullable String description;
    private final @Nullable String ensContains;
    private final @Nullable String didContains;
    private final @Nullable Boolean active;
    private final @Nullable Boolean x402Support;
    private final @Nullable Boolean hasMcp;
    private final @Nullable Boolean hasA2a;
    private final @Nullable Boolean hasWeb;
    private final @Nullable Boolean hasOasf;
    private final @Nullable Boolean hasEndpoints;
    private final @Nullable String mcpContains;
    private final @Nullable String a2aContains;
    private final @Nullable String webContains;
    private final @Nullable List<String> supportedTrust;
    private final @Nullable List<String> a2aSkills;
    private final @Nullable List<String> mcpTools;
    private final @Nullable List<String> mcpPrompts;
    private final @Nullable List<String> mcpResources;
    private final @Nullable List<String> oasfSkills;
    private final @Nullable List<String> oasfDomains;
    private final @Nullable String hasMetadataKey;
    private final @Nullable MetadataFilter metadataValue;
    private final @Nullable FeedbackFilters feedback;

    private SearchFilters(Builder b) {
        this.keyword = b.keyword;
        this.chains = b.chains;
        this.agentIds = copy(b.agentIds);
        this.owners = copy(b.owners);
        this.operators = copy(b.operators);
        this.walletAddress = b.walletAddress;
        this.hasRegistrationFile = b.hasRegistrationFile;
        this.registeredAtFrom = b.registeredAtFrom;
        this.registeredAtTo = b.registeredAtTo;
        this.updatedAtFrom = b.updatedAtFrom;
        this.updatedAtTo = b.updatedAtTo;
        this.name = b.name;
        this.description = b.description;
        this.ensContains = b.ensContains;
        this.didContains = b.didContains;
        this.active = b.active;
        this.x402Support = b.x402Support;
        this.hasMcp = b.hasMcp;
        this.hasA2a = b.hasA2a;
        this.hasWeb = b.hasWeb;
        this.hasOasf = b.hasOasf;
        this.hasEndpoints = b.hasEndpoints;
        this.mcpContains = b.mcpContains;
        this.a2aContains = b.a2aContains;
        this.webContains = b.webContains;
        this.supportedTrust = copy(b.supportedTrust);
        this.a2aSkills = copy(b.a2aSkills);
        this.mcpTools = copy(b.mcpTools);
        this.mcpPrompts = copy(b.mcpPrompts);
        this.mcpResources = copy(b.mcpResources);
        this.oasfSkills = copy(b.oasfSkills);
        this.oasfDomains = copy(b.oasfDomains);
        this.hasMetadataKey = b.hasMetadataKey;
        this.metadataValue = b.metadataValue;
        this.feedback = b.feedback;
    }

    public static SearchFilters none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    /**
     * @return true when a non-blank keyword is present
     */
    public boolean hasKeyword() {
        return keyword != null && !keyword.isBlank();
    }

    /**
     * @return the metadata key to prefilter on, from either metadata filter, or null
     */
    public @Nullable String metadataKey() {
        if (hasMetadataKey != null && !hasMetadataKey.isBlank()) {
            return hasMetadataKey;
        }
        return metadataValue == null ? null : metadataValue.key();
    }

    /**
     * @return the metadata value to match, or null for key-only matching
     */
    public @Nullable String metadataExpectedValue() {
        return metadataValue == null ? null : metadataValue.value();
    }

    public @Nullable String keyword() {
        return keyword;
    }

    public @Nullable ChainSelector chains() {
        return chains;
    }

    public @Nullable List<String> agentIds() {
        return agentIds;
    }

    public @Nullable List<String> owners() {
        return owners;
    }

    public @Nullable List<String> operators() {
        return operators;
    }

    public @Nullable String walletAddress() {
        return walletAddress;
    }

    public @Nullable Boolean hasRegistrationFile() {
        return hasRegistrationFile;
    }

    public @Nullable String registeredAtFrom() {
        return registeredAtFrom;
    }

    public @Nullable String registeredAtTo() {
        return registeredAtTo;
    }

    public @Nullable String updatedAtFrom() {
        return updatedAtFrom;
    }

    public @Nullable String updatedAtTo() {
        return updatedAtTo;
    }

    public @Nullable String name() {
        return name;
    }

    public @Nullable String description() {
        return description;
    }

    public @Nullable String ensContains() {
        return ensContains;
    }

    public @Nullable String didContains() {
        return didContains;
    }

    public @Nullable Boolean active() {
        return active;
    }

    public @Nullable Boolean x402Support() {
        return x402Support;
    }

    public @Nullable Boolean hasMcp() {
        return hasMcp;
    }

    public @Nullable Boolean hasA2a() {
        return hasA2a;
    }

    public @Nullable Boolean hasWeb() {
        return hasWeb;
    }

    public @Nullable Boolean hasOasf() {
        return hasOasf;
    }

    public @Nullable Boolean hasEndpoints() {
        return hasEndpoints;
    }

    public @Nullable String mcpContains() {
        return mcpContains;
    }

    public @Nullable String a2aContains() {
        return a2aContains;
    }

    public @Nullable String webContains() {
        return webContains;
    }

    public @Nullable List<String> supportedTrust() {
        return supportedTrust;
    }

    public @Nullable List<String> a2aSkills() {
        return a2aSkills;
    }

    public @Nullable List<String> mcpTools() {
        return mcpTools;
    }

    public @Nullable List<String> mcpPrompts() {
        return mcpPrompts;
    }

    public @Nullable List<String> mcpResources() {
        return mcpResources;
    }

    public @Nullable List<String> oasfSkills() {
        return oasfSkills;
    }

    public @Nullable List<String> oasfDomains() {
        return oasfDomains;
    }

    public @Nullable String hasMetadataKey() {
        return hasMetadataKey;
    }

    public @Nullable MetadataFilter metadataValue() {
        return metadataValue;
    }

    public @Nullable FeedbackFilters feedback() {
        return feedback;
    }

    @Override
    public String toString() {
        return "SearchFilters{keyword=" + keyword + ", chains=" + chains + ", agentIds=" + agentIds
                + ", name=" + name + ", feedback=" + feedback + ", metadataKey=" + metadataKey() + "}";
    }

    private static @Nullable List<String> copy(@Nullable List<String> values) {
        return values == null || values.isEmpty() ? null : List.copyOf(values);
    }

    public static final class Builder {
        private String keyword;
        private ChainSelector chains;
        private List<String> agentIds;
        private List<String> owners;
        private List<String> operators;
        private String walletAddress;
        private Boolean hasRegistrationFile;
        private String registeredAtFrom;
        private String registeredAtTo;
        private String updatedAtFrom;
        private String updatedAtTo;
        private String name;
        private String description;
        private String ensContains;
        private String didContains;
        private Boolean active;
        private Boolean x402Support;
        private Boolean hasMcp;
        private Boolean hasA2a;
        private Boolean hasWeb;
        private Boolean hasOasf;
        private Boolean hasEndpoints;
        private String mcpContains;
        private String a2aContains;
        private String webContains;
        private List<String> supportedTrust;
        private List<String> a2aSkills;
        private List<String> mcpTools;
        private List<String> mcpPrompts;
        private List<String> mcpResources;
        private List<String> oasfSkills;
        private List<String> oasfDomains;
        private String hasMetadataKey;
        private MetadataFilter metadataValue;
        private FeedbackFilters feedback;

        private Builder() {
        }

        private Builder(SearchFilters f) {
            this.keyword = f.keyword;
            this.chains = f.chains;
            this.agentIds = f.agentIds;
            this.owners = f.owners;
            this.operators = f.operators;
            this.walletAddress = f.walletAddress;
            this.hasRegistrationFile = f.hasRegistrationFile;
            this.registeredAtFrom = f.registeredAtFrom;
            this.registeredAtTo = f.registeredAtTo;
            this.updatedAtFrom = f.updatedAtFrom;
            this.updatedAtTo = f.updatedAtTo;
            this.name = f.name;
            this.description = f.description;
            this.ensContains = f.ensContains;
            this.didContains = f.didContains;
            this.active = f.active;
            this.x402Support = f.x402Support;
            this.hasMcp = f.hasMcp;
            this.hasA2a = f.hasA2a;
            this.hasWeb = f.hasWeb;
            this.hasOasf = f.hasOasf;
            this.hasEndpoints = f.hasEndpoints;
            this.mcpContains = f.mcpContains;
            this.a2aContains = f.a2aContains;
            this.webContains = f.webContains;
            this.supportedTrust = f.supportedTrust;
            this.a2aSkills = f.a2aSkills;
            this.mcpTools = f.mcpTools;
            this.mcpPrompts = f.mcpPrompts;
            this.mcpResources = f.mcpResources;
            this.oasfSkills = f.oasfSkills;
            this.oasfDomains = f.oasfDomains;
            this.hasMetadataKey = f.hasMetadataKey;
            this.metadataValue = f.metadataValue;
            this.feedback = f.feedback;
        }

        public Builder keyword(String keyword) {
            this.keyword = keyword;
            return this;
        }

        public Builder chains(ChainSelector chains) {
            this.chains = chains;
            return this;
        }

        public Builder agentIds(Collection<String> agentIds) {
            this.agentIds = list(agentIds);
            return this;
        }

        public Builder agentIds(String... agentIds) {
            return agentIds(List.of(agentIds));
        }

        public Builder owners(Collection<String> owners) {
            this.owners = list(owners);
            return this;
        }

        public Builder operators(Collection<String> operators) {
            this.operators = list(operators);
            return this;
        }

        public Builder walletAddress(String walletAddress) {
            this.walletAddress = walletAddress;
            return this;
        }

        public Builder hasRegistrationFile(Boolean hasRegistrationFile) {
            this.hasRegistrationFile = hasRegistrationFile;
            return this;
        }

        public Builder registeredAtFrom(String registeredAtFrom) {
            this.registeredAtFrom = registeredAtFrom;
            return this;
        }

        public Builder registeredAtTo(String registeredAtTo) {
            this.registeredAtTo = registeredAtTo;
            return this;
        }

        public Builder updatedAtFrom(String updatedAtFrom) {
            this.updatedAtFrom = updatedAtFrom;
            return this;
        }

        public Builder updatedAtTo(String updatedAtTo) {
            this.updatedAtTo = updatedAtTo;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder ensContains(String ensContains) {
            this.ensContains = ensContains;
            return this;
        }

        public Builder didContains(String didContains) {
            this.didContains = didContains;
            return this;
        }

        public Builder active(Boolean active) {
            this.active = active;
            return this;
        }

        public Builder x402Support(Boolean x402Support) {
            this.x402Support = x402Support;
            return this;
        }

        public Builder hasMcp(Boolean hasMcp) {
            this.hasMcp = hasMcp;
            return this;
        }

        public Builder hasA2a(Boolean hasA2a) {
            this.hasA2a = hasA2a;
            return this;
        }

        public Builder hasWeb(Boolean hasWeb) {
            this.hasWeb = hasWeb;
            return this;
        }

        public Builder hasOasf(Boolean hasOasf) {
            this.hasOasf = hasOasf;
            return this;
        }

        public Builder hasEndpoints(Boolean hasEndpoints) {
            this.hasEndpoints = hasEndpoints;
            return this;
        }

        public Builder mcpContains(String mcpContains) {
            this.mcpContains = mcpContains;
            return this;
        }

        public Builder a2aContains(String a2aContains) {
            this.a2aContains = a2aContains;
            return this;
        }

        public Builder webContains(String webContains) {
            this.webContains = webContains;
            return this;
        }

        public Builder supportedTrust(Collection<String> supportedTrust) {
            this.supportedTrust = list(supportedTrust);
            return this;
        }

        public Builder a2aSkills(Collection<String> a2aSkills) {
            this.a2aSkills = list(a2aSkills);
            return this;
        }

        public Builder mcpTools(Collection<String> mcpTools) {
            this.mcpTools = list(mcpTools);
            return this;
        }

        public Builder mcpPrompts(Collection<String> mcpPrompts) {
            this.mcpPrompts = list(mcpPrompts);
            return this;
        }

        public Builder mcpResources(Collection<String> mcpResources) {
            this.mcpResources = list(mcpResources);
            return this;
        }

        public Builder oasfSkills(Collection<String> oasfSkills) {
            this.oasfSkills = list(oasfSkills);
            return this;
        }

        public Builder oasfDomains(Collection<String> oasfDomains) {
            this.oasfDomains = list(oasfDomains);
            return this;
        }

        public Builder hasMetadataKey(String hasMetadataKey) {
            this.hasMetadataKey = hasMetadataKey;
            return this;
        }

        public Builder metadataValue(MetadataFilter metadataValue) {
            this.metadataValue = metadataValue;
            return this;
        }

        public Builder feedback(FeedbackFilters feedback) {
            this.feedback = feedback;
            return this;
        }

        public SearchFilters build() {
            return new SearchFilters(this);
        }

        private static List<String> list(Collection<String> values) {
            return values == null ? null : new ArrayList<>(values);
        }
    }
}
