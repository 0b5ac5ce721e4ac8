// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.rpc;

import java.util.EnumSet;
import java.util.Set;

import org.jspecify.annotations.Nullable;

import sh.scry.core.error.BackendException;

/**
 * Known schema variants across subgraph deployments.
 *
 * <p>Each rule names the canonical field and what replaces it on deployments that
 * lack it: a renamed field, or nothing (the field is dropped from selections).
 */
public enum SchemaRule {
    RESPONSE_URI_LOWERCASE("FeedbackResponse", "responseURI", "responseUri"),
    X402_SUPPORT_LOWERCASE("AgentRegistrationFile", "x402Support", "x402support"),
    AGENT_WALLET_DROPPED("AgentRegistrationFile", "agentWallet", null),
    AGENT_WALLET_CHAIN_DROPPED("AgentRegistrationFile", "agentWalletChainId", null),
    /** Selections read {@code oasfEndpoint}; {@code hasOASF} filters become null checks on it. */
    OASF_ENDPOINT_FALLBACK("AgentRegistrationFile", "hasOASF", "oasfEndpoint"),
    METADATA_COLLECTION_RENAMED("Query", "agentMetadatas", "agentMetadata_collection");

    private final String typeName;
    private final String field;
    private final @Nullable String replacement;

    SchemaRule(String typeName, String field, @Nullable String replacement) {
        this.typeName = typeName;
        this.field = field;
        this.replacement = replacement;
    }

    public String typeName() {
        return typeName;
    }

    public String field() {
        return field;
    }

    public @Nullable String replacement() {
        return replacement;
    }

    public boolean drops() {
        return replacement == null;
    }

    /**
     * Rules not yet in {@code active} whose canonical field the backend reported as missing.
     */
    public static Set<SchemaRule> fixesFor(BackendException error, Set<SchemaRule> active) {
        final Set<SchemaRule> fixes = EnumSet.noneOf(SchemaRule.class);
        for (SchemaRule rule : values()) {
            if (!active.contains(rule) && error.isMissingField(rule.typeName, rule.field)) {
                fixes.add(rule);
            }
        }
        return fixes;
    }
}
