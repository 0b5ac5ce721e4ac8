// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.rpc.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

/**
 * {@code Feedback} entity.
 *
 * <p>The prefilter scan selects a minimal subset (agent, reviewer, value, tags,
 * endpoint, revocation, first response id); lookups select everything. Fields
 * that were not selected are null.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FeedbackRow(
        String id,
        @Nullable EntityRef agent,
        @Nullable String clientAddress,
        @Nullable String feedbackIndex,
        @Nullable String value,
        @Nullable String tag1,
        @Nullable String tag2,
        @Nullable String endpoint,
        @JsonProperty("feedbackURI") @JsonAlias("feedbackUri") @Nullable String feedbackUri,
        @JsonProperty("isRevoked") @Nullable Boolean revoked,
        @Nullable String createdAt,
        @Nullable FeedbackFileRow feedbackFile,
        @Nullable List<ResponseRow> responses) {

    public @Nullable String agentId() {
        return agent == null ? null : agent.id();
    }

    public boolean hasResponses() {
        return responses != null && !responses.isEmpty();
    }
}
