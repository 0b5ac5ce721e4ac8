// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.core.model;

import java.util.List;

import org.jspecify.annotations.Nullable;

/**
 * A single reputation entry left by a reviewer for an agent.
 *
 * <p>The id has the form {@code chainId:tokenId:reviewer:index}. Tags are
 * already decoded to text when the backend stored them as {@code bytes32}.
 *
 * @param value the numeric score, or null when the stored value did not parse
 */
public record Feedback(
        String id,
        String agentId,
        String reviewer,
        long feedbackIndex,
        @Nullable Double value,
        List<String> tags,
        @Nullable String endpoint,
        @Nullable String feedbackUri,
        @Nullable String createdAt,
        boolean revoked,
        @Nullable String text,
        @Nullable String capability,
        @Nullable String skill,
        @Nullable String task,
        List<FeedbackResponse> responses) {

    public Feedback {
        tags = tags == null ? List.of() : List.copyOf(tags);
        responses = responses == null ? List.of() : List.copyOf(responses);
    }

    /**
     * Builds the canonical feedback id.
     */
    public static String idOf(String agentId, String reviewer, long feedbackIndex) {
        return agentId + ":" + reviewer + ":" + feedbackIndex;
    }
}
