// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.core.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import org.jspecify.annotations.Nullable;

/**
 * Criteria for listing feedback entries.
 *
 * <p>Agent ids may be chain-prefixed; unprefixed ids belong to the default chain.
 * The query runs on the chain of the first agent, or the default chain when no
 * agent is given.
 */
public record FeedbackSearchParams(
        List<String> agents,
        List<String> reviewers,
        List<String> tags,
        @Nullable Double minValue,
        @Nullable Double maxValue,
        boolean includeRevoked) {

    public FeedbackSearchParams {
        agents = agents == null ? List.of() : List.copyOf(agents);
        reviewers = reviewers == null ? List.of() : List.copyOf(reviewers);
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<String> agents = new ArrayList<>();
        private final List<String> reviewers = new ArrayList<>();
        private final List<String> tags = new ArrayList<>();
        private Double minValue;
        private Double maxValue;
        private boolean includeRevoked;

        private Builder() {
        }

        public Builder agents(Collection<String> values) {
            agents.addAll(values);
            return this;
        }

        public Builder agent(String agentId) {
            agents.add(agentId);
            return this;
        }

        public Builder reviewers(Collection<String> values) {
            reviewers.addAll(values);
            return this;
        }

        public Builder tags(Collection<String> values) {
            tags.addAll(values);
            return this;
        }

        public Builder minValue(Double minValue) {
            this.minValue = minValue;
            return this;
        }

        public Builder maxValue(Double maxValue) {
            this.maxValue = maxValue;
            return this;
        }

        public Builder includeRevoked(boolean includeRevoked) {
            this.includeRevoked = includeRevoked;
            return this;
        }

        public FeedbackSearchParams build() {
            return new FeedbackSearchParams(agents, reviewers, tags, minValue, maxValue, includeRevoked);
        }
    }
}
