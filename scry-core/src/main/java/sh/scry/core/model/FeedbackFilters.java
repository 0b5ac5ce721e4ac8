// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.core.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import org.jspecify.annotations.Nullable;

/**
 * Reputation constraints embedded in {@link SearchFilters}.
 *
 * <p>Constraints fall into three groups:
 * <ul>
 * <li>existence flags: {@code hasFeedback}, {@code hasNoFeedback}</li>
 * <li>aggregate thresholds over matching rows: {@code minCount}, {@code maxCount},
 *     {@code minValue}, {@code maxValue} (closed intervals)</li>
 * <li>row constraints: reviewers, endpoint substring, tags, {@code hasResponse=true}</li>
 * </ul>
 * {@code includeRevoked} widens which rows count at all.
 *
 * <p>A pure {@code hasFeedback} can be answered by the backend from the agent's
 * feedback counter. Everything else requires scanning feedback rows, see
 * {@link #requiresScan()}.
 */
public record FeedbackFilters(
        @Nullable Boolean hasFeedback,
        @Nullable Boolean hasNoFeedback,
        boolean includeRevoked,
        @Nullable Double minValue,
        @Nullable Double maxValue,
        @Nullable Integer minCount,
        @Nullable Integer maxCount,
        @Nullable List<String> fromReviewers,
        @Nullable String endpoint,
        @Nullable Boolean hasResponse,
        @Nullable String tag1,
        @Nullable String tag2,
        @Nullable String tag) {

    public FeedbackFilters {
        fromReviewers = fromReviewers == null || fromReviewers.isEmpty() ? null : List.copyOf(fromReviewers);
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean wantsFeedback() {
        return Boolean.TRUE.equals(hasFeedback);
    }

    public boolean wantsNoFeedback() {
        return Boolean.TRUE.equals(hasNoFeedback);
    }

    public boolean hasThreshold() {
        return minValue != null || maxValue != null || minCount != null || maxCount != null;
    }

    public boolean hasRowConstraint() {
        return fromReviewers != null
                || notBlank(endpoint)
                || Boolean.TRUE.equals(hasResponse)
                || notBlank(tag1)
                || notBlank(tag2)
                || notBlank(tag);
    }

    /**
     * @return true when feedback rows must be scanned, i.e. the constraint is more than a
     *         pure {@code hasFeedback} existence check
     */
    public boolean requiresScan() {
        return wantsNoFeedback() || hasThreshold() || hasRowConstraint();
    }

    /**
     * @return true when only {@code hasFeedback} is set and it can be answered by the backend
     */
    public boolean isExistenceOnly() {
        return wantsFeedback() && !requiresScan();
    }

    public boolean isEmpty() {
        return !wantsFeedback() && !requiresScan();
    }

    public boolean passesThresholds(FeedbackStats stats) {
        final double average = stats.average();
        if (minCount != null && stats.count() < minCount) {
            return false;
        }
        if (maxCount != null && stats.count() > maxCount) {
            return false;
        }
        if (minValue != null && average < minValue) {
            return false;
        }
        return maxValue == null || average <= maxValue;
    }

    static boolean notBlank(@Nullable String value) {
        return value != null && !value.isBlank();
    }

    public static final class Builder {
        private Boolean hasFeedback;
        private Boolean hasNoFeedback;
        private boolean includeRevoked;
        private Double minValue;
        private Double maxValue;
        private Integer minCount;
        private Integer maxCount;
        private List<String> fromReviewers;
        private String endpoint;
        private Boolean hasResponse;
        private String tag1;
        private String tag2;
        private String tag;

        private Builder() {
        }

        public Builder hasFeedback(Boolean hasFeedback) {
            this.hasFeedback = hasFeedback;
            return this;
        }

        public Builder hasNoFeedback(Boolean hasNoFeedback) {
            this.hasNoFeedback = hasNoFeedback;
            return this;
        }

        public Builder includeRevoked(boolean includeRevoked) {
            this.includeRevoked = includeRevoked;
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

        public Builder minCount(Integer minCount) {
            this.minCount = minCount;
            return this;
        }

        public Builder maxCount(Integer maxCount) {
            this.maxCount = maxCount;
            return this;
        }

        public Builder fromReviewers(Collection<String> reviewers) {
            this.fromReviewers = reviewers == null ? null : new ArrayList<>(reviewers);
            return this;
        }

        public Builder endpoint(String endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder hasResponse(Boolean hasResponse) {
            this.hasResponse = hasResponse;
            return this;
        }

        public Builder tag1(String tag1) {
            this.tag1 = tag1;
            return this;
        }

        public Builder tag2(String tag2) {
            this.tag2 = tag2;
            return this;
        }

        public Builder tag(String tag) {
            this.tag = tag;
            return this;
        }

        public FeedbackFilters build() {
            return new FeedbackFilters(hasFeedback, hasNoFeedback, includeRevoked, minValue, maxValue,
                    minCount, maxCount, fromReviewers, endpoint, hasResponse, tag1, tag2, tag);
        }
    }
}
