// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.core.model;

import org.jspecify.annotations.Nullable;

/**
 * A response appended to a feedback entry by the agent or a third party.
 */
public record FeedbackResponse(
        @Nullable String responder,
        @Nullable String responseUri,
        @Nullable String createdAt) {
}
