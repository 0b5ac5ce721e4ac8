// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.rpc.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.jspecify.annotations.Nullable;

/**
 * Off-chain feedback document indexed next to the on-chain feedback entry.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FeedbackFileRow(
        @Nullable String text,
        @Nullable String capability,
        @Nullable String name,
        @Nullable String skill,
        @Nullable String task) {
}
