// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.rpc.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

/**
 * Response attached to a feedback row. The scan query selects only {@code id}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ResponseRow(
        @Nullable String id,
        @Nullable String responder,
        @JsonProperty("responseURI") @JsonAlias("responseUri") @Nullable String responseUri,
        @Nullable String createdAt) {
}
