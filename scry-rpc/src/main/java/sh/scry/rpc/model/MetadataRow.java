// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.rpc.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.jspecify.annotations.Nullable;

/**
 * On-chain metadata entry; {@code value} is the raw {@code Bytes} hex string.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MetadataRow(
        String id,
        @Nullable String key,
        @Nullable String value,
        @Nullable String updatedAt,
        @Nullable EntityRef agent) {

    public @Nullable String agentId() {
        return agent == null ? null : agent.id();
    }
}
