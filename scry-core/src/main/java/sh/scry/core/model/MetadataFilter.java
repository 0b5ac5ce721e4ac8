// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.core.model;

import java.util.Objects;

import org.jspecify.annotations.Nullable;

/**
 * On-chain metadata key, optionally with the exact value it must hold.
 *
 * @param key   the metadata key
 * @param value the expected UTF-8 value, or null to match any value
 */
public record MetadataFilter(String key, @Nullable String value) {

    public MetadataFilter {
        Objects.requireNonNull(key, "key");
        if (key.isBlank()) {
            throw new IllegalArgumentException("metadata key must not be blank");
        }
    }

    public static MetadataFilter hasKey(String key) {
        return new MetadataFilter(key, null);
    }
}
