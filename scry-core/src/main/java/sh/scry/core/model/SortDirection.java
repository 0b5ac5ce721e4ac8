// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.core.model;

import java.util.Locale;

/**
 * Sort direction, rendered in lowercase as the subgraph's {@code OrderDirection}.
 */
public enum SortDirection {
    ASC,
    DESC;

    /**
     * Parses {@code asc}/{@code desc} case-insensitively; anything else is {@link #DESC}.
     */
    public static SortDirection parse(String value) {
        if (value != null && "asc".equals(value.trim().toLowerCase(Locale.ROOT))) {
            return ASC;
        }
        return DESC;
    }

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
