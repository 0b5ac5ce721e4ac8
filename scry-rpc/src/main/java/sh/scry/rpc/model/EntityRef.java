// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.rpc.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Reference to a related entity, selected as {@code { id }}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EntityRef(String id) {
}
