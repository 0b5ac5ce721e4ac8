// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.rpc;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One entry of a GraphQL {@code errors} array.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GraphQlError(String message, List<Object> path) {
}
