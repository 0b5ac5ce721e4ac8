// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.rpc;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A GraphQL POST body.
 *
 * <p>Variables may legitimately contain null values (a {@code where} entry such
 * as {@code mcpEndpoint: null}), so they are copied into an unmodifiable
 * {@link LinkedHashMap} rather than {@code Map.copyOf}.
 *
 * @param query         the document
 * @param variables     variable bindings
 * @param operationName operation to execute, also used in logs and errors
 */
public record GraphQlRequest(
        String query,
        Map<String, Object> variables,
        @JsonInclude(JsonInclude.Include.NON_NULL) String operationName) {

    public GraphQlRequest {
        Objects.requireNonNull(query, "query");
        variables = variables == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(variables));
    }
}
