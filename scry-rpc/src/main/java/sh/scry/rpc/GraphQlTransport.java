// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.rpc;

import sh.scry.core.error.BackendException;

/**
 * Executes GraphQL documents against a single endpoint.
 *
 * <p>Implementations throw {@link BackendException} for transport failures,
 * non-2xx statuses, unparsable bodies and responses carrying a GraphQL
 * {@code errors} array; a returned response therefore always has usable data.
 */
public interface GraphQlTransport extends AutoCloseable {

    GraphQlResponse execute(GraphQlRequest request) throws BackendException;

    /**
     * @return the endpoint URL, for logging
     */
    String endpoint();

    static GraphQlTransport http(final String url) {
        return HttpGraphQlTransport.builder(url).build();
    }

    @Override
    default void close() {
        // default no-op
    }
}
