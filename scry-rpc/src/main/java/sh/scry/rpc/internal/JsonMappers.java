// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.rpc.internal;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Shared Jackson configuration for wire payloads.
 */
public final class JsonMappers {

    /** Lenient mapper: backend deployments add fields faster than clients learn about them. */
    public static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private JsonMappers() {
    }
}
