// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.rpc;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Connection settings shared by the HTTP clients in this module.
 *
 * @param url            endpoint URL
 * @param connectTimeout TCP connect timeout (default 10s)
 * @param readTimeout    per-request timeout (default 30s)
 * @param headers        extra request headers, e.g. {@code Authorization}
 */
public record TransportConfig(
        String url,
        Duration connectTimeout,
        Duration readTimeout,
        Map<String, String> headers) {

    private static final Duration DEFAULT_CONNECT = Duration.ofSeconds(10);
    private static final Duration DEFAULT_READ = Duration.ofSeconds(30);

    public TransportConfig {
        Objects.requireNonNull(url, "url");
        connectTimeout = connectTimeout == null ? DEFAULT_CONNECT : connectTimeout;
        readTimeout = readTimeout == null ? DEFAULT_READ : readTimeout;
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public static TransportConfig withDefaults(final String url) {
        return new TransportConfig(url, DEFAULT_CONNECT, DEFAULT_READ, Map.of());
    }
}
