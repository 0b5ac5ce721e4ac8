// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.search.refresh;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * {@link RegistrationFetcher} over HTTP(S).
 *
 * <p>IPFS URIs, bare CIDs and URLs of well-known public gateways are resolved
 * through a single configured gateway.
 */
public final class HttpRegistrationFetcher implements RegistrationFetcher {

    public static final String DEFAULT_IPFS_GATEWAY = "https://ipfs.io/ipfs/";

    private final String ipfsGateway;
    private final Duration timeout;
    private final HttpClient httpClient;

    private HttpRegistrationFetcher(final String ipfsGateway, final Duration timeout) {
        this.ipfsGateway = ipfsGateway.endsWith("/") ? ipfsGateway : ipfsGateway + "/";
        this.timeout = timeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String fetch(final String uri) throws IOException {
        final String url = resolve(uri);
        final HttpRequest request = HttpRequest.newBuilder(URI.create(url))
                .header("Accept", "application/json")
                .timeout(timeout)
                .GET()
                .build();
        final HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while fetching " + url, e);
        }
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new IOException("Fetching " + url + " failed with HTTP " + response.statusCode());
        }
        return response.body();
    }

    /**
     * @throws IOException if the URI scheme is not supported
     */
    String resolve(final String uri) throws IOException {
        final String path = UriTypes.ipfsPath(uri);
        if (path != null) {
            return ipfsGateway + path;
        }
        final String type = UriTypes.detect(uri);
        if (UriTypes.HTTPS.equals(type) || UriTypes.HTTP.equals(type)) {
            return uri;
        }
        throw new IOException("Unsupported agent URI: " + uri);
    }

    public static final class Builder {
        private String ipfsGateway = DEFAULT_IPFS_GATEWAY;
        private Duration timeout = Duration.ofSeconds(10);

        private Builder() {
        }

        public Builder ipfsGateway(final String ipfsGateway) {
            if (ipfsGateway != null && !ipfsGateway.isBlank()) {
                this.ipfsGateway = ipfsGateway;
            }
            return this;
        }

        public Builder timeout(final Duration timeout) {
            if (timeout != null) {
                this.timeout = timeout;
            }
            return this;
        }

        public HttpRegistrationFetcher build() {
            return new HttpRegistrationFetcher(ipfsGateway, timeout);
        }
    }
}
