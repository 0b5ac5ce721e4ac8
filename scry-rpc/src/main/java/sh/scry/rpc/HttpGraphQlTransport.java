// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.rpc;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;

import sh.scry.core.DebugLogger;
import sh.scry.core.LogFormatter;
import sh.scry.core.error.BackendException;
import sh.scry.rpc.internal.JsonMappers;

/**
 * {@link GraphQlTransport} over {@code java.net.http}.
 *
 * <pre>{@code
 * GraphQlTransport transport = HttpGraphQlTransport.builder(url)
 *     .header("Authorization", "Bearer " + apiKey)
 *     .readTimeout(Duration.ofSeconds(15))
 *     .build();
 * }</pre>
 */
public final class HttpGraphQlTransport implements GraphQlTransport {

    private static final String ANONYMOUS = "anonymous";

    private final TransportConfig config;
    private final HttpClient httpClient;

    private HttpGraphQlTransport(final TransportConfig config) {
        this.config = config;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(config.connectTimeout())
                .build();
    }

    public static Builder builder(final String url) {
        return new Builder(url);
    }

    @Override
    public String endpoint() {
        return config.url();
    }

    @Override
    public GraphQlResponse execute(final GraphQlRequest request) throws BackendException {
        final String operation = request.operationName() == null ? ANONYMOUS : request.operationName();
        final String payload = serialize(request, operation);
        final HttpRequest httpRequest = buildRequest(payload);

        final long start = System.nanoTime();
        final HttpResponse<String> response = send(httpRequest, operation, start);
        final long durationMicros = (System.nanoTime() - start) / 1_000L;

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            DebugLogger.logQuery(
                    LogFormatter.formatQueryError(operation, response.statusCode(),
                            "HTTP " + response.statusCode(), durationMicros));
            throw new BackendException(
                    response.statusCode(),
                    operation,
                    "HTTP error for " + operation + ": " + response.statusCode(),
                    null);
        }

        final GraphQlResponse graphQlResponse = parseResponse(operation, response);
        if (graphQlResponse.hasErrors()) {
            final List<String> messages = graphQlResponse.errorMessages();
            DebugLogger.logQuery(
                    LogFormatter.formatQueryError(operation, response.statusCode(),
                            String.join("; ", messages), durationMicros));
            throw new BackendException(operation, messages);
        }

        DebugLogger.logQuery(LogFormatter.formatQuery(operation, durationMicros));
        return graphQlResponse;
    }

    private String serialize(final GraphQlRequest request, final String operation) throws BackendException {
        try {
            return JsonMappers.MAPPER.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new BackendException(-1, operation, "Unable to serialize GraphQL request for " + operation, e);
        }
    }

    private HttpRequest buildRequest(final String payload) {
        final HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(config.url()))
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .timeout(config.readTimeout())
                .POST(HttpRequest.BodyPublishers.ofString(payload));

        for (Map.Entry<String, String> entry : config.headers().entrySet()) {
            builder.header(entry.getKey(), entry.getValue());
        }

        return builder.build();
    }

    private HttpResponse<String> send(final HttpRequest request, final String operation, final long start)
            throws BackendException {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackendException(-1, operation, "Interrupted during GraphQL call " + operation, e);
        } catch (IOException e) {
            DebugLogger.logQuery(LogFormatter.formatQueryError(operation, -1, String.valueOf(e.getMessage()),
                    (System.nanoTime() - start) / 1_000L));
            throw new BackendException(-1, operation, "Network error during GraphQL call " + operation, e);
        }
    }

    private GraphQlResponse parseResponse(final String operation, final HttpResponse<String> response)
            throws BackendException {
        try {
            return JsonMappers.MAPPER.readValue(response.body(), GraphQlResponse.class);
        } catch (JsonProcessingException e) {
            throw new BackendException(
                    response.statusCode(),
                    operation,
                    "Unable to parse GraphQL response for " + operation,
                    e);
        }
    }

    public static final class Builder {
        private final String url;
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(30);
        private final Map<String, String> headers = new LinkedHashMap<>();

        private Builder(final String url) {
            this.url = url;
        }

        public Builder connectTimeout(final Duration connectTimeout) {
            if (connectTimeout != null) {
                this.connectTimeout = connectTimeout;
            }
            return this;
        }

        public Builder readTimeout(final Duration readTimeout) {
            if (readTimeout != null) {
                this.readTimeout = readTimeout;
            }
            return this;
        }

        public Builder header(final String key, final String value) {
            headers.put(key, value);
            return this;
        }

        public HttpGraphQlTransport build() {
            return new HttpGraphQlTransport(
                    new TransportConfig(url, connectTimeout, readTimeout, new LinkedHashMap<>(headers)));
        }
    }
}
