// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.rpc.semantic;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;

import sh.scry.core.DebugLogger;
import sh.scry.core.LogFormatter;
import sh.scry.core.error.SemanticSearchException;
import sh.scry.rpc.internal.JsonMappers;

/**
 * {@link SemanticSearchClient} for the hosted search service.
 *
 * <p>Posts {@code {query, minScore, limit}} to {@code <baseUrl>/api/v1/search}. The
 * service answers either {@code {"results": [...]}} or a bare array; anything else
 * that is valid JSON is treated as no hits.
 */
public final class HttpSemanticSearchClient implements SemanticSearchClient {

    public static final String DEFAULT_BASE_URL = "https://semantic-search.ag0.xyz";

    private final String baseUrl;
    private final Duration timeout;
    private final HttpClient httpClient;

    private HttpSemanticSearchClient(final String baseUrl, final Duration timeout) {
        this.baseUrl = stripTrailingSlash(baseUrl);
        this.timeout = timeout;
        this.httpClient = HttpClient.newBuilder().connectTimeout(timeout).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String baseUrl() {
        return baseUrl;
    }

    @Override
    public List<SemanticHit> search(final String query, final double minScore, final int limit)
            throws SemanticSearchException {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        final String trimmed = query.trim();
        final Map<String, Object> body = new LinkedHashMap<>();
        body.put("query", trimmed);
        body.put("minScore", minScore);
        body.put("limit", limit);

        final HttpRequest request;
        try {
            request = HttpRequest.newBuilder(URI.create(baseUrl + "/api/v1/search"))
                    .header("Content-Type", "application/json")
                    .header("Accept", "application/json")
                    .timeout(timeout)
                    .POST(HttpRequest.BodyPublishers.ofString(JsonMappers.MAPPER.writeValueAsString(body)))
                    .build();
        } catch (JsonProcessingException e) {
            throw new SemanticSearchException(-1, "Unable to serialize semantic search request", e);
        }

        final long start = System.nanoTime();
        final HttpResponse<String> response = send(request);
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new SemanticSearchException(response.statusCode(),
                    "Semantic search failed with HTTP " + response.statusCode(), null);
        }
        final List<SemanticHit> hits = parse(response);
        DebugLogger.logSearch(LogFormatter.formatSemantic(trimmed, hits.size(), (System.nanoTime() - start) / 1_000L));
        return hits;
    }

    private HttpResponse<String> send(final HttpRequest request) throws SemanticSearchException {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SemanticSearchException(-1, "Interrupted during semantic search", e);
        } catch (IOException e) {
            throw new SemanticSearchException(-1, "Network error during semantic search: " + e.getMessage(), e);
        }
    }

    private static List<SemanticHit> parse(final HttpResponse<String> response) throws SemanticSearchException {
        final Object decoded;
        try {
            decoded = JsonMappers.MAPPER.readValue(response.body(), Object.class);
        } catch (JsonProcessingException e) {
            throw new SemanticSearchException(response.statusCode(), "Semantic search returned a non-JSON body", e);
        }
        final Object results = decoded instanceof Map<?, ?> map ? map.get("results") : decoded;
        if (!(results instanceof List<?> entries)) {
            return List.of();
        }
        final List<SemanticHit> hits = new ArrayList<>(entries.size());
        for (Object entry : entries) {
            SemanticHit.fromJson(entry).ifPresent(hits::add);
        }
        return hits;
    }

    private static String stripTrailingSlash(final String url) {
        String out = url;
        while (out.endsWith("/")) {
            out = out.substring(0, out.length() - 1);
        }
        return out;
    }

    public static final class Builder {
        private String baseUrl = DEFAULT_BASE_URL;
        private Duration timeout = Duration.ofSeconds(20);

        private Builder() {
        }

        public Builder baseUrl(final String baseUrl) {
            if (baseUrl != null && !baseUrl.isBlank()) {
                this.baseUrl = baseUrl;
            }
            return this;
        }

        public Builder timeout(final Duration timeout) {
            if (timeout != null) {
                this.timeout = timeout;
            }
            return this;
        }

        public HttpSemanticSearchClient build() {
            return new HttpSemanticSearchClient(baseUrl, timeout);
        }
    }
}
