// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.search;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.scry.rpc.AgentBackend;
import sh.scry.rpc.SubgraphClient;

/**
 * {@link BackendRegistry} that builds backends from endpoint URLs.
 *
 * <p>A chain's URL is taken from, in order: explicit overrides, the static
 * defaults, then the environment variable {@code SUBGRAPH_URL_<chainId>}. The
 * backend for a chain is created on first lookup and reused afterwards.
 *
 * <pre>{@code
 * BackendRegistry registry = ConfiguredBackendRegistry.builder()
 *     .override(11155111L, "https://api.studio.thegraph.com/query/.../v1")
 *     .build();
 * }</pre>
 */
public final class ConfiguredBackendRegistry implements BackendRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(ConfiguredBackendRegistry.class);

    static final String ENV_PREFIX = "SUBGRAPH_URL_";

    private final Map<Long, String> overrides;
    private final Map<Long, String> defaults;
    private final Map<String, String> environment;
    private final Function<String, ? extends AgentBackend> factory;
    private final Map<Long, AgentBackend> backends = new ConcurrentHashMap<>();

    private ConfiguredBackendRegistry(final Builder builder) {
        this.overrides = Map.copyOf(builder.overrides);
        this.defaults = Map.copyOf(builder.defaults);
        this.environment = Map.copyOf(builder.environment);
        this.factory = builder.factory;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public Optional<AgentBackend> backendFor(final long chainId) {
        final AgentBackend cached = backends.get(chainId);
        if (cached != null) {
            return Optional.of(cached);
        }
        final Optional<String> url = urlFor(chainId);
        if (url.isEmpty()) {
            LOG.debug("No backend URL configured for chain {}", chainId);
            return Optional.empty();
        }
        return Optional.of(backends.computeIfAbsent(chainId, id -> {
            final AgentBackend backend = factory.apply(url.get());
            LOG.info("Created backend for chain {}", id);
            return backend;
        }));
    }

    /**
     * Resolves the endpoint URL for a chain without creating a backend.
     */
    public Optional<String> urlFor(final long chainId) {
        final String override = overrides.get(chainId);
        if (override != null) {
            return Optional.of(override);
        }
        final String fallback = defaults.get(chainId);
        if (fallback != null) {
            return Optional.of(fallback);
        }
        final String key = ENV_PREFIX + chainId;
        final String fromEnv = environment.get(key);
        if (fromEnv != null && !fromEnv.isBlank()) {
            LOG.info("Using backend URL from environment variable {}", key);
            return Optional.of(fromEnv);
        }
        return Optional.empty();
    }

    @Override
    public List<Long> configuredChains() {
        final TreeSet<Long> chains = new TreeSet<>();
        chains.addAll(overrides.keySet());
        chains.addAll(defaults.keySet());
        for (Map.Entry<String, String> entry : environment.entrySet()) {
            if (!entry.getKey().startsWith(ENV_PREFIX) || entry.getValue() == null || entry.getValue().isBlank()) {
                continue;
            }
            try {
                chains.add(Long.parseLong(entry.getKey().substring(ENV_PREFIX.length())));
            } catch (NumberFormatException e) {
                LOG.debug("Ignoring malformed backend variable {}", entry.getKey());
            }
        }
        return new ArrayList<>(chains);
    }

    @Override
    public void close() {
        for (Map.Entry<Long, AgentBackend> entry : backends.entrySet()) {
            try {
                entry.getValue().close();
            } catch (Exception e) {
                LOG.warn("Failed to close backend for chain {}", entry.getKey(), e);
            }
        }
        backends.clear();
    }

    public static final class Builder {
        private final Map<Long, String> overrides = new HashMap<>();
        private final Map<Long, String> defaults = new HashMap<>();
        private Map<String, String> environment = System.getenv();
        private Function<String, ? extends AgentBackend> factory = SubgraphClient::connect;

        private Builder() {
        }

        public Builder override(final long chainId, final String url) {
            overrides.put(chainId, Objects.requireNonNull(url, "url"));
            return this;
        }

        public Builder overrides(final Map<Long, String> urls) {
            overrides.putAll(urls);
            return this;
        }

        /**
         * Static per-chain URLs used when no override is present.
         */
        public Builder defaults(final Map<Long, String> urls) {
            defaults.putAll(urls);
            return this;
        }

        /**
         * Replaces the environment consulted for {@code SUBGRAPH_URL_<chainId>}; defaults to {@link System#getenv()}.
         */
        public Builder environment(final Map<String, String> environment) {
            this.environment = Objects.requireNonNull(environment, "environment");
            return this;
        }

        public Builder factory(final Function<String, ? extends AgentBackend> factory) {
            this.factory = Objects.requireNonNull(factory, "factory");
            return this;
        }

        public ConfiguredBackendRegistry build() {
            return new ConfiguredBackendRegistry(this);
        }
    }

    /**
     * Registry over already-built backends.
     */
    static final class Fixed implements BackendRegistry {
        private final Map<Long, AgentBackend> backends;

        Fixed(final Map<Long, ? extends AgentBackend> backends) {
            this.backends = new TreeMap<>(backends);
        }

        @Override
        public Optional<AgentBackend> backendFor(final long chainId) {
            return Optional.ofNullable(backends.get(chainId));
        }

        @Override
        public List<Long> configuredChains() {
            return new ArrayList<>(backends.keySet());
        }

        @Override
        public void close() {
            for (AgentBackend backend : backends.values()) {
                try {
                    backend.close();
                } catch (Exception e) {
                    LOG.warn("Failed to close backend", e);
                }
            }
        }
    }
}
