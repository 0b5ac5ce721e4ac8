// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.search;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import sh.scry.rpc.AgentBackend;

/**
 * Resolves the structured backend serving each chain.
 *
 * <p>Implementations memoize: repeated lookups for a chain return the same
 * instance for the lifetime of the registry.
 */
public interface BackendRegistry extends AutoCloseable {

    /**
     * @return the chain's backend, or empty when none is configured
     */
    Optional<AgentBackend> backendFor(long chainId);

    /**
     * @return every chain with a configured backend, ascending
     */
    List<Long> configuredChains();

    /**
     * Registry over a fixed set of backends, mostly for tests and embedding.
     */
    static BackendRegistry of(final Map<Long, ? extends AgentBackend> backends) {
        return new ConfiguredBackendRegistry.Fixed(backends);
    }

    @Override
    default void close() {
        // default no-op
    }
}
