// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.search;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import sh.scry.rpc.AgentBackend;

class ConfiguredBackendRegistryTest {

    private final List<String> createdFor = new ArrayList<>();

    private AgentBackend create(final String url) {
        createdFor.add(url);
        return new InMemoryAgentBackend();
    }

    @Test
    void overrideBeatsDefaultBeatsEnvironment() {
        final ConfiguredBackendRegistry registry = ConfiguredBackendRegistry.builder()
                .override(1L, "https://override/1")
                .defaults(Map.of(1L, "https://default/1", 10L, "https://default/10"))
                .environment(Map.of(
                        "SUBGRAPH_URL_1", "https://env/1",
                        "SUBGRAPH_URL_10", "https://env/10",
                        "SUBGRAPH_URL_137", "https://env/137"))
                .factory(this::create)
                .build();

        assertAll(
                () -> assertEquals("https://override/1", registry.urlFor(1L).orElseThrow()),
                () -> assertEquals("https://default/10", registry.urlFor(10L).orElseThrow()),
                () -> assertEquals("https://env/137", registry.urlFor(137L).orElseThrow()),
                () -> assertTrue(registry.urlFor(8453L).isEmpty()));
    }

    @Test
    void blankEnvironmentValueIsIgnored() {
        final ConfiguredBackendRegistry registry = ConfiguredBackendRegistry.builder()
                .environment(Map.of("SUBGRAPH_URL_137", "  "))
                .factory(this::create)
                .build();

        assertTrue(registry.backendFor(137L).isEmpty());
        assertEquals(List.of(), registry.configuredChains());
        assertTrue(createdFor.isEmpty());
    }

    @Test
    void backendIsCreatedOnceAndReused() {
        final ConfiguredBackendRegistry registry = ConfiguredBackendRegistry.builder()
                .environment(Map.of("SUBGRAPH_URL_137", "https://env/137"))
                .factory(this::create)
                .build();

        final AgentBackend first = registry.backendFor(137L).orElseThrow();
        final AgentBackend second = registry.backendFor(137L).orElseThrow();

        assertSame(first, second);
        assertEquals(List.of("https://env/137"), createdFor);
    }

    @Test
    void configuredChainsAreAscendingAndSkipMalformedVariables() {
        final ConfiguredBackendRegistry registry = ConfiguredBackendRegistry.builder()
                .override(59144L, "https://override/59144")
                .defaults(Map.of(8453L, "https://default/8453"))
                .environment(Map.of(
                        "SUBGRAPH_URL_1", "https://env/1",
                        "SUBGRAPH_URL_mainnet", "https://env/mainnet",
                        "HOME", "/root"))
                .factory(this::create)
                .build();

        assertEquals(List.of(1L, 8453L, 59144L), registry.configuredChains());
    }

    @Test
    void closeClosesCreatedBackends() {
        final List<AgentBackend> created = new ArrayList<>();
        final ConfiguredBackendRegistry registry = ConfiguredBackendRegistry.builder()
                .override(1L, "https://override/1")
                .override(10L, "https://override/10")
                .environment(Map.of())
                .factory(url -> {
                    final AgentBackend backend = mock(AgentBackend.class);
                    created.add(backend);
                    return backend;
                })
                .build();
        registry.backendFor(1L);

        registry.close();

        assertEquals(1, created.size());
        verify(created.get(0)).close();
    }

    @Test
    void fixedRegistryServesGivenBackends() {
        final InMemoryAgentBackend backend = new InMemoryAgentBackend();
        final BackendRegistry registry = BackendRegistry.of(Map.of(137L, backend, 1L, new InMemoryAgentBackend()));

        assertSame(backend, registry.backendFor(137L).orElseThrow());
        assertTrue(registry.backendFor(10L).isEmpty());
        assertEquals(List.of(1L, 137L), registry.configuredChains());
    }
}
