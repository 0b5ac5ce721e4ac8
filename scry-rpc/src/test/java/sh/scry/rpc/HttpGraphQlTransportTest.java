// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.rpc;

import static org.junit.jupiter.api.Assertions.*;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import sh.scry.core.ScryDebug;
import sh.scry.core.error.BackendException;
import sh.scry.rpc.model.AgentRow;

class HttpGraphQlTransportTest {

    private HttpServer server;
    private String url;
    private final Logger debugLogger = (Logger) LoggerFactory.getLogger("sh.scry.debug");
    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.start();
        url = "http://127.0.0.1:" + server.getAddress().getPort() + "/graphql";
        appender = new ListAppender<>();
        appender.start();
        debugLogger.addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
        ScryDebug.setEnabled(false);
        debugLogger.detachAndStopAllAppenders();
    }

    @Test
    void postsQueryAndDecodesRows() {
        final AtomicReference<String> body = new AtomicReference<>();
        final AtomicReference<String> auth = new AtomicReference<>();
        server.createContext("/graphql", exchange -> {
            body.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            auth.set(exchange.getRequestHeaders().getFirst("Authorization"));
            respond(exchange, 200, """
                    {"data":{"agents":[{"id":"1:7","chainId":"1","agentId":"7","agentURI":"ipfs://x","extra":1}]}}
                    """);
        });

        final GraphQlTransport transport = HttpGraphQlTransport.builder(url)
                .header("Authorization", "Bearer secret")
                .build();
        final GraphQlResponse response = transport.execute(
                new GraphQlRequest("query Q { agents { id } }", Map.of("first", 5), "Q"));

        final List<AgentRow> rows = response.list("agents", AgentRow.class);
        assertAll(
                () -> assertEquals(1, rows.size()),
                () -> assertEquals("1:7", rows.get(0).id()),
                () -> assertEquals("ipfs://x", rows.get(0).agentUri()),
                () -> assertEquals("Bearer secret", auth.get()),
                () -> assertTrue(body.get().contains("\"operationName\":\"Q\"")),
                () -> assertTrue(body.get().contains("\"first\":5")));
    }

    @Test
    void nonSuccessStatusThrowsWithStatus() {
        server.createContext("/graphql", exchange -> respond(exchange, 502, "bad gateway"));

        final GraphQlTransport transport = GraphQlTransport.http(url);
        final BackendException ex = assertThrows(BackendException.class,
                () -> transport.execute(new GraphQlRequest("{ agents { id } }", Map.of(), "Agents")));

        assertAll(
                () -> assertEquals(502, ex.status()),
                () -> assertEquals("Agents", ex.operation()),
                () -> assertFalse(ex.isGraphQlError()));
    }

    @Test
    void graphQlErrorsThrowWithMessages() {
        server.createContext("/graphql", exchange -> respond(exchange, 200, """
                {"data":null,"errors":[{"message":"Type `AgentRegistrationFile` has no field `agentWallet`"}]}
                """));

        final GraphQlTransport transport = GraphQlTransport.http(url);
        final BackendException ex = assertThrows(BackendException.class,
                () -> transport.execute(new GraphQlRequest("{ x }", Map.of(), null)));

        assertAll(
                () -> assertTrue(ex.isGraphQlError()),
                () -> assertEquals("anonymous", ex.operation()),
                () -> assertTrue(ex.isMissingField("agentWallet")),
                () -> assertFalse(ex.isMissingField("agentWalletChainId")));
    }

    @Test
    void unparsableBodyThrows() {
        server.createContext("/graphql", exchange -> respond(exchange, 200, "<html>nope</html>"));

        final GraphQlTransport transport = GraphQlTransport.http(url);
        final BackendException ex = assertThrows(BackendException.class,
                () -> transport.execute(new GraphQlRequest("{ x }", Map.of(), "X")));
        assertEquals(200, ex.status());
    }

    @Test
    void unreachableEndpointThrowsWithoutStatus() {
        server.stop(0);

        final GraphQlTransport transport = GraphQlTransport.http(url);
        final BackendException ex = assertThrows(BackendException.class,
                () -> transport.execute(new GraphQlRequest("{ x }", Map.of(), "X")));
        assertEquals(-1, ex.status());
    }

    @Test
    void logsQueriesWhenDebugEnabled() {
        server.createContext("/graphql", exchange -> respond(exchange, 200, "{\"data\":{}}"));
        ScryDebug.setQueryLogging(true);

        GraphQlTransport.http(url).execute(new GraphQlRequest("{ x }", Map.of(), "Probe"));

        assertEquals(1, appender.list.size());
        final String line = appender.list.get(0).getFormattedMessage();
        assertTrue(line.contains("[QUERY]"));
        assertTrue(line.contains("op=Probe"));
    }

    @Test
    void logsQueryErrorsWhenDebugEnabled() {
        server.createContext("/graphql", exchange -> respond(exchange, 500, "boom"));
        ScryDebug.setQueryLogging(true);

        assertThrows(BackendException.class,
                () -> GraphQlTransport.http(url).execute(new GraphQlRequest("{ x }", Map.of(), "Probe")));

        assertEquals(1, appender.list.size());
        assertTrue(appender.list.get(0).getFormattedMessage().contains("[QUERY-ERROR]"));
    }

    @Test
    void quietWhenDebugDisabled() {
        server.createContext("/graphql", exchange -> respond(exchange, 200, "{\"data\":{}}"));

        GraphQlTransport.http(url).execute(new GraphQlRequest("{ x }", Map.of(), "Probe"));

        assertTrue(appender.list.isEmpty());
    }

    static void respond(HttpExchange exchange, int status, String body) throws IOException {
        final byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
