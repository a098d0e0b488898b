package com.agentrooms.gateway.http;

import com.agentrooms.abort.CancellationRegistry;
import com.agentrooms.agent.ChatDispatcher;
import com.agentrooms.local.ClaudeCodeProvider;
import com.agentrooms.observability.DispatchMetrics;
import com.agentrooms.orchestrator.AnthropicPlanProvider;
import com.agentrooms.providers.AgentProvider;
import com.agentrooms.providers.ProviderKind;
import com.agentrooms.providers.ProviderRegistry;
import com.agentrooms.remote.RemoteAgentProvider;
import com.agentrooms.shared.config.RemoteConfig;
import com.agentrooms.shared.error.DispatchException;
import com.agentrooms.shared.error.ErrorKind;
import com.agentrooms.shared.model.AgentDescriptor;
import com.agentrooms.shared.model.ChatRequest;
import com.agentrooms.shared.model.StreamEvent;
import com.agentrooms.stream.EventStream;
import com.agentrooms.stream.NdjsonStreamWriter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;

import java.io.ByteArrayOutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ChatControllerTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final CancellationRegistry cancellations = new CancellationRegistry();
    private final DispatchMetrics metrics = new DispatchMetrics();
    private final NdjsonStreamWriter writer = new NdjsonStreamWriter(0.0, new Random(7),
            Clock.fixed(Instant.ofEpochMilli(1_700_000_000_000L), ZoneOffset.UTC));
    private HttpServer server;

    @AfterEach
    void stopServer() {
        if (server != null) server.stop(0);
    }

    private AgentProvider provider(String id, ProviderKind kind, boolean blockUntilAborted) {
        return new AgentProvider() {
            @Override public String id() { return id; }
            @Override public ProviderKind kind() { return kind; }
            @Override
            public EventStream executeChat(ChatRequest request, AgentDescriptor target) {
                return new EventStream(request.requestId(), cancellations) {
                    final CountDownLatch aborted = new CountDownLatch(1);
                    int step;

                    @Override
                    protected void open() {
                        handle.onAbort(aborted::countDown);
                    }

                    @Override
                    protected boolean advance() throws Exception {
                        if (step++ == 0) {
                            emit(StreamEvent.text(id + " says hi"));
                            return true;
                        }
                        if (blockUntilAborted) {
                            aborted.await(5, TimeUnit.SECONDS);
                            throw DispatchException.cancelled();
                        }
                        return false;
                    }
                };
            }
        };
    }

    private ChatController controller(ProviderRegistry registry) {
        return new ChatController(new ChatDispatcher(registry, cancellations, metrics), cancellations, writer, metrics);
    }

    private ChatController localController(boolean blockUntilAborted) {
        var registry = new ProviderRegistry();
        registry.register(provider(ClaudeCodeProvider.ID, ProviderKind.LOCAL_TOOL, blockUntilAborted));
        registry.register(provider(AnthropicPlanProvider.ID, ProviderKind.LLM_API, false));
        registry.initializeDefaults("/work");
        return controller(registry);
    }

    private static List<JsonNode> events(ByteArrayOutputStream out) throws Exception {
        var events = new ArrayList<JsonNode>();
        for (var line : out.toString(StandardCharsets.UTF_8).split("\n")) {
            if (!line.isBlank()) events.add(MAPPER.readTree(line));
        }
        return events;
    }

    @Test
    void rejectsMissingFields() {
        var e = assertThrows(DispatchException.class,
                () -> localController(false).chat(ChatRequest.of("r1", " ")));
        assertEquals(ErrorKind.VALIDATION, e.kind());
        assertEquals("Missing required fields: message, requestId", e.getMessage());
        assertThrows(DispatchException.class, () -> ChatController.validate(ChatRequest.of(null, "hello")));
        assertThrows(DispatchException.class, () -> ChatController.validate(null));

        var response = localController(false).onDispatchFailure(e);
        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals("Missing required fields: message, requestId", response.getBody().get("error"));
    }

    @Test
    void backendFailureBeforeStreamingIsInternalError() {
        var response = localController(false).onDispatchFailure(DispatchException.backend("peer down"));
        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
        assertEquals("Internal server error", response.getBody().get("error"));
        assertEquals("peer down", response.getBody().get("message"));
    }

    @Test
    void streamsAckThenEventsWithNoBufferingHeaders() throws Exception {
        var response = localController(false).chat(ChatRequest.of("r1", "fix the build"));

        assertEquals(HttpStatus.OK, response.getStatusCode());
        var headers = response.getHeaders();
        assertEquals(ChatController.NDJSON, headers.getContentType());
        assertEquals("no-cache, no-store, must-revalidate", headers.getFirst(HttpHeaders.CACHE_CONTROL));
        assertEquals("no-cache", headers.getFirst(HttpHeaders.PRAGMA));
        assertEquals("0", headers.getFirst(HttpHeaders.EXPIRES));
        assertEquals("no", headers.getFirst("X-Accel-Buffering"));

        var out = new ByteArrayOutputStream();
        response.getBody().writeTo(out);

        var events = events(out);
        assertEquals(3, events.size());
        assertEquals("connection_ack", events.get(0).path("data").path("subtype").asText());
        assertEquals("claude-code says hi", events.get(1).path("content").asText());
        assertEquals("done", events.get(2).path("type").asText());
        assertEquals(1.0, metrics.outcomes("done").count());
        assertEquals(0, cancellations.size());
    }

    @Test
    void abortEndpointStopsALiveStream() throws Exception {
        var controller = localController(true);
        var body = controller.chat(ChatRequest.of("r1", "long task")).getBody();
        var out = new ByteArrayOutputStream();
        var writing = CompletableFuture.runAsync(() -> {
            try {
                body.writeTo(out);
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }
        });

        var deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!cancellations.contains("r1") && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        var response = controller.abort("r1");
        writing.get(5, TimeUnit.SECONDS);

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals(true, response.getBody().get("success"));
        assertEquals("Request aborted", response.getBody().get("message"));
        var events = events(out);
        assertEquals("aborted", events.get(events.size() - 1).path("type").asText());
        assertEquals(1.0, metrics.outcomes("aborted").count());
        assertEquals(1.0, metrics.abortSignals(true).count());
        assertFalse(cancellations.contains("r1"));
    }

    @Test
    void abortOfUnknownRequestIsNotFound() {
        var response = localController(false).abort("nope");
        assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
        assertEquals("Request not found or already completed", response.getBody().get("error"));
        assertEquals(1.0, metrics.abortSignals(false).count());
    }

    @Test
    void singleMentionIsDelegatedToThePeerEndToEnd() throws Exception {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/api/chat", exchange -> {
            exchange.getRequestBody().readAllBytes();
            exchange.sendResponseHeaders(200, 0);
            try (var peer = exchange.getResponseBody()) {
                peer.write(("{\"type\":\"claude_json\",\"data\":{\"type\":\"system\",\"subtype\":\"connection_ack\"}}\n"
                        + "{\"type\":\"text_delta\",\"content\":\"rows: 42\"}\n"
                        + "{\"type\":\"done\"}\n").getBytes(StandardCharsets.UTF_8));
            }
        });
        server.start();
        var endpoint = "http://127.0.0.1:" + server.getAddress().getPort() + "/";

        var registry = new ProviderRegistry();
        registry.register(provider(AnthropicPlanProvider.ID, ProviderKind.LLM_API, false));
        registry.register(new RemoteAgentProvider(
                new RemoteConfig(Duration.ofSeconds(5), Duration.ofSeconds(5)), cancellations));
        registry.initializeDefaults("/work");

        var request = ChatRequest.of("r9", "@db-agent count rows")
                .withAgents(List.of(AgentDescriptor.worker("db-agent", "Database", endpoint)));
        var out = new ByteArrayOutputStream();
        controller(registry).chat(request).getBody().writeTo(out);

        var events = events(out);
        assertEquals(List.of("claude_json", "claude_json", "text_delta", "done"),
                events.stream().map(e -> e.path("type").asText()).toList());
        assertEquals("rows: 42", events.get(2).path("content").asText());
    }

    @Test
    void multiAgentEndpointUsesThePlanner() throws Exception {
        var out = new ByteArrayOutputStream();
        localController(false).multiAgentChat(ChatRequest.of("r2", "plain message")).getBody().writeTo(out);

        assertEquals("anthropic says hi", events(out).get(1).path("content").asText());
    }
}
