package com.agentrooms.remote;

import com.agentrooms.abort.CancellationRegistry;
import com.agentrooms.providers.AgentProvider;
import com.agentrooms.providers.ProviderKind;
import com.agentrooms.shared.config.RemoteConfig;
import com.agentrooms.shared.error.DispatchException;
import com.agentrooms.shared.model.AgentDescriptor;
import com.agentrooms.shared.model.ChatRequest;
import com.agentrooms.stream.BlockingLineReader;
import com.agentrooms.stream.EventStream;
import com.agentrooms.stream.StreamEventCodec;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Forwards a request to one peer agent's {@code /api/chat} and re-streams its
 * NDJSON response unchanged.
 */
public class RemoteAgentProvider implements AgentProvider {

    public static final String ID = "remote-http";

    private static final Logger log = LoggerFactory.getLogger(RemoteAgentProvider.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final int MAX_ERROR_BODY = 2048;

    private final HttpClient httpClient;
    private final RemoteConfig config;
    private final CancellationRegistry cancellations;

    public RemoteAgentProvider(RemoteConfig config, CancellationRegistry cancellations) {
        this(HttpClient.newBuilder().connectTimeout(config.connectTimeout()).build(), config, cancellations);
    }

    public RemoteAgentProvider(HttpClient httpClient, RemoteConfig config, CancellationRegistry cancellations) {
        this.httpClient = httpClient;
        this.config = config;
        this.cancellations = cancellations;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public ProviderKind kind() {
        return ProviderKind.REMOTE_HTTP;
    }

    @Override
    public EventStream executeChat(ChatRequest request, AgentDescriptor target) {
        return new RemoteRun(request, target);
    }

    static ObjectNode payload(ChatRequest request, AgentDescriptor target) {
        var body = MAPPER.createObjectNode();
        body.put("message", request.message());
        body.put("sessionId", request.sessionId());
        body.put("requestId", request.requestId());
        body.put("workingDirectory", target.workingDirectory());
        if (request.claudeAuth() != null) {
            body.set("claudeAuth", MAPPER.valueToTree(request.claudeAuth()));
        }
        return body;
    }

    static DispatchException statusError(AgentDescriptor agent, int status, String body) {
        if (status == 401 || status == 403) {
            return DispatchException.authentication("Authentication failed for agent " + agent.id()
                    + ". Please check OAuth credentials. Status: " + status);
        }
        if (status >= 500) {
            return DispatchException.backend("Agent " + agent.id() + " server error (" + status + "): " + body);
        }
        return DispatchException.backend("HTTP error from agent " + agent.id() + "! status: " + status);
    }

    private final class RemoteRun extends EventStream {

        private final ChatRequest request;
        private final AgentDescriptor target;
        private CompletableFuture<HttpResponse<InputStream>> pending;
        private InputStream body;
        private BlockingLineReader reader;

        RemoteRun(ChatRequest request, AgentDescriptor target) {
            super(request.requestId(), cancellations);
            this.request = request;
            this.target = target;
        }

        @Override
        protected void open() throws IOException {
            if (target == null || !target.hasEndpoint()) {
                throw DispatchException.backend("Agent "
                        + (target != null ? target.id() : "(none)") + " has no API endpoint");
            }
            var uri = URI.create(target.apiEndpoint().replaceAll("/+$", "") + "/api/chat");
            var json = MAPPER.writeValueAsString(payload(request, target));
            log.info("Delegating {} to agent {} at {}", requestId, target.id(), uri);
            if (log.isDebugEnabled() && request.claudeAuth() != null) {
                log.debug("Forwarding credentials {}", request.claudeAuth());
            }

            var httpReq = HttpRequest.newBuilder()
                    .uri(uri)
                    .header("Content-Type", "application/json")
                    .header("Cache-Control", "no-cache")
                    .POST(HttpRequest.BodyPublishers.ofString(json))
                    .build();
            pending = httpClient.sendAsync(httpReq, HttpResponse.BodyHandlers.ofInputStream());
            handle.onAbort(() -> pending.cancel(true));

            HttpResponse<InputStream> resp;
            try {
                resp = pending.join();
            } catch (CancellationException e) {
                throw DispatchException.cancelled();
            } catch (CompletionException e) {
                var cause = e.getCause() != null ? e.getCause() : e;
                throw DispatchException.backend("Failed to reach agent " + target.id() + ": "
                        + (cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName()), cause);
            }
            body = resp.body();

            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                String text;
                try (var in = body) {
                    text = new String(in.readNBytes(MAX_ERROR_BODY), StandardCharsets.UTF_8);
                }
                throw statusError(target, resp.statusCode(), text);
            }

            reader = new BlockingLineReader(body, "remote-" + target.id() + "-" + requestId);
            handle.onAbort(reader::interrupt);
        }

        @Override
        protected boolean advance() throws Exception {
            var line = reader.next(config.readTimeout());
            if (line == null) {
                log.info("Agent {} closed the stream for {}", target.id(), requestId);
                return false;
            }
            var event = StreamEventCodec.decode(line);
            if (event.isEmpty()) {
                if (!line.isBlank()) log.debug("Skipping line from {}: {}", target.id(), line);
                return true;
            }
            emit(event.get());
            return true;
        }

        @Override
        protected void cleanup() throws IOException {
            if (reader != null) {
                reader.close();
            } else if (body != null) {
                body.close();
            }
            if (pending != null) pending.cancel(true);
        }
    }
}
