package com.agentrooms.orchestrator;

import com.agentrooms.abort.CancellationRegistry;
import com.agentrooms.providers.AgentProvider;
import com.agentrooms.providers.ProviderKind;
import com.agentrooms.shared.config.OrchestratorConfig;
import com.agentrooms.shared.error.DispatchException;
import com.agentrooms.shared.model.AgentDescriptor;
import com.agentrooms.shared.model.ChatRequest;
import com.agentrooms.shared.model.StreamEvent;
import com.agentrooms.stream.BlockingLineReader;
import com.agentrooms.stream.EventStream;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
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
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.stream.Collectors;

/**
 * Asks the Anthropic Messages API for an execution plan across the worker
 * agents, forcing a call to {@code orchestrate_execution}, and streams the
 * result as Claude-style JSON events.
 */
public class AnthropicPlanProvider implements AgentProvider {

    public static final String ID = "anthropic";

    private static final Logger log = LoggerFactory.getLogger(AnthropicPlanProvider.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final int MAX_ERROR_BODY = 2048;

    private final String apiKey;
    private final OrchestratorConfig config;
    private final HttpClient httpClient;
    private final CancellationRegistry cancellations;
    private final Clock clock;

    public AnthropicPlanProvider(String apiKey, OrchestratorConfig config, CancellationRegistry cancellations) {
        this(apiKey, config, HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(),
                cancellations, Clock.systemUTC());
    }

    public AnthropicPlanProvider(String apiKey, OrchestratorConfig config, HttpClient httpClient,
                                 CancellationRegistry cancellations, Clock clock) {
        this.apiKey = apiKey;
        this.config = config;
        this.httpClient = httpClient;
        this.cancellations = cancellations;
        this.clock = clock;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public ProviderKind kind() {
        return ProviderKind.LLM_API;
    }

    @Override
    public PlanStream executeChat(ChatRequest request, AgentDescriptor target) {
        return new PlanStream(request, workers(request.availableAgents()));
    }

    static List<AgentDescriptor> workers(List<AgentDescriptor> agents) {
        return agents.stream().filter(a -> !a.orchestrator()).collect(Collectors.toList());
    }

    /** Event stream of one planning call; exposes the plan once the message has stopped. */
    public final class PlanStream extends EventStream {

        private final ChatRequest request;
        private final List<AgentDescriptor> workers;
        private final String sessionId;
        private final PlanAccumulator accumulator = new PlanAccumulator();
        private CompletableFuture<HttpResponse<InputStream>> pending;
        private BlockingLineReader reader;
        private ObjectNode message;
        private ExecutionPlan plan;

        PlanStream(ChatRequest request, List<AgentDescriptor> workers) {
            super(request.requestId(), cancellations);
            this.request = request;
            this.workers = workers;
            this.sessionId = request.sessionId() != null && !request.sessionId().isBlank()
                    ? request.sessionId()
                    : "anthropic-" + clock.millis();
        }

        public Optional<ExecutionPlan> plan() {
            return Optional.ofNullable(plan);
        }

        public PlanAccumulator accumulator() {
            return accumulator;
        }

        @Override
        protected void open() throws IOException {
            if (apiKey == null || apiKey.isBlank()) {
                throw DispatchException.authentication(
                        "ANTHROPIC_API_KEY environment variable is required for orchestrator mode");
            }
            var body = OrchestrationTool.requestBody(config, request.message(), workers);
            log.info("Planning {} across {} agent(s) with {}", requestId, workers.size(), config.model());

            var httpReq = HttpRequest.newBuilder()
                    .uri(URI.create(config.baseUrl() + "/v1/messages"))
                    .header("Content-Type", "application/json")
                    .header("Accept", "text/event-stream")
                    .header("x-api-key", apiKey)
                    .header("anthropic-version", config.apiVersion())
                    .POST(HttpRequest.BodyPublishers.ofString(MAPPER.writeValueAsString(body)))
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
                throw DispatchException.backend("Anthropic API request failed: " + cause.getMessage(), cause);
            }

            if (resp.statusCode() != 200) {
                String text;
                try (var in = resp.body()) {
                    text = new String(in.readNBytes(MAX_ERROR_BODY), StandardCharsets.UTF_8);
                }
                if (resp.statusCode() == 401 || resp.statusCode() == 403) {
                    throw DispatchException.authentication("Anthropic API authentication failed ("
                            + resp.statusCode() + "): " + text);
                }
                throw DispatchException.backend("Anthropic API error " + resp.statusCode() + ": " + text);
            }

            reader = new BlockingLineReader(resp.body(), "anthropic-" + requestId);
            handle.onAbort(reader::interrupt);
            emit(StreamEvent.claudeJson(initEvent()));
        }

        @Override
        protected boolean advance() throws Exception {
            var line = reader.next();
            if (line == null) return false;
            line = line.trim();
            if (!line.startsWith("data:")) return true;
            var data = line.substring(5).trim();
            if (data.isEmpty() || "[DONE]".equals(data)) return true;

            JsonNode event;
            try {
                event = MAPPER.readTree(data);
            } catch (JsonProcessingException e) {
                log.debug("Skipping malformed SSE data for {}: {}", requestId, data);
                return true;
            }
            handleEvent(event);
            return true;
        }

        private void handleEvent(JsonNode event) {
            var index = event.path("index").asInt(0);
            switch (event.path("type").asText()) {
                case "message_start":
                    startMessage(event.path("message"));
                    break;
                case "content_block_start":
                    accumulator.start(index, event.path("content_block"));
                    break;
                case "content_block_delta":
                    applyBlockDelta(index, event);
                    break;
                case "content_block_stop":
                    accumulator.stop(index);
                    break;
                case "message_delta":
                    applyMessageDelta(event);
                    break;
                case "message_stop":
                    completeMessage();
                    break;
                case "error":
                    throw DispatchException.backend("Anthropic API error: "
                            + event.path("error").path("message").asText("unknown error"));
                default:
                    log.trace("Ignoring SSE event {}", event.path("type").asText());
            }
        }

        private void applyBlockDelta(int index, JsonNode event) {
            var delta = event.path("delta");
            accumulator.delta(index, delta);
            var kind = delta.path("type").asText();
            if ("text_delta".equals(kind)) {
                emit(StreamEvent.text(delta.path("text").asText("")));
            } else if ("input_json_delta".equals(kind)) {
                var wrapped = MAPPER.createObjectNode();
                wrapped.put("type", "stream_event");
                wrapped.set("event", event);
                wrapped.put("session_id", sessionId);
                emit(StreamEvent.claudeJson(wrapped));
            }
        }

        private void startMessage(JsonNode source) {
            message = MAPPER.createObjectNode();
            message.put("id", source.path("id").asText(""));
            message.put("type", "message");
            message.put("role", source.path("role").asText("assistant"));
            message.put("model", source.path("model").asText(config.model()));
            message.putArray("content");
            message.putNull("stop_reason");
            message.putNull("stop_sequence");
            var usage = message.putObject("usage");
            if (source.path("usage").isObject()) usage.setAll((ObjectNode) source.get("usage"));
        }

        private void applyMessageDelta(JsonNode event) {
            if (message == null) startMessage(MAPPER.createObjectNode());
            var delta = event.path("delta");
            if (delta.has("stop_reason")) message.set("stop_reason", delta.get("stop_reason"));
            if (delta.has("stop_sequence")) message.set("stop_sequence", delta.get("stop_sequence"));
            var usage = event.path("usage");
            if (usage.isObject()) {
                ((ObjectNode) message.get("usage")).setAll((ObjectNode) usage);
            }
        }

        private void completeMessage() {
            if (message == null) startMessage(MAPPER.createObjectNode());
            message.set("content", accumulator.content());
            var assistant = MAPPER.createObjectNode();
            assistant.put("type", "assistant");
            assistant.set("message", message);
            assistant.put("session_id", sessionId);
            emit(StreamEvent.claudeJson(assistant));

            plan = accumulator.plan().orElse(null);
            if (plan != null) {
                log.info("Plan for {} has {} step(s)", requestId, plan.steps().size());
            } else {
                log.warn("No usable plan for {}: {}", requestId, accumulator.diagnostics());
            }
        }

        private ObjectNode initEvent() {
            var init = MAPPER.createObjectNode();
            init.put("type", "system");
            init.put("subtype", "init");
            init.put("session_id", sessionId);
            init.put("model", config.model());
            init.putArray("tools").add(OrchestrationTool.NAME);
            return init;
        }

        @Override
        protected void cleanup() {
            if (reader != null) reader.close();
            if (pending != null) pending.cancel(true);
        }
    }
}
