package com.agentrooms.gateway.http;

import com.agentrooms.abort.CancellationRegistry;
import com.agentrooms.agent.ChatDispatcher;
import com.agentrooms.observability.DispatchMetrics;
import com.agentrooms.shared.error.DispatchException;
import com.agentrooms.shared.error.ErrorKind;
import com.agentrooms.shared.model.ChatRequest;
import com.agentrooms.stream.EventStream;
import com.agentrooms.stream.NdjsonStreamWriter;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api")
public class ChatController {

    private static final Logger log = LoggerFactory.getLogger(ChatController.class);
    static final MediaType NDJSON = MediaType.parseMediaType("application/x-ndjson");

    private final ChatDispatcher dispatcher;
    private final CancellationRegistry cancellations;
    private final NdjsonStreamWriter writer;
    private final DispatchMetrics metrics;

    public ChatController(ChatDispatcher dispatcher, CancellationRegistry cancellations,
                          NdjsonStreamWriter writer, DispatchMetrics metrics) {
        this.dispatcher = dispatcher;
        this.cancellations = cancellations;
        this.writer = writer;
        this.metrics = metrics;
    }

    @PostMapping("/chat")
    public ResponseEntity<StreamingResponseBody> chat(@RequestBody ChatRequest request) {
        validate(request);
        log.debug("Chat request {}", request);
        return stream(dispatcher.dispatch(request));
    }

    @PostMapping("/multi-agent-chat")
    public ResponseEntity<StreamingResponseBody> multiAgentChat(@RequestBody ChatRequest request) {
        validate(request);
        log.debug("Multi-agent request {}", request);
        return stream(dispatcher.dispatchOrchestrated(request));
    }

    @PostMapping("/abort/{requestId}")
    public ResponseEntity<Map<String, Object>> abort(@PathVariable String requestId) {
        var found = cancellations.signal(requestId);
        metrics.abortSignals(found).increment();
        log.info("Abort {} for request {}", found ? "signalled" : "ignored", requestId);
        if (!found) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(Map.of("error", "Request not found or already completed"));
        }
        return ResponseEntity.ok(Map.of("success", true, "message", "Request aborted"));
    }

    private ResponseEntity<StreamingResponseBody> stream(EventStream events) {
        StreamingResponseBody body = out -> {
            var sample = Timer.start(metrics.registry());
            try {
                var terminal = writer.write(events, out);
                metrics.recordOutcome(terminal);
            } catch (IOException e) {
                metrics.recordOutcome(null);
                throw e;
            } finally {
                sample.stop(metrics.streamDuration());
            }
        };
        return ResponseEntity.ok()
                .contentType(NDJSON)
                .header(HttpHeaders.CACHE_CONTROL, "no-cache, no-store, must-revalidate")
                .header(HttpHeaders.PRAGMA, "no-cache")
                .header(HttpHeaders.EXPIRES, "0")
                .header("X-Accel-Buffering", "no")
                .body(body);
    }

    static void validate(ChatRequest request) {
        if (request == null || isBlank(request.message()) || isBlank(request.requestId())) {
            throw DispatchException.validation("Missing required fields: message, requestId");
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    @ExceptionHandler(DispatchException.class)
    public ResponseEntity<Map<String, Object>> onDispatchFailure(DispatchException e) {
        if (e.kind() == ErrorKind.VALIDATION) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
        log.error("Dispatch failed before streaming", e);
        return internalError(e);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> onUnreadableBody(HttpMessageNotReadableException e) {
        var body = new LinkedHashMap<String, Object>();
        body.put("error", "Invalid request body");
        body.put("message", String.valueOf(e.getMostSpecificCause().getMessage()));
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<Map<String, Object>> onUnexpected(RuntimeException e) {
        log.error("Unexpected failure before streaming", e);
        return internalError(e);
    }

    private static ResponseEntity<Map<String, Object>> internalError(Exception e) {
        var body = new LinkedHashMap<String, Object>();
        body.put("error", "Internal server error");
        body.put("message", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }
}
