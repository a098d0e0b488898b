package com.agentrooms.stream;

import com.agentrooms.shared.model.StreamEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.UncheckedIOException;
import java.util.Optional;

/**
 * NDJSON wire form of {@link StreamEvent}. Decoding is lenient: blank lines,
 * malformed JSON and unknown {@code type} values all decode to empty.
 */
public final class StreamEventCodec {

    private static final ObjectMapper mapper = new ObjectMapper();

    private StreamEventCodec() {}

    public static ObjectNode toJson(StreamEvent event) {
        var node = mapper.createObjectNode();
        node.put("type", event.type());
        if (event instanceof StreamEvent.TextDelta text) {
            node.put("content", text.content());
        } else if (event instanceof StreamEvent.ClaudeJson json) {
            node.set("data", json.data());
        } else if (event instanceof StreamEvent.Failed failed) {
            node.put("error", failed.error());
        }
        return node;
    }

    public static String encode(StreamEvent event) {
        try {
            return mapper.writeValueAsString(toJson(event));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static Optional<StreamEvent> decode(String line) {
        if (line == null || line.isBlank()) return Optional.empty();
        JsonNode node;
        try {
            node = mapper.readTree(line);
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
        return decode(node);
    }

    public static Optional<StreamEvent> decode(JsonNode node) {
        if (node == null || !node.isObject()) return Optional.empty();
        switch (node.path("type").asText("")) {
            case "text_delta": {
                var content = node.hasNonNull("content") ? node.get("content") : node.get("text");
                return content != null && content.isTextual()
                        ? Optional.of(StreamEvent.text(content.asText()))
                        : Optional.empty();
            }
            case "claude_json": {
                var data = node.get("data");
                return data != null && !data.isNull()
                        ? Optional.of(StreamEvent.claudeJson(data))
                        : Optional.empty();
            }
            case "done":
                return Optional.of(StreamEvent.done());
            case "error": {
                var error = node.hasNonNull("error") ? node.get("error") : node.path("content");
                return Optional.of(StreamEvent.failed(error.asText("Unknown error")));
            }
            case "aborted":
                return Optional.of(StreamEvent.aborted());
            default:
                return Optional.empty();
        }
    }
}
