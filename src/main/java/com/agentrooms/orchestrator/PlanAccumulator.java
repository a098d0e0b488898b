package com.agentrooms.orchestrator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Rebuilds the assistant message content from Messages API stream events.
 * Tool input arrives as {@code partial_json} fragments and is only parsed
 * once its block stops; an unparseable input keeps its raw text.
 */
public class PlanAccumulator {

    private static final Logger log = LoggerFactory.getLogger(PlanAccumulator.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Map<Integer, Block> blocks = new TreeMap<>();
    private final List<String> diagnostics = new ArrayList<>();

    private static final class Block {
        final ObjectNode node;
        final StringBuilder text = new StringBuilder();
        final StringBuilder partialJson = new StringBuilder();
        JsonNode input;

        Block(ObjectNode node) {
            this.node = node;
        }

        boolean isToolUse() {
            return "tool_use".equals(node.path("type").asText());
        }
    }

    public void start(int index, JsonNode contentBlock) {
        var node = contentBlock != null && contentBlock.isObject()
                ? ((ObjectNode) contentBlock).deepCopy()
                : MAPPER.createObjectNode();
        var block = new Block(node);
        if (block.isToolUse()) {
            node.put("input", "");
        } else if (node.hasNonNull("text")) {
            block.text.append(node.get("text").asText());
        }
        blocks.put(index, block);
    }

    /** Applies one {@code content_block_delta}. Deltas for unknown blocks start a block of the delta's kind. */
    public void delta(int index, JsonNode delta) {
        var kind = delta.path("type").asText();
        var block = blocks.get(index);
        if (block == null) {
            var node = MAPPER.createObjectNode();
            node.put("type", "input_json_delta".equals(kind) ? "tool_use" : "text");
            start(index, node);
            block = blocks.get(index);
        }
        if ("text_delta".equals(kind)) {
            block.text.append(delta.path("text").asText(""));
        } else if ("input_json_delta".equals(kind)) {
            block.partialJson.append(delta.path("partial_json").asText(""));
        }
    }

    public void stop(int index) {
        var block = blocks.get(index);
        if (block == null || !block.isToolUse()) return;
        var raw = block.partialJson.toString();
        if (raw.isBlank()) {
            block.input = MAPPER.createObjectNode();
            return;
        }
        try {
            block.input = MAPPER.readTree(raw);
        } catch (JsonProcessingException e) {
            var diagnostic = "Failed to parse input of block " + index + ": " + e.getOriginalMessage();
            diagnostics.add(diagnostic);
            log.warn(diagnostic);
        }
    }

    public String rawInput(int index) {
        var block = blocks.get(index);
        return block != null ? block.partialJson.toString() : "";
    }

    public List<String> diagnostics() {
        return List.copyOf(diagnostics);
    }

    /** Content blocks in index order, as the final assistant message carries them. */
    public ArrayNode content() {
        var content = MAPPER.createArrayNode();
        for (var block : blocks.values()) {
            var node = block.node.deepCopy();
            if (block.isToolUse()) {
                node.set("input", block.input != null ? block.input : TextNode.valueOf(block.partialJson.toString()));
            } else if ("text".equals(node.path("type").asText())) {
                node.put("text", block.text.toString());
            }
            content.add(node);
        }
        return content;
    }

    public Optional<ExecutionPlan> plan() {
        for (var block : blocks.values()) {
            if (!block.isToolUse() || block.input == null || !block.input.isObject()) continue;
            if (!OrchestrationTool.NAME.equals(block.node.path("name").asText())) continue;
            try {
                return Optional.of(MAPPER.treeToValue(block.input, ExecutionPlan.class));
            } catch (JsonProcessingException e) {
                diagnostics.add("Plan does not match the tool schema: " + e.getOriginalMessage());
                log.warn("Plan does not match the tool schema: {}", e.getOriginalMessage());
            }
        }
        return Optional.empty();
    }
}
