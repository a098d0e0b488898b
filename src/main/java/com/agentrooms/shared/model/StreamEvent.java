package com.agentrooms.shared.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One element of a chat response stream. Exactly one terminal event
 * ({@link Done}, {@link Failed} or {@link Aborted}) closes every stream.
 */
public sealed interface StreamEvent {

    String type();

    default boolean isTerminal() {
        return false;
    }

    record TextDelta(String content) implements StreamEvent {
        @Override
        public String type() { return "text_delta"; }
    }

    record ClaudeJson(JsonNode data) implements StreamEvent {
        @Override
        public String type() { return "claude_json"; }
    }

    record Done() implements StreamEvent {
        @Override
        public String type() { return "done"; }

        @Override
        public boolean isTerminal() { return true; }
    }

    record Failed(String error) implements StreamEvent {
        @Override
        public String type() { return "error"; }

        @Override
        public boolean isTerminal() { return true; }
    }

    record Aborted() implements StreamEvent {
        @Override
        public String type() { return "aborted"; }

        @Override
        public boolean isTerminal() { return true; }
    }

    static StreamEvent text(String content) {
        return new TextDelta(content);
    }

    static StreamEvent claudeJson(JsonNode data) {
        return new ClaudeJson(data);
    }

    static StreamEvent done() {
        return new Done();
    }

    static StreamEvent failed(String error) {
        return new Failed(error);
    }

    static StreamEvent aborted() {
        return new Aborted();
    }
}
