package io.streamchat.core.stream;

public record ToolCallDelta(int index, String id, String name, String arguments) {
}
