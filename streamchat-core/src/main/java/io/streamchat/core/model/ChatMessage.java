package io.streamchat.core.model;

import java.util.List;
import java.util.Objects;

public record ChatMessage(MessageRole role, String content, String toolCallId, List<ToolCall> toolCalls, String name) {

    public ChatMessage {
        Objects.requireNonNull(role, "role must not be null");
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
        if (role == MessageRole.TOOL && (toolCallId == null || toolCallId.isBlank())) {
            throw new IllegalArgumentException("tool messages require a tool_call_id");
        }
        if (role != MessageRole.ASSISTANT && !toolCalls.isEmpty()) {
            throw new IllegalArgumentException("only assistant messages may carry tool calls");
        }
    }

    public static ChatMessage of(MessageRole role, String content) {
        return new ChatMessage(role, content, null, List.of(), null);
    }

    public static ChatMessage system(String content) {
        return of(MessageRole.SYSTEM, content);
    }

    public static ChatMessage user(String content) {
        return of(MessageRole.USER, content);
    }

    public static ChatMessage assistantWithToolCalls(String content, List<ToolCall> toolCalls) {
        return new ChatMessage(MessageRole.ASSISTANT, content, null, toolCalls, null);
    }

    public static ChatMessage tool(String content, String toolCallId) {
        return new ChatMessage(MessageRole.TOOL, content, toolCallId, List.of(), null);
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }
}
