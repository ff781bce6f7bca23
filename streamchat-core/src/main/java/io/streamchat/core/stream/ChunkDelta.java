package io.streamchat.core.stream;

import java.util.List;

public record ChunkDelta(String content, String reasoning, List<ToolCallDelta> toolCalls, String finishReason) {

    public ChunkDelta {
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }

    public boolean finished() {
        return finishReason != null;
    }
}
