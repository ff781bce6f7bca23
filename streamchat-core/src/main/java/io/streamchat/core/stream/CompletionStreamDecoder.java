package io.streamchat.core.stream;

import java.util.Objects;

public final class CompletionStreamDecoder {
    static final String TOOL_CALLS_FINISH = "tool_calls";

    private final SseEventParser parser;
    private final EventSink sink;
    private final ToolCallAggregator toolCalls = new ToolCallAggregator();
    private boolean terminated;

    public CompletionStreamDecoder(SseEventParser parser, EventSink sink) {
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
    }

    public boolean accept(String line) {
        if (terminated) {
            return false;
        }
        SseFrame frame = parser.parse(line);
        if (frame instanceof SseFrame.Terminate) {
            terminate();
            sink.emit(StreamEvent.DONE);
            return false;
        }
        if (frame instanceof SseFrame.Chunk chunk) {
            return onDelta(chunk.delta());
        }
        return true;
    }

    public void finish() {
        // stream ran out without [DONE] or a finish reason
        if (!terminated) {
            terminate();
            sink.emit(StreamEvent.DONE);
        }
    }

    public void abandon() {
        terminate();
    }

    private boolean onDelta(ChunkDelta delta) {
        if (delta.content() != null && !delta.content().isEmpty()) {
            sink.emit(new StreamEvent.Content(delta.content()));
        }
        if (delta.reasoning() != null && !delta.reasoning().isEmpty()) {
            sink.emit(new StreamEvent.Reasoning(delta.reasoning()));
        }
        for (ToolCallDelta toolCall : delta.toolCalls()) {
            toolCalls.accept(toolCall);
        }

        if (!delta.finished()) {
            return true;
        }
        if (TOOL_CALLS_FINISH.equals(delta.finishReason())) {
            terminated = true;
            toolCalls.finish(sink);
            return false;
        }
        terminate();
        sink.emit(StreamEvent.DONE);
        return false;
    }

    private void terminate() {
        terminated = true;
        toolCalls.discard();
    }
}
