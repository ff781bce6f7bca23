package io.streamchat.core.stream;

public sealed interface SseFrame permits SseFrame.Skip, SseFrame.Terminate, SseFrame.Chunk {

    Skip SKIP = new Skip();
    Terminate TERMINATE = new Terminate();

    record Skip() implements SseFrame {
    }

    record Terminate() implements SseFrame {
    }

    record Chunk(ChunkDelta delta) implements SseFrame {
    }
}
