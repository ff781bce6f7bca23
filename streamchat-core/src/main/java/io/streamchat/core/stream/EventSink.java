package io.streamchat.core.stream;

public interface EventSink {

    boolean emit(StreamEvent event);

    boolean isCancelled();

    // null unbinds; runs immediately if already cancelled
    void bindCancellation(Runnable cancelAction);
}
