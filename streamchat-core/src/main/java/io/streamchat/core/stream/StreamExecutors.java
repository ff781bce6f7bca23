package io.streamchat.core.stream;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

public final class StreamExecutors {
    private static final ExecutorService SHARED = Executors.newCachedThreadPool(daemonThreads("streamchat-io"));

    private StreamExecutors() {
    }

    public static ExecutorService shared() {
        return SHARED;
    }

    public static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
