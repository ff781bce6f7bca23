package io.streamchat.core.stream;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single-consumer ordered channel fed by one producer task. Closing the channel cancels the producer and
 * whatever I/O it has bound through {@link EventSink#bindCancellation(Runnable)}.
 */
public final class EventChannel implements EventSink, AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(EventChannel.class);
    private static final Object END = new Object();

    private final LinkedBlockingQueue<Object> queue = new LinkedBlockingQueue<>();
    private final CountDownLatch finished = new CountDownLatch(1);
    private final AtomicBoolean started = new AtomicBoolean();
    private final Object lock = new Object();
    private volatile boolean cancelled;
    private boolean ended;
    private Runnable cancelAction;
    private Future<?> producerTask;

    private EventChannel() {
    }

    public static EventChannel open(ExecutorService executor, Consumer<EventSink> producer) {
        Objects.requireNonNull(executor, "executor must not be null");
        Objects.requireNonNull(producer, "producer must not be null");
        EventChannel channel = new EventChannel();
        Future<?> task = executor.submit(() -> channel.runProducer(producer));
        synchronized (channel.lock) {
            channel.producerTask = task;
            if (channel.cancelled) {
                task.cancel(true);
            }
        }
        return channel;
    }

    private void runProducer(Consumer<EventSink> producer) {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        try {
            producer.accept(this);
        } catch (RuntimeException e) {
            LOG.warn("Stream producer failed", e);
            String message = e.getMessage() == null || e.getMessage().isBlank()
                ? "Unexpected error (" + e.getClass().getSimpleName() + "). Please try again."
                : "Error: " + e.getMessage();
            emit(new StreamEvent.Error(message));
        } finally {
            bindCancellation(null);
            queue.add(END);
            finished.countDown();
        }
    }

    @Override
    public boolean emit(StreamEvent event) {
        Objects.requireNonNull(event, "event must not be null");
        if (cancelled) {
            return false;
        }
        queue.add(event);
        return true;
    }

    @Override
    public boolean isCancelled() {
        return cancelled;
    }

    @Override
    public void bindCancellation(Runnable action) {
        boolean runNow;
        synchronized (lock) {
            cancelAction = action;
            runNow = cancelled && action != null;
        }
        if (runNow) {
            action.run();
        }
    }

    /**
     * Blocks for the next event. Returns {@code null} once the producer has finished or the channel was closed.
     */
    public StreamEvent next() throws InterruptedException {
        if (ended || cancelled) {
            return null;
        }
        Object item = queue.take();
        if (item == END || cancelled) {
            ended = true;
            return null;
        }
        return (StreamEvent) item;
    }

    public void forEachRemaining(Consumer<StreamEvent> consumer) throws InterruptedException {
        StreamEvent event;
        while ((event = next()) != null) {
            consumer.accept(event);
        }
    }

    public List<StreamEvent> drain() throws InterruptedException {
        List<StreamEvent> events = new ArrayList<>();
        forEachRemaining(events::add);
        return events;
    }

    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public void close() {
        Runnable action;
        Future<?> task;
        synchronized (lock) {
            if (cancelled) {
                return;
            }
            cancelled = true;
            action = cancelAction;
            task = producerTask;
        }
        if (started.compareAndSet(false, true)) {
            // producer never ran
            finished.countDown();
        }
        if (finished.getCount() == 0) {
            queue.clear();
            queue.add(END);
            return;
        }
        LOG.debug("Cancelling stream");
        if (action != null) {
            action.run();
        }
        if (task != null) {
            task.cancel(true);
        }
        queue.clear();
        queue.add(END);
    }
}
