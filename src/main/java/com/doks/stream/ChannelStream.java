package com.doks.stream;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a producer running on its own task into a single-shot, backpressured sequence.
 *
 * <p>The producer writes into a bounded channel through a {@link Sender}; the consumer reads the
 * values in send order through the {@link Iterator} methods. When the producer throws, the consumer
 * sees every value sent before the failure and then exactly one {@link StreamException} from
 * {@link #next()}, after which the stream is exhausted.
 *
 * <p>A full channel blocks the producer on its next send. {@link #close()} discards buffered values,
 * interrupts the producer and makes every later send fail with {@link StreamClosedException}. It may be
 * called from another thread, in which case a consumer waiting in {@link #hasNext()} returns {@code false}.
 */
public final class ChannelStream<T> implements Iterator<T>, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ChannelStream.class);

    public static final int DEFAULT_CAPACITY = 1;
    private static final long CLOSE_CHECK_INTERVAL_MS = 50;

    private static final ExecutorService DEFAULT_EXECUTOR =
            Executors.newCachedThreadPool(new NamedThreadFactory("doks-stream"));

    private final BlockingQueue<Signal<T>> channel;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile Future<?> task;
    private Signal<T> pending;
    private boolean finished;

    private ChannelStream(int capacity) {
        this.channel = new ArrayBlockingQueue<>(capacity);
    }

    public static <T> ChannelStream<T> open(Producer<T> producer) {
        return open(DEFAULT_CAPACITY, DEFAULT_EXECUTOR, producer);
    }

    public static <T> ChannelStream<T> open(int capacity, Producer<T> producer) {
        return open(capacity, DEFAULT_EXECUTOR, producer);
    }

    public static <T> ChannelStream<T> open(int capacity, ExecutorService executor, Producer<T> producer) {
        if (capacity < 1) {
            throw new IllegalArgumentException("channel capacity must be at least 1, got " + capacity);
        }
        ChannelStream<T> stream = new ChannelStream<>(capacity);
        stream.task = executor.submit(() -> stream.run(producer));
        return stream;
    }

    public static <T> ChannelStream<T> of(List<T> items) {
        List<T> snapshot = List.copyOf(items);
        return open(sender -> {
            for (T item : snapshot) {
                sender.send(item);
            }
        });
    }

    @Override
    public boolean hasNext() {
        if (closed.get()) {
            return false;
        }
        if (pending == null && !finished) {
            try {
                pending = awaitSignal();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new StreamException("Interrupted while waiting for the next stream item", e);
            }
            if (pending == null) {
                // closed while waiting
                return false;
            }
            if (pending.kind() == Kind.END) {
                pending = null;
                finished = true;
            }
        }
        return pending != null;
    }

    @Override
    public T next() {
        if (!hasNext()) {
            throw new NoSuchElementException("stream is exhausted");
        }
        Signal<T> signal = pending;
        pending = null;
        if (signal.kind() == Kind.FAILURE) {
            finished = true;
            throw new StreamException(signal.failure());
        }
        return signal.value();
    }

    // a closed producer never sends END, so the wait re-checks the flag instead of blocking in take()
    private Signal<T> awaitSignal() throws InterruptedException {
        Signal<T> signal = channel.poll(CLOSE_CHECK_INTERVAL_MS, TimeUnit.MILLISECONDS);
        while (signal == null) {
            if (closed.get()) {
                return null;
            }
            signal = channel.poll(CLOSE_CHECK_INTERVAL_MS, TimeUnit.MILLISECONDS);
        }
        if (closed.get()) {
            return null;
        }
        return signal;
    }

    public List<T> toList() {
        List<T> items = new ArrayList<>();
        try {
            forEachRemaining(items::add);
        } finally {
            close();
        }
        return items;
    }

    public Stream<T> stream() {
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED), false)
                .onClose(this::close);
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        channel.clear();
        pending = null;
        Future<?> running = task;
        if (running != null && !running.isDone()) {
            log.debug("Stream closed before its producer finished, cancelling producer");
            running.cancel(true);
        }
    }

    private void run(Producer<T> producer) {
        try {
            producer.produce(item -> put(new Signal<>(Kind.ITEM, item, null)));
            put(new Signal<>(Kind.END, null, null));
            log.debug("Stream completed successfully");
        } catch (StreamClosedException e) {
            log.debug("Stream producer stopped, consumer closed the stream");
        } catch (InterruptedException e) {
            if (!closed.get()) {
                forwardFailure(e);
            }
            Thread.currentThread().interrupt();
        } catch (Throwable e) {
            forwardFailure(rootOf(e));
        }
    }

    // a failure re-thrown from an upstream stream is forwarded as its original cause
    private static Throwable rootOf(Throwable failure) {
        Throwable current = failure;
        while (current instanceof StreamException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private void forwardFailure(Throwable cause) {
        if (closed.get()) {
            log.debug("Stream producer failed after the stream was closed: {}", cause.toString());
            return;
        }
        log.debug("Stream producer failed, sending the error through the channel: {}", cause.toString());
        try {
            put(new Signal<>(Kind.FAILURE, null, cause));
        } catch (StreamClosedException e) {
            log.warn("Couldn't send stream error through the channel, stream already closed", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while sending stream error through the channel", cause);
        }
    }

    private void put(Signal<T> signal) throws StreamClosedException, InterruptedException {
        if (closed.get()) {
            throw new StreamClosedException();
        }
        channel.put(signal);
        if (closed.get()) {
            channel.clear();
            throw new StreamClosedException();
        }
    }

    @FunctionalInterface
    public interface Producer<T> {
        void produce(Sender<T> sender) throws Exception;
    }

    @FunctionalInterface
    public interface Sender<T> {
        void send(T item) throws StreamClosedException, InterruptedException;
    }

    private enum Kind {
        ITEM,
        FAILURE,
        END
    }

    private record Signal<T>(Kind kind, T value, Throwable failure) {
    }
}
