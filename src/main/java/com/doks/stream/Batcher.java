package com.doks.stream;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class Batcher {
    private static final Logger log = LoggerFactory.getLogger(Batcher.class);

    private Batcher() {
    }

    /**
     * Regroups {@code source} into lists of exactly {@code size} items, the last one holding the remainder.
     * The accumulating producer hands batches over a channel of capacity 1, so it only moves ahead of the
     * consumer by one batch. A failure while pulling from {@code source} ends the stream with that failure
     * and the partial batch is dropped.
     */
    public static <T> ChannelStream<List<T>> batched(Iterator<T> source, int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("batch size must be positive, got " + size);
        }
        return ChannelStream.open(1, sender -> {
            try {
                List<T> batch = new ArrayList<>(size);
                while (source.hasNext()) {
                    batch.add(source.next());
                    if (batch.size() >= size) {
                        sender.send(batch);
                        batch = new ArrayList<>(size);
                    }
                }
                if (!batch.isEmpty()) {
                    log.debug("Flushing final batch of {} items", batch.size());
                    sender.send(batch);
                }
            } finally {
                if (source instanceof AutoCloseable closeable) {
                    closeable.close();
                }
            }
        });
    }
}
