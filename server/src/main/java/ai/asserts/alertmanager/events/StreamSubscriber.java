/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.events;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One unidirectional push connection. Events are buffered in a bounded queue and written by {@link #serve(EventSink)}
 * which waits for whichever comes first: the next event, the keep-alive interval, or {@link #close()}.
 */
@Slf4j
public class StreamSubscriber implements EventSubscriber {
    private static final Event CLOSE = Event.builder().build();

    @Getter
    private final String id = "stream-" + UUID.randomUUID();
    private final BlockingQueue<Event> queue;
    private final Duration keepAlive;
    private final AtomicLong dropped = new AtomicLong();
    private volatile boolean closed;

    public StreamSubscriber(int queueSize, Duration keepAlive) {
        this.queue = new ArrayBlockingQueue<>(queueSize);
        this.keepAlive = keepAlive;
    }

    @Override
    public boolean offer(Event event) {
        if (closed) {
            return false;
        }
        if (!queue.offer(event)) {
            dropped.incrementAndGet();
            return false;
        }
        return true;
    }

    @Override
    public long getDroppedCount() {
        return dropped.get();
    }

    public int getQueued() {
        return queue.size();
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Idempotent. Wakes up a serving loop that is waiting for events.
     */
    public void close() {
        if (!closed) {
            closed = true;
            queue.clear();
            queue.offer(CLOSE);
        }
    }

    /**
     * Writes events to the sink until the subscriber is closed, the sink fails or the thread is interrupted.
     */
    public void serve(EventSink sink) {
        try {
            while (!closed) {
                Event event = queue.poll(keepAlive.toMillis(), TimeUnit.MILLISECONDS);
                if (event == CLOSE || closed) {
                    break;
                } else if (event == null) {
                    sink.keepAlive();
                } else {
                    sink.send(event);
                }
            }
        } catch (IOException e) {
            log.debug("Stream {} disconnected: {}", id, e.getMessage());
        } catch (InterruptedException e) {
            log.debug("Stream {} interrupted", id);
            Thread.currentThread().interrupt();
        } finally {
            close();
        }
    }
}
