/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.events;

import org.easymock.EasyMockSupport;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;

import static org.easymock.EasyMock.expectLastCall;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class StreamSubscriberTest extends EasyMockSupport {
    private static final Instant NOW = Instant.parse("2023-06-01T10:00:00Z");

    @Test
    public void serve_writesQueuedEventsInOrder() throws IOException {
        StreamSubscriber subscriber = new StreamSubscriber(10, Duration.ofSeconds(15));
        EventSink sink = strictMock(EventSink.class);
        Event first = event(EventType.ALERT_FIRING);
        Event second = event(EventType.ALERT_RESOLVED);

        sink.send(first);
        sink.send(second);
        expectLastCall().andAnswer(() -> {
            subscriber.close();
            return null;
        });
        replayAll();

        assertTrue(subscriber.offer(first));
        assertTrue(subscriber.offer(second));
        subscriber.serve(sink);

        assertTrue(subscriber.isClosed());
        verifyAll();
    }

    @Test
    public void serve_keepAliveWhenIdle() throws IOException {
        StreamSubscriber subscriber = new StreamSubscriber(10, Duration.ofMillis(1));
        EventSink sink = mock(EventSink.class);

        sink.keepAlive();
        expectLastCall().andAnswer(() -> {
            subscriber.close();
            return null;
        });
        replayAll();

        subscriber.serve(sink);
        verifyAll();
    }

    @Test
    public void serve_stopsWhenClientGoesAway() throws IOException {
        StreamSubscriber subscriber = new StreamSubscriber(10, Duration.ofSeconds(15));
        EventSink sink = mock(EventSink.class);
        Event event = event(EventType.ALERT_FIRING);

        sink.send(event);
        expectLastCall().andThrow(new IOException("Broken pipe"));
        replayAll();

        subscriber.offer(event);
        subscriber.serve(sink);

        assertTrue(subscriber.isClosed());
        assertFalse(subscriber.offer(event));
        verifyAll();
    }

    @Test
    public void offer_dropsWhenFull() {
        StreamSubscriber subscriber = new StreamSubscriber(2, Duration.ofSeconds(15));

        assertTrue(subscriber.offer(event(EventType.ALERT_FIRING)));
        assertTrue(subscriber.offer(event(EventType.ALERT_FIRING)));
        assertFalse(subscriber.offer(event(EventType.ALERT_FIRING)));

        assertEquals(2, subscriber.getQueued());
        assertEquals(1, subscriber.getDroppedCount());
    }

    @Test
    public void close_isIdempotent() {
        StreamSubscriber subscriber = new StreamSubscriber(2, Duration.ofSeconds(15));
        subscriber.offer(event(EventType.ALERT_FIRING));

        subscriber.close();
        subscriber.close();

        assertTrue(subscriber.isClosed());
        assertEquals(1, subscriber.getQueued());
        assertFalse(subscriber.offer(event(EventType.ALERT_FIRING)));
        assertEquals(0, subscriber.getDroppedCount());
    }

    private static Event event(EventType type) {
        return Event.builder().type(type).data("x").timestamp(NOW).source("test").build();
    }
}
