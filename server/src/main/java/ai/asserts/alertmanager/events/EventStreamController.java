/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.events;

import ai.asserts.alertmanager.DispatchConfigProvider;
import ai.asserts.alertmanager.TaskThreadPool;
import ai.asserts.alertmanager.config.EventStreamConfig;
import ai.asserts.alertmanager.error.ServiceUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.springframework.http.MediaType.APPLICATION_JSON_VALUE;

@Slf4j
@RestController
@SuppressWarnings("unused")
public class EventStreamController {
    private final EventBus eventBus;
    private final EventJson eventJson;
    private final BroadcastHub broadcastHub;
    private final DispatchConfigProvider configProvider;
    private final TaskThreadPool taskThreadPool;
    private final long streamTimeoutMs;
    private final Set<StreamSubscriber> streams = ConcurrentHashMap.newKeySet();
    private final AtomicInteger reservedSlots = new AtomicInteger();

    public EventStreamController(EventBus eventBus, EventJson eventJson, BroadcastHub broadcastHub,
                                 DispatchConfigProvider configProvider,
                                 @Qualifier("event-stream-thread-pool") TaskThreadPool taskThreadPool,
                                 @Value("${alertmanager.event_stream.timeout_ms:3600000}") long streamTimeoutMs) {
        this.eventBus = eventBus;
        this.eventJson = eventJson;
        this.broadcastHub = broadcastHub;
        this.configProvider = configProvider;
        this.taskThreadPool = taskThreadPool;
        this.streamTimeoutMs = streamTimeoutMs;
    }

    @GetMapping(path = "/api/v2/events/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream() {
        // one pool thread per open stream
        if (reservedSlots.incrementAndGet() > taskThreadPool.getNumThreads()) {
            reservedSlots.decrementAndGet();
            throw new ServiceUnavailableException("Too many event stream connections");
        }
        EventStreamConfig config = configProvider.getConfig().getEventStream();
        StreamSubscriber subscriber = new StreamSubscriber(config.getQueueSize(),
                Duration.ofSeconds(config.getKeepAliveSeconds()));
        SseEmitter emitter = new SseEmitter(streamTimeoutMs);
        emitter.onCompletion(subscriber::close);
        emitter.onTimeout(subscriber::close);
        emitter.onError(e -> subscriber.close());

        streams.add(subscriber);
        eventBus.register(subscriber);
        try {
            taskThreadPool.getExecutorService().submit(() -> {
                try {
                    subscriber.serve(new SseEventSink(emitter, eventJson));
                } finally {
                    release(subscriber);
                    emitter.complete();
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Event stream rejected by executor", e);
            release(subscriber);
            throw new ServiceUnavailableException("Too many event stream connections");
        }
        return emitter;
    }

    private void release(StreamSubscriber subscriber) {
        eventBus.unregister(subscriber);
        if (streams.remove(subscriber)) {
            reservedSlots.decrementAndGet();
        }
    }

    @GetMapping(path = "/api/v2/events/stats", produces = APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> stats() {
        Map<String, Long> droppedBySubscriber = new TreeMap<>();
        long totalDropped = 0;
        for (EventSubscriber subscriber : eventBus.getSubscribers()) {
            droppedBySubscriber.put(subscriber.getId(), subscriber.getDroppedCount());
            totalDropped += subscriber.getDroppedCount();
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("subscribers", eventBus.getSubscriberCount());
        body.put("streams", streams.size());
        body.put("websocketSessions", broadcastHub.getSessionCount());
        body.put("droppedTotal", totalDropped);
        body.put("dropped", droppedBySubscriber);
        return ResponseEntity.ok(body);
    }
}
