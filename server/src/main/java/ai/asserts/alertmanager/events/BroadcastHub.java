/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.events;

import ai.asserts.alertmanager.DispatchConfigProvider;
import ai.asserts.alertmanager.TaskThreadPool;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.google.common.annotations.VisibleForTesting;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * WebSocket broadcast hub. Every open session receives every event. Events are queued and written by a single
 * dispatcher thread so that a slow socket never blocks the publisher.
 */
@Slf4j
@Component
public class BroadcastHub extends TextWebSocketHandler implements EventSubscriber, InitializingBean, DisposableBean {
    private final Set<WebSocketSession> sessions = ConcurrentHashMap.newKeySet();
    private final BlockingQueue<Event> queue;
    private final AtomicLong dropped = new AtomicLong();
    private final EventBus eventBus;
    private final EventJson eventJson;
    private final TaskThreadPool taskThreadPool;
    private volatile boolean running;

    public BroadcastHub(EventBus eventBus, EventJson eventJson, DispatchConfigProvider configProvider,
                        @Qualifier("event-hub-thread-pool") TaskThreadPool taskThreadPool) {
        this.eventBus = eventBus;
        this.eventJson = eventJson;
        this.taskThreadPool = taskThreadPool;
        this.queue = new ArrayBlockingQueue<>(configProvider.getConfig().getEventStream().getHubQueueSize());
    }

    @Override
    public void afterPropertiesSet() {
        running = true;
        eventBus.register(this);
        taskThreadPool.getExecutorService().submit(this::dispatchLoop);
    }

    @Override
    public void destroy() {
        running = false;
        eventBus.unregister(this);
    }

    @Override
    public String getId() {
        return "websocket-hub";
    }

    @Override
    public boolean offer(Event event) {
        if (sessions.isEmpty()) {
            return true;
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

    public int getSessionCount() {
        return sessions.size();
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        sessions.add(session);
        log.info("WebSocket session {} connected, {} sessions", session.getId(), sessions.size());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        sessions.remove(session);
        log.info("WebSocket session {} closed with {}, {} sessions", session.getId(), status, sessions.size());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("WebSocket session {} transport error: {}", session.getId(), exception.getMessage());
        sessions.remove(session);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws IOException {
        String payload = message.getPayload().trim();
        if ("ping".equalsIgnoreCase(payload) || payload.contains("\"ping\"")) {
            synchronized (session) {
                session.sendMessage(new TextMessage("{\"type\":\"pong\"}"));
            }
        } else {
            log.debug("Ignoring message from session {}", session.getId());
        }
    }

    private void dispatchLoop() {
        log.info("Event hub dispatcher started");
        while (running) {
            try {
                Event event = queue.poll(1, TimeUnit.SECONDS);
                if (event != null) {
                    broadcast(event);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                log.error("Event hub dispatch failed", e);
            }
        }
        log.info("Event hub dispatcher stopped");
    }

    @VisibleForTesting
    void broadcast(Event event) {
        String json;
        try {
            json = eventJson.toJson(event);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize event " + event.getType().getId(), e);
            return;
        }
        TextMessage message = new TextMessage(json);
        for (WebSocketSession session : sessions) {
            if (!session.isOpen()) {
                sessions.remove(session);
                continue;
            }
            try {
                synchronized (session) {
                    session.sendMessage(message);
                }
            } catch (IOException e) {
                log.warn("Failed to write to WebSocket session {}, dropping it: {}", session.getId(),
                        e.getMessage());
                sessions.remove(session);
                closeQuietly(session);
            }
        }
    }

    private void closeQuietly(WebSocketSession session) {
        try {
            session.close(CloseStatus.SERVER_ERROR);
        } catch (IOException e) {
            log.debug("Close of session {} failed: {}", session.getId(), e.getMessage());
        }
    }
}
