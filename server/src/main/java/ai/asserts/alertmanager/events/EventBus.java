/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.events;

import ai.asserts.alertmanager.metrics.DispatchMetricCollector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

import static ai.asserts.alertmanager.metrics.MetricNames.EVENTS_DROPPED;
import static ai.asserts.alertmanager.metrics.MetricNames.EVENTS_PUBLISHED;
import static ai.asserts.alertmanager.metrics.MetricNames.EVENT_TYPE_LABEL;
import static ai.asserts.alertmanager.metrics.MetricNames.SUBSCRIBER_LABEL;

/**
 * Fans events out to all registered subscribers. Publishing never blocks: a subscriber that cannot accept an event
 * loses that event and nobody else is affected.
 */
@Slf4j
@Component
public class EventBus {
    private final List<EventSubscriber> subscribers = new CopyOnWriteArrayList<>();
    private final DispatchMetricCollector metricCollector;
    private final Clock clock;

    public EventBus(DispatchMetricCollector metricCollector, Clock clock) {
        this.metricCollector = metricCollector;
        this.clock = clock;
    }

    public void publish(EventType type, Object data, String source) {
        publish(Event.builder()
                .type(type)
                .data(data)
                .source(source)
                .timestamp(clock.instant())
                .build());
    }

    public void publish(Event event) {
        metricCollector.increment(EVENTS_PUBLISHED, EVENT_TYPE_LABEL, event.getType().getId());
        for (EventSubscriber subscriber : subscribers) {
            if (!subscriber.offer(event)) {
                log.debug("Dropped {} for subscriber {}", event.getType().getId(), subscriber.getId());
                metricCollector.increment(EVENTS_DROPPED, SUBSCRIBER_LABEL, subscriberKind(subscriber));
            }
        }
    }

    public void register(EventSubscriber subscriber) {
        subscribers.add(subscriber);
        log.info("Registered event subscriber {}, {} subscribers", subscriber.getId(), subscribers.size());
    }

    public void unregister(EventSubscriber subscriber) {
        if (subscribers.remove(subscriber)) {
            log.info("Unregistered event subscriber {}, {} subscribers", subscriber.getId(), subscribers.size());
        }
    }

    public int getSubscriberCount() {
        return subscribers.size();
    }

    public List<EventSubscriber> getSubscribers() {
        return subscribers.stream().collect(Collectors.toList());
    }

    private static String subscriberKind(EventSubscriber subscriber) {
        return subscriber instanceof StreamSubscriber ? "stream" : "hub";
    }
}
