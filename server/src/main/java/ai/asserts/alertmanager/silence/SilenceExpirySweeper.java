/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.silence;

import ai.asserts.alertmanager.DispatchConfigProvider;
import ai.asserts.alertmanager.EnvironmentConfig;
import ai.asserts.alertmanager.events.EventBus;
import ai.asserts.alertmanager.events.EventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Periodically re-derives every silence's status. The last status seen per silence is tracked explicitly so that
 * <code>silence_expired</code> is published exactly once, on the sweep that first observes the window closed. A
 * silence created and closed between two sweeps is reported by the second one. Silences expired for longer than the
 * retention period are purged without an event.
 */
@Slf4j
@Component
public class SilenceExpirySweeper {
    private final SilenceRepository repository;
    private final DispatchConfigProvider configProvider;
    private final EnvironmentConfig environmentConfig;
    private final EventBus eventBus;
    private final Clock clock;
    private final Map<String, SilenceStatus> lastKnownStatus = new ConcurrentHashMap<>();
    private volatile Instant lastSweep;

    public SilenceExpirySweeper(SilenceRepository repository, DispatchConfigProvider configProvider,
                                EnvironmentConfig environmentConfig, EventBus eventBus, Clock clock) {
        this.repository = repository;
        this.configProvider = configProvider;
        this.environmentConfig = environmentConfig;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${alertmanager.silence.sweep.fixedDelay:15000}",
            initialDelayString = "${alertmanager.silence.sweep.fixedDelay:15000}")
    public void scheduledSweep() {
        if (environmentConfig.isDisabled()) {
            log.debug("Silence sweep off");
            return;
        }
        sweep();
    }

    /**
     * Not reentrant; the scheduler never overlaps runs.
     *
     * @return the number of expiry events published
     */
    public int sweep() {
        Instant now = clock.instant();
        Duration retention = Duration.ofSeconds(configProvider.getConfig().getSilences().getGcRetentionSeconds());
        Collection<Silence> silences = repository.findAll();
        int expired = 0;
        int purged = 0;
        for (Silence silence : silences) {
            SilenceStatus status = silence.getStatus(now);
            SilenceStatus previous = lastKnownStatus.put(silence.getId(), status);
            if (status == SilenceStatus.expired && closedSinceLastSweep(silence, previous)) {
                log.info("Silence {} expired at {}", silence.getId(), silence.getEndsAt());
                eventBus.publish(EventType.SILENCE_EXPIRED, SilenceResponse.of(silence, now),
                        SilenceManager.EVENT_SOURCE);
                expired++;
            }
            if (status == SilenceStatus.expired && !silence.getEndsAt().plus(retention).isAfter(now)) {
                if (repository.delete(silence.getId())) {
                    purged++;
                }
                lastKnownStatus.remove(silence.getId());
            }
        }

        lastSweep = now;
        Set<String> live = silences.stream().map(Silence::getId).collect(Collectors.toSet());
        lastKnownStatus.keySet().removeIf(id -> !live.contains(id));
        if (expired > 0 || purged > 0) {
            log.info("Silence sweep: {} expired, {} purged, {} remaining", expired, purged, repository.count());
        }
        return expired;
    }

    private boolean closedSinceLastSweep(Silence silence, SilenceStatus previous) {
        if (previous != null) {
            return previous != SilenceStatus.expired;
        }
        return lastSweep != null && silence.getEndsAt().isAfter(lastSweep);
    }
}
