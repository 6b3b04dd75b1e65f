/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.alert;

import ai.asserts.alertmanager.DispatchConfigProvider;
import ai.asserts.alertmanager.EnvironmentConfig;
import ai.asserts.alertmanager.config.FlappingConfig;
import com.google.common.annotations.VisibleForTesting;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Counts firing/resolved status changes per fingerprint within a rolling window.
 */
@Slf4j
@Component
public class FlapDetector {
    private final DispatchConfigProvider configProvider;
    private final EnvironmentConfig environmentConfig;
    private final Clock clock;
    private final Map<String, Deque<Instant>> changes = new ConcurrentHashMap<>();

    public FlapDetector(DispatchConfigProvider configProvider, EnvironmentConfig environmentConfig, Clock clock) {
        this.configProvider = configProvider;
        this.environmentConfig = environmentConfig;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${alertmanager.flapping.evict.fixedDelay:60000}",
            initialDelayString = "${alertmanager.flapping.evict.fixedDelay:60000}")
    public void scheduledEvict() {
        if (environmentConfig.isDisabled()) {
            log.debug("Flap history eviction off");
            return;
        }
        int before = changes.size();
        evictIdle(clock.instant());
        log.debug("Evicted flap history for {} fingerprints", before - changes.size());
    }

    /**
     * Records a status change and reports whether the fingerprint is now flapping.
     */
    public boolean recordStatusChange(String fingerprint, Instant at) {
        FlappingConfig config = configProvider.getConfig().getFlapping();
        Instant cutoff = at.minus(Duration.ofSeconds(config.getWindowSeconds()));
        Deque<Instant> timestamps = changes.computeIfAbsent(fingerprint, k -> new ArrayDeque<>());
        synchronized (timestamps) {
            timestamps.addLast(at);
            prune(timestamps, cutoff);
            return timestamps.size() >= config.getThreshold();
        }
    }

    public boolean isFlapping(String fingerprint, Instant now) {
        Deque<Instant> timestamps = changes.get(fingerprint);
        if (timestamps == null) {
            return false;
        }
        FlappingConfig config = configProvider.getConfig().getFlapping();
        synchronized (timestamps) {
            prune(timestamps, now.minus(Duration.ofSeconds(config.getWindowSeconds())));
            return timestamps.size() >= config.getThreshold();
        }
    }

    /**
     * Drops fingerprints with no status change inside the window.
     */
    @VisibleForTesting
    void evictIdle(Instant now) {
        Instant cutoff = now.minus(Duration.ofSeconds(configProvider.getConfig().getFlapping().getWindowSeconds()));
        changes.entrySet().removeIf(entry -> {
            synchronized (entry.getValue()) {
                prune(entry.getValue(), cutoff);
                return entry.getValue().isEmpty();
            }
        });
    }

    @VisibleForTesting
    int trackedFingerprints() {
        return changes.size();
    }

    private static void prune(Deque<Instant> timestamps, Instant cutoff) {
        while (!timestamps.isEmpty() && timestamps.peekFirst().isBefore(cutoff)) {
            timestamps.removeFirst();
        }
    }
}
