/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.alert;

import ai.asserts.alertmanager.model.Alert;
import ai.asserts.alertmanager.model.AlertStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Collapses repeated submissions of one fingerprint into a single current state and reports the status transition.
 */
@Slf4j
@Component
public class Deduplicator {
    private final AlertStore alertStore;
    private final FlapDetector flapDetector;

    public Deduplicator(AlertStore alertStore, FlapDetector flapDetector) {
        this.alertStore = alertStore;
        this.flapDetector = flapDetector;
    }

    /**
     * @param incoming a normalised alert with fingerprint, status and startsAt set
     */
    public DedupResult deduplicate(Alert incoming, Instant now) {
        AtomicReference<Alert> previous = new AtomicReference<>();
        Alert stored = alertStore.compute(incoming.getFingerprint(), (fingerprint, existing) -> {
            previous.set(existing);
            if (existing == null) {
                return incoming.copy();
            } else if (isUnchanged(existing, incoming)) {
                return existing;
            }
            return merge(existing, incoming);
        });

        Alert existing = previous.get();
        if (existing == null) {
            log.debug("New alert {} {}", stored.getFingerprint(), stored.getName());
            return DedupResult.builder()
                    .action(DedupAction.created)
                    .alert(stored)
                    .build();
        }

        Transition transition = Transition.of(existing.getStatus(), stored.getStatus());
        if (stored == existing) {
            return DedupResult.builder()
                    .action(DedupAction.ignored)
                    .alert(stored)
                    .transition(transition)
                    .flapping(flapDetector.isFlapping(stored.getFingerprint(), now))
                    .build();
        }

        boolean flapping = transition.isStatusChange()
                ? flapDetector.recordStatusChange(stored.getFingerprint(), now)
                : flapDetector.isFlapping(stored.getFingerprint(), now);
        log.debug("Updated alert {} {} {}", stored.getFingerprint(), stored.getName(), transition);
        return DedupResult.builder()
                .action(DedupAction.updated)
                .alert(stored)
                .transition(transition)
                .flapping(flapping)
                .build();
    }

    private static boolean isUnchanged(Alert existing, Alert incoming) {
        return existing.getStatus() == incoming.getStatus()
                && Objects.equals(existing.getEndsAt(), incoming.getEndsAt());
    }

    private static Alert merge(Alert existing, Alert incoming) {
        Alert.AlertBuilder merged = existing.copy().toBuilder()
                .status(incoming.getStatus())
                .endsAt(incoming.getEndsAt());
        if (incoming.getAnnotations() != null && !incoming.getAnnotations().isEmpty()) {
            merged.annotations(new TreeMap<>(incoming.getAnnotations()));
        }
        if (incoming.getGeneratorURL() != null) {
            merged.generatorURL(incoming.getGeneratorURL());
        }
        if (existing.getStatus() == AlertStatus.resolved && incoming.getStatus() == AlertStatus.firing) {
            merged.startsAt(incoming.getStartsAt());
        }
        return merged.build();
    }
}
