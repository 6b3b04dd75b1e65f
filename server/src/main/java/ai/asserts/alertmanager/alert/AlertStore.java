/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.alert;

import ai.asserts.alertmanager.model.Alert;
import com.google.common.collect.ImmutableList;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiFunction;
import java.util.stream.Collectors;

/**
 * Current state of every alert by fingerprint. Alerts are upserted, never deleted. Stored values are immutable
 * copies so snapshots handed out can be read without locking.
 */
@Component
public class AlertStore {
    private final Map<String, Alert> alerts = new ConcurrentHashMap<>();

    public Optional<Alert> get(String fingerprint) {
        return Optional.ofNullable(alerts.get(fingerprint));
    }

    /**
     * Atomically replaces the state of one fingerprint. The function receives the current alert or
     * <code>null</code>.
     */
    public Alert compute(String fingerprint, BiFunction<String, Alert, Alert> remapping) {
        return alerts.compute(fingerprint, remapping);
    }

    public List<Alert> firingSnapshot() {
        return alerts.values().stream()
                .filter(Alert::isFiring)
                .collect(ImmutableList.toImmutableList());
    }

    public List<Alert> all() {
        return alerts.values().stream().collect(Collectors.toList());
    }

    public int size() {
        return alerts.size();
    }
}
