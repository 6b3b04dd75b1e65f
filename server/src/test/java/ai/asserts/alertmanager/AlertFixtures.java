/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager;

import ai.asserts.alertmanager.model.Alert;
import ai.asserts.alertmanager.model.AlertStatus;
import ai.asserts.alertmanager.model.Fingerprints;

import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

public final class AlertFixtures {
    private AlertFixtures() {
    }

    public static Alert firing(Map<String, String> labels, Instant startsAt) {
        return Alert.builder()
                .fingerprint(Fingerprints.of(labels))
                .status(AlertStatus.firing)
                .labels(new TreeMap<>(labels))
                .startsAt(startsAt)
                .build();
    }

    public static Alert resolved(Map<String, String> labels, Instant startsAt, Instant endsAt) {
        return firing(labels, startsAt).toBuilder()
                .status(AlertStatus.resolved)
                .endsAt(endsAt)
                .build();
    }
}
