/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.alert;

import ai.asserts.alertmanager.model.Alert;
import ai.asserts.alertmanager.model.AlertStatus;
import com.google.common.collect.ImmutableMap;
import org.easymock.EasyMockSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.TreeMap;

import static ai.asserts.alertmanager.AlertFixtures.firing;
import static ai.asserts.alertmanager.AlertFixtures.resolved;
import static org.easymock.EasyMock.expect;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class DeduplicatorTest extends EasyMockSupport {
    private static final Instant NOW = Instant.parse("2023-06-01T10:00:00Z");
    private static final ImmutableMap<String, String> LABELS = ImmutableMap.of("alertname", "HighCPU",
            "instance", "web-1");

    private AlertStore alertStore;
    private FlapDetector flapDetector;
    private Deduplicator deduplicator;

    @BeforeEach
    public void setup() {
        alertStore = new AlertStore();
        flapDetector = mock(FlapDetector.class);
        deduplicator = new Deduplicator(alertStore, flapDetector);
    }

    @Test
    public void created() {
        replayAll();
        Alert alert = firing(LABELS, NOW);

        DedupResult result = deduplicator.deduplicate(alert, NOW);

        assertEquals(DedupAction.created, result.getAction());
        assertNull(result.getTransition());
        assertEquals(alert, result.getAlert());
        assertEquals(1, alertStore.size());
        verifyAll();
    }

    @Test
    public void firingThenResolved_oneStoredAlert() {
        Alert alert = firing(LABELS, NOW);
        Instant endsAt = NOW.plus(Duration.ofMinutes(5));
        expect(flapDetector.recordStatusChange(alert.getFingerprint(), endsAt)).andReturn(false);
        replayAll();

        deduplicator.deduplicate(alert, NOW);
        DedupResult result = deduplicator.deduplicate(resolved(LABELS, NOW, endsAt), endsAt);

        assertEquals(DedupAction.updated, result.getAction());
        assertEquals(Transition.FIRING_TO_RESOLVED, result.getTransition());
        assertEquals(1, alertStore.size());
        Alert stored = alertStore.get(alert.getFingerprint()).orElseThrow();
        assertEquals(AlertStatus.resolved, stored.getStatus());
        assertEquals(endsAt, stored.getEndsAt());
        assertEquals(NOW, stored.getStartsAt());
        verifyAll();
    }

    @Test
    public void identicalResubmissionIgnored() {
        Alert alert = firing(LABELS, NOW);
        expect(flapDetector.isFlapping(alert.getFingerprint(), NOW.plusSeconds(30))).andReturn(false);
        replayAll();

        deduplicator.deduplicate(alert, NOW);
        DedupResult result = deduplicator.deduplicate(firing(LABELS, NOW), NOW.plusSeconds(30));

        assertEquals(DedupAction.ignored, result.getAction());
        assertEquals(Transition.FIRING_TO_FIRING, result.getTransition());
        verifyAll();
    }

    @Test
    public void firingUpdateReplacesAnnotations() {
        Alert alert = firing(LABELS, NOW);
        Instant later = NOW.plus(Duration.ofMinutes(1));
        expect(flapDetector.isFlapping(alert.getFingerprint(), later)).andReturn(false);
        replayAll();

        deduplicator.deduplicate(alert, NOW);
        Alert update = firing(LABELS, later).toBuilder()
                .endsAt(later.plus(Duration.ofMinutes(4)))
                .annotations(new TreeMap<>(ImmutableMap.of("summary", "cpu at 95%")))
                .build();
        DedupResult result = deduplicator.deduplicate(update, later);

        assertEquals(DedupAction.updated, result.getAction());
        assertEquals(Transition.FIRING_TO_FIRING, result.getTransition());
        assertEquals("cpu at 95%", result.getAlert().getAnnotations().get("summary"));
        assertEquals(NOW, result.getAlert().getStartsAt());
        verifyAll();
    }

    @Test
    public void refiringResetsStartAndReportsFlapping() {
        Alert alert = firing(LABELS, NOW);
        Instant resolvedAt = NOW.plus(Duration.ofMinutes(1));
        Instant refiredAt = NOW.plus(Duration.ofMinutes(2));
        expect(flapDetector.recordStatusChange(alert.getFingerprint(), resolvedAt)).andReturn(false);
        expect(flapDetector.recordStatusChange(alert.getFingerprint(), refiredAt)).andReturn(true);
        replayAll();

        deduplicator.deduplicate(alert, NOW);
        deduplicator.deduplicate(resolved(LABELS, NOW, resolvedAt), resolvedAt);
        DedupResult result = deduplicator.deduplicate(firing(LABELS, refiredAt), refiredAt);

        assertEquals(Transition.RESOLVED_TO_FIRING, result.getTransition());
        assertTrue(result.isFlapping());
        assertEquals(refiredAt, result.getAlert().getStartsAt());
        assertNull(result.getAlert().getEndsAt());
        verifyAll();
    }

    @Test
    public void storedAlertIsACopy() {
        replayAll();
        Alert alert = firing(LABELS, NOW);
        deduplicator.deduplicate(alert, NOW);
        alert.getLabels().put("mutated", "true");

        assertFalse(alertStore.get(alert.getFingerprint()).orElseThrow().getLabels().containsKey("mutated"));
        verifyAll();
    }
}
