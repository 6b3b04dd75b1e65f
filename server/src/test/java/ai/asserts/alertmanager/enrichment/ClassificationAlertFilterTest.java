/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.enrichment;

import ai.asserts.alertmanager.DispatchConfigProvider;
import ai.asserts.alertmanager.config.DispatchConfig;
import ai.asserts.alertmanager.config.EnrichmentConfig;
import ai.asserts.alertmanager.model.Alert;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Sets;
import org.easymock.EasyMockSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static ai.asserts.alertmanager.AlertFixtures.firing;
import static org.easymock.EasyMock.expect;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ClassificationAlertFilterTest extends EasyMockSupport {
    private ClassificationAlertFilter filter;
    private Alert alert;

    @BeforeEach
    public void setup() {
        DispatchConfigProvider configProvider = mock(DispatchConfigProvider.class);
        DispatchConfig config = DispatchConfig.builder().enrichment(EnrichmentConfig.builder()
                .blockedSeverities(Sets.newHashSet("noise", "info"))
                .minConfidence(0.6D)
                .build()).build();
        expect(configProvider.getConfig()).andReturn(config).anyTimes();
        filter = new ClassificationAlertFilter(configProvider);
        alert = firing(ImmutableMap.of("alertname", "HighCPU"), Instant.parse("2023-06-01T10:00:00Z"));
    }

    @Test
    public void unclassifiedAllowed() {
        replayAll();
        assertTrue(filter.evaluate(alert, null).isAllowed());
        assertTrue(filter.evaluate(alert, new Classification(null, 0.1D, null)).isAllowed());
        verifyAll();
    }

    @Test
    public void criticalAlwaysAllowed() {
        replayAll();
        assertTrue(filter.evaluate(alert, new Classification("CRITICAL", 0.1D, null)).isAllowed());
        verifyAll();
    }

    @Test
    public void blockedSeverity() {
        replayAll();
        FilterDecision decision = filter.evaluate(alert, new Classification("Noise", 0.99D, null));
        assertFalse(decision.isAllowed());
        assertEquals("severity noise is blocked", decision.getReason());
        verifyAll();
    }

    @Test
    public void lowConfidence() {
        replayAll();
        assertFalse(filter.evaluate(alert, new Classification("warning", 0.5D, null)).isAllowed());
        assertTrue(filter.evaluate(alert, new Classification("warning", 0.6D, null)).isAllowed());
        verifyAll();
    }
}
