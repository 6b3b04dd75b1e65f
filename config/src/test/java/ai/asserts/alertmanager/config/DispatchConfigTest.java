/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.config;

import ai.asserts.alertmanager.error.ValidationException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class DispatchConfigTest {
    private ObjectMapper objectMapper;

    @BeforeEach
    public void setup() {
        objectMapper = new ObjectMapper(new YAMLFactory());
    }

    @Test
    public void load() throws Exception {
        DispatchConfig config = objectMapper.readValue(
                getClass().getResource("/dispatch_config_test.yml"), DispatchConfig.class);
        config.validateConfig();

        List<InhibitionRule> rules = config.getCompiledInhibitionRules();
        assertEquals(2, rules.size());
        assertEquals("critical-mutes-warning", rules.get(0).getName());
        assertEquals(ImmutableList.of("alertname", "cluster"), rules.get(0).getEqual());
        assertEquals("inhibit_rule_1", rules.get(1).getName());
        assertEquals(2, rules.get(1).getTarget().size());

        assertEquals(300, config.getFlapping().getWindowSeconds());
        assertEquals(3, config.getFlapping().getThreshold());
        assertEquals(3600, config.getSilences().getGcRetentionSeconds());
        assertEquals(100, config.getSilences().getMaxMatchers());
        assertEquals(30, config.getRefresh().getRateLimitSeconds());
        assertEquals(5000, config.getRefresh().getValidationTimeoutMs());
        assertEquals(50, config.getEventStream().getQueueSize());
        assertEquals(1000, config.getEventStream().getHubQueueSize());
        assertTrue(config.getEnrichment().isEnabled());
        assertTrue(config.getEnrichment().getBlockedSeverities().contains("info"));
        assertEquals(0.3D, config.getEnrichment().getMinConfidence());

        assertEquals(2, config.getTargets().size());
        assertEquals(ImmutableMap.of("Authorization", "Bearer abc"), config.getTargets().get(0).getHeaders());
        assertFalse(config.getTargets().get(1).isEnabled());
        assertEquals("webhook", config.getTargets().get(1).getType());
    }

    @Test
    public void defaults() throws Exception {
        DispatchConfig config = objectMapper.readValue("flapping: ~", DispatchConfig.class);
        config.validateConfig();
        assertTrue(config.getCompiledInhibitionRules().isEmpty());
        assertEquals(600, config.getFlapping().getWindowSeconds());
        assertEquals(60, config.getRefresh().getRateLimitSeconds());
        assertFalse(config.getEnrichment().isEnabled());
        assertTrue(config.getTargets().isEmpty());
    }

    @Test
    public void inhibitRule_withoutSource_rejected() {
        DispatchConfig config = DispatchConfig.builder()
                .inhibitRules(ImmutableList.of(InhibitRuleConfig.builder()
                        .targetMatch(ImmutableMap.of("severity", "warning"))
                        .build()))
                .build();
        assertThrows(ValidationException.class, config::validateConfig);
    }

    @Test
    public void inhibitRule_withoutTarget_rejected() {
        InhibitRuleConfig rule = InhibitRuleConfig.builder()
                .sourceMatchers(ImmutableList.of("severity=\"critical\""))
                .build();
        assertThrows(ValidationException.class, () -> rule.compile(0));
    }

    @Test
    public void inhibitionRule_equalLabels() {
        InhibitionRule rule = InhibitRuleConfig.builder()
                .sourceMatch(ImmutableMap.of("severity", "critical"))
                .targetMatch(ImmutableMap.of("severity", "warning"))
                .equal(ImmutableList.of("alertname"))
                .build()
                .compile(0);
        assertTrue(rule.hasEqualLabels(ImmutableMap.of("alertname", "DiskFull"),
                ImmutableMap.of("alertname", "DiskFull", "severity", "critical")));
        assertFalse(rule.hasEqualLabels(ImmutableMap.of("alertname", "DiskFull"),
                ImmutableMap.of("alertname", "HighCPU")));
        assertTrue(rule.matchesSource(ImmutableMap.of("severity", "critical")));
        assertTrue(rule.matchesTarget(ImmutableMap.of("severity", "warning")));
    }

    @Test
    public void inhibitionRule_nullLabelValueTreatedAsEmpty() {
        InhibitionRule rule = InhibitRuleConfig.builder()
                .sourceMatch(ImmutableMap.of("severity", "critical"))
                .targetMatch(ImmutableMap.of("severity", "warning"))
                .equal(ImmutableList.of("team"))
                .build()
                .compile(0);
        Map<String, String> target = new HashMap<>();
        target.put("severity", "warning");
        target.put("team", null);
        assertTrue(rule.hasEqualLabels(target, ImmutableMap.of("severity", "critical")));
        assertFalse(rule.hasEqualLabels(target, ImmutableMap.of("severity", "critical", "team", "infra")));
        assertFalse(rule.hasEqualLabels(ImmutableMap.of("team", "infra"), target));
    }

    @Test
    public void targets_validated() {
        DispatchConfig badUrl = DispatchConfig.builder()
                .targets(ImmutableList.of(TargetConfig.builder().name("t").url("ftp://x").build()))
                .build();
        assertThrows(ValidationException.class, badUrl::validateConfig);

        DispatchConfig duplicate = DispatchConfig.builder()
                .targets(ImmutableList.of(
                        TargetConfig.builder().name("t").url("http://a").build(),
                        TargetConfig.builder().name("t").url("http://b").build()))
                .build();
        assertThrows(ValidationException.class, duplicate::validateConfig);
    }

    @Test
    public void enrichment_requiresUrlWhenEnabled() {
        DispatchConfig config = DispatchConfig.builder()
                .enrichment(EnrichmentConfig.builder().enabled(true).build())
                .build();
        assertThrows(ValidationException.class, config::validateConfig);
    }
}
