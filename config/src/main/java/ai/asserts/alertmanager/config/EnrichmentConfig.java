/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.config;

import ai.asserts.alertmanager.error.ValidationException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.Sets;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.util.Set;
import java.util.TreeSet;

import static org.springframework.util.StringUtils.hasLength;

/**
 * Settings for the optional remote severity classifier and the filter that acts on its output.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode
@ToString
@JsonIgnoreProperties(ignoreUnknown = true)
public class EnrichmentConfig {
    @Builder.Default
    private boolean enabled = false;
    private String url;
    @JsonProperty("timeout_ms")
    @Builder.Default
    private int timeoutMs = 2000;
    @JsonProperty("cache_ttl_seconds")
    @Builder.Default
    private int cacheTtlSeconds = 300;
    @JsonProperty("blocked_severities")
    @Builder.Default
    private Set<String> blockedSeverities = new TreeSet<>(Sets.newHashSet("noise"));
    @JsonProperty("min_confidence")
    @Builder.Default
    private double minConfidence = 0.0D;

    public void validate() {
        if (enabled && !hasLength(url)) {
            throw new ValidationException("enrichment.url must be specified when enrichment is enabled");
        } else if (minConfidence < 0.0D || minConfidence > 1.0D) {
            throw new ValidationException("enrichment.min_confidence must be between 0 and 1");
        } else if (cacheTtlSeconds < 0) {
            throw new ValidationException("enrichment.cache_ttl_seconds must not be negative");
        }
    }
}
