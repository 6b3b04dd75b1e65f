/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.config;

import ai.asserts.alertmanager.error.ValidationException;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.springframework.util.CollectionUtils;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Root of the YAML dispatch configuration. {@link #validateConfig()} must be called after loading; it compiles the
 * inhibition rules and rejects the whole document on the first problem found.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@SuppressWarnings("FieldMayBeFinal")
@EqualsAndHashCode
@ToString
public class DispatchConfig {
    @JsonProperty("inhibit_rules")
    @Builder.Default
    private List<InhibitRuleConfig> inhibitRules = new ArrayList<>();
    @Builder.Default
    private FlappingConfig flapping = new FlappingConfig();
    @Builder.Default
    private SilenceConfig silences = new SilenceConfig();
    @Builder.Default
    private RefreshConfig refresh = new RefreshConfig();
    @JsonProperty("event_stream")
    @Builder.Default
    private EventStreamConfig eventStream = new EventStreamConfig();
    @Builder.Default
    private EnrichmentConfig enrichment = new EnrichmentConfig();
    @Builder.Default
    private List<TargetConfig> targets = new ArrayList<>();

    @JsonIgnore
    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    @Builder.Default
    private List<InhibitionRule> compiledInhibitionRules = ImmutableList.of();

    public void validateConfig() {
        List<InhibitionRule> rules = new ArrayList<>();
        if (!CollectionUtils.isEmpty(inhibitRules)) {
            for (int i = 0; i < inhibitRules.size(); i++) {
                rules.add(inhibitRules.get(i).compile(i));
            }
        }
        if (flapping == null) {
            flapping = new FlappingConfig();
        }
        if (silences == null) {
            silences = new SilenceConfig();
        }
        if (refresh == null) {
            refresh = new RefreshConfig();
        }
        if (eventStream == null) {
            eventStream = new EventStreamConfig();
        }
        if (enrichment == null) {
            enrichment = new EnrichmentConfig();
        }
        flapping.validate();
        silences.validate();
        refresh.validate();
        eventStream.validate();
        enrichment.validate();

        if (targets == null) {
            targets = new ArrayList<>();
        }
        Set<String> targetNames = new HashSet<>();
        if (!CollectionUtils.isEmpty(targets)) {
            for (int i = 0; i < targets.size(); i++) {
                TargetConfig target = targets.get(i);
                target.validate(i);
                if (!targetNames.add(target.getName())) {
                    throw new ValidationException("Duplicate target name [" + target.getName() + "]");
                }
            }
        }
        compiledInhibitionRules = ImmutableList.copyOf(rules);
    }
}
