/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.publishing;

import ai.asserts.alertmanager.DispatchConfigProvider;
import ai.asserts.alertmanager.config.TargetConfig;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Candidates are the enabled targets of the dispatch configuration. The configuration is reloaded before discovery
 * so that a refresh picks up edits to the file.
 */
@Slf4j
@Component
@AllArgsConstructor
public class ConfiguredTargetDiscovery implements TargetDiscovery {
    private final DispatchConfigProvider configProvider;

    @Override
    public List<TargetConfig> discover() {
        configProvider.update();
        List<TargetConfig> candidates = configProvider.getConfig().getTargets().stream()
                .filter(TargetConfig::isEnabled)
                .collect(Collectors.toList());
        log.info("Discovered {} candidate publishing targets", candidates.size());
        return candidates;
    }
}
