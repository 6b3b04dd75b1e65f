/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.inhibition;

import ai.asserts.alertmanager.DispatchConfigProvider;
import ai.asserts.alertmanager.alert.AlertStore;
import ai.asserts.alertmanager.config.InhibitionRule;
import ai.asserts.alertmanager.model.Alert;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Decides whether an alert is muted by another firing alert according to the configured inhibition rules.
 * Evaluation is read only and works on one snapshot of the firing alerts.
 */
@Slf4j
@Component
@AllArgsConstructor
public class InhibitionChecker {
    private final DispatchConfigProvider configProvider;
    private final AlertStore alertStore;

    /**
     * @return fingerprints of the firing alerts that inhibit the given alert, empty if none
     */
    public List<String> getInhibitingFingerprints(Alert alert) {
        return getInhibitingFingerprints(alert, null);
    }

    /**
     * @param firing the firing alerts to evaluate against, or <code>null</code> to take a fresh snapshot
     */
    public List<String> getInhibitingFingerprints(Alert alert, List<Alert> firing) {
        List<InhibitionRule> rules = configProvider.getConfig().getCompiledInhibitionRules().stream()
                .filter(rule -> rule.matchesTarget(alert.getLabels()))
                .collect(Collectors.toList());
        if (rules.isEmpty()) {
            return List.of();
        }

        List<Alert> sources = firing != null ? firing : alertStore.firingSnapshot();
        Set<String> inhibitedBy = new TreeSet<>();
        for (Alert source : sources) {
            if (source.getFingerprint().equals(alert.getFingerprint())) {
                continue;
            }
            for (InhibitionRule rule : rules) {
                if (rule.matchesSource(source.getLabels())
                        && rule.hasEqualLabels(alert.getLabels(), source.getLabels())) {
                    log.debug("Alert {} inhibited by {} through rule {}", alert.getFingerprint(),
                            source.getFingerprint(), rule.getName());
                    inhibitedBy.add(source.getFingerprint());
                    break;
                }
            }
        }
        return List.copyOf(inhibitedBy);
    }
}
