/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.enrichment;

import ai.asserts.alertmanager.DispatchConfigProvider;
import ai.asserts.alertmanager.config.EnrichmentConfig;
import ai.asserts.alertmanager.model.Alert;
import lombok.AllArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Blocks alerts the classifier considers noise. Unclassified and critical alerts always pass.
 */
@Component
@AllArgsConstructor
public class ClassificationAlertFilter implements AlertFilter {
    private final DispatchConfigProvider configProvider;

    @Override
    public FilterDecision evaluate(Alert alert, Classification classification) {
        if (classification == null || classification.getSeverity() == null) {
            return FilterDecision.ALLOW;
        }
        String severity = classification.getSeverity().toLowerCase(Locale.ROOT);
        if (Classification.CRITICAL.equals(severity)) {
            return FilterDecision.ALLOW;
        }
        EnrichmentConfig config = configProvider.getConfig().getEnrichment();
        if (config.getBlockedSeverities().contains(severity)) {
            return FilterDecision.deny("severity " + severity + " is blocked");
        } else if (classification.getConfidence() < config.getMinConfidence()) {
            return FilterDecision.deny(String.format("confidence %.2f below %.2f",
                    classification.getConfidence(), config.getMinConfidence()));
        }
        return FilterDecision.ALLOW;
    }
}
