/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.alert;

import ai.asserts.alertmanager.inhibition.InhibitionChecker;
import ai.asserts.alertmanager.model.Alert;
import ai.asserts.alertmanager.model.Suppression;
import ai.asserts.alertmanager.silence.SilenceManager;
import lombok.AllArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Combines inhibition and silences into one verdict. Resolved alerts are never suppressed.
 */
@Component
@AllArgsConstructor
public class SuppressionService {
    private final InhibitionChecker inhibitionChecker;
    private final SilenceManager silenceManager;

    public Suppression evaluate(Alert alert) {
        return evaluate(alert, null);
    }

    /**
     * @param firing snapshot of firing alerts to evaluate inhibition against, <code>null</code> for a fresh one
     */
    public Suppression evaluate(Alert alert, List<Alert> firing) {
        if (!alert.isFiring()) {
            return Suppression.NONE;
        }
        List<String> inhibitedBy = inhibitionChecker.getInhibitingFingerprints(alert, firing);
        List<String> silencedBy = silenceManager.getSilencingIds(alert.getLabels());
        if (inhibitedBy.isEmpty() && silencedBy.isEmpty()) {
            return Suppression.NONE;
        }
        return new Suppression(silencedBy, inhibitedBy);
    }
}
