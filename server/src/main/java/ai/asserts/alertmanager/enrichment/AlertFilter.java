/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.enrichment;

import ai.asserts.alertmanager.model.Alert;

public interface AlertFilter {
    /**
     * @param classification <code>null</code> when the alert is unclassified
     */
    FilterDecision evaluate(Alert alert, Classification classification);
}
