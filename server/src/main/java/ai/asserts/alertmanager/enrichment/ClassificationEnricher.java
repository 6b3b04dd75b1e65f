/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.enrichment;

import ai.asserts.alertmanager.model.Alert;

import java.util.Optional;

public interface ClassificationEnricher {
    /**
     * @return the classification, or empty when the alert is not classified
     */
    Optional<Classification> classify(Alert alert);
}
