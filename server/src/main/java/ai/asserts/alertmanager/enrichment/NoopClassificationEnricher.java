/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.enrichment;

import ai.asserts.alertmanager.model.Alert;

import java.util.Optional;

public class NoopClassificationEnricher implements ClassificationEnricher {
    public static final NoopClassificationEnricher INSTANCE = new NoopClassificationEnricher();

    @Override
    public Optional<Classification> classify(Alert alert) {
        return Optional.empty();
    }
}
