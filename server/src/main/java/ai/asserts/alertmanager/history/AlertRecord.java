/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.history;

import ai.asserts.alertmanager.enrichment.Classification;
import ai.asserts.alertmanager.model.Alert;
import ai.asserts.alertmanager.model.Suppression;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

@Getter
@Builder
@EqualsAndHashCode
@ToString
public class AlertRecord {
    private final Alert alert;
    /**
     * <code>null</code> when enrichment is off or failed
     */
    private final Classification classification;
    private final Suppression suppression;
    private final Instant receivedAt;
}
