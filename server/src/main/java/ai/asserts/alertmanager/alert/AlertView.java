/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.alert;

import ai.asserts.alertmanager.model.Alert;
import ai.asserts.alertmanager.model.Suppression;
import ai.asserts.alertmanager.model.SuppressionState;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Alert as returned by the query API, with its suppression status computed at read time.
 */
@Getter
@AllArgsConstructor
@ToString
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AlertView {
    private final String fingerprint;
    private final Map<String, String> labels;
    private final Map<String, String> annotations;
    private final Instant startsAt;
    private final Instant endsAt;
    private final String generatorURL;
    private final Status status;

    public static AlertView of(Alert alert, Suppression suppression) {
        return new AlertView(alert.getFingerprint(), alert.getLabels(), alert.getAnnotations(),
                alert.getStartsAt(), alert.getEndsAt(), alert.getGeneratorURL(),
                new Status(suppression.getState(), suppression.getSilencedBy(), suppression.getInhibitedBy()));
    }

    @Getter
    @AllArgsConstructor
    @ToString
    public static class Status {
        private final SuppressionState state;
        private final List<String> silencedBy;
        private final List<String> inhibitedBy;
    }
}
