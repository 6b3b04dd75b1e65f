/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.alert;

import ai.asserts.alertmanager.config.LabelMatcher;
import ai.asserts.alertmanager.model.Alert;
import ai.asserts.alertmanager.model.AlertStatus;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

@Getter
@Builder
@ToString
public class AlertQuery {
    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT = 1000;

    @Builder.Default
    private final List<LabelMatcher> matchers = List.of();
    private final AlertStatus status;
    private final String severity;
    private final Instant startsAfter;
    private final Instant startsBefore;
    /**
     * <code>null</code> to return alerts regardless of silences
     */
    private final Boolean silenced;
    private final Boolean inhibited;
    @Builder.Default
    private final int limit = DEFAULT_LIMIT;
    @Builder.Default
    private final int offset = 0;
    @Builder.Default
    private final AlertSortField sort = AlertSortField.STARTS_AT;
    @Builder.Default
    private final boolean ascending = false;

    /**
     * Label, status, severity and time conditions. Suppression conditions are applied separately.
     */
    public boolean matches(Alert alert) {
        if (status != null && alert.getStatus() != status) {
            return false;
        } else if (severity != null && !severity.equals(alert.getSeverity())) {
            return false;
        } else if (startsAfter != null && (alert.getStartsAt() == null || !alert.getStartsAt().isAfter(startsAfter))) {
            return false;
        } else if (startsBefore != null
                && (alert.getStartsAt() == null || !alert.getStartsAt().isBefore(startsBefore))) {
            return false;
        }
        return matchers.stream().allMatch(matcher -> matcher.matches(alert.getLabels()));
    }

    public Comparator<Alert> comparator() {
        Comparator<Alert> comparator = ascending ? sort.getComparator() : sort.getComparator().reversed();
        return comparator.thenComparing(Alert::getFingerprint);
    }
}
