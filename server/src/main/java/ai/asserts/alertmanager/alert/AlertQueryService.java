/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.alert;

import ai.asserts.alertmanager.error.ValidationException;
import ai.asserts.alertmanager.model.Alert;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Lists current alerts. Suppression is computed per alert against a single snapshot of the firing alerts.
 */
@Slf4j
@Component
@AllArgsConstructor
public class AlertQueryService {
    private final AlertStore alertStore;
    private final SuppressionService suppressionService;

    public AlertPage query(AlertQuery query) {
        if (query.getLimit() < 1 || query.getLimit() > AlertQuery.MAX_LIMIT) {
            throw new ValidationException("limit must be between 1 and " + AlertQuery.MAX_LIMIT);
        } else if (query.getOffset() < 0) {
            throw new ValidationException("offset must not be negative");
        }

        List<Alert> firing = alertStore.firingSnapshot();
        List<AlertView> matching = alertStore.all().stream()
                .filter(query::matches)
                .sorted(query.comparator())
                .map(alert -> AlertView.of(alert, suppressionService.evaluate(alert, firing)))
                .filter(view -> matchesSuppression(query, view))
                .collect(Collectors.toList());

        List<AlertView> page = matching.stream()
                .skip(query.getOffset())
                .limit(query.getLimit())
                .collect(Collectors.toList());
        log.debug("Alert query {} matched {}", query, matching.size());
        return new AlertPage(page, matching.size(), query.getLimit(), query.getOffset());
    }

    private static boolean matchesSuppression(AlertQuery query, AlertView view) {
        boolean silenced = !view.getStatus().getSilencedBy().isEmpty();
        boolean inhibited = !view.getStatus().getInhibitedBy().isEmpty();
        return (query.getSilenced() == null || query.getSilenced() == silenced)
                && (query.getInhibited() == null || query.getInhibited() == inhibited);
    }
}
