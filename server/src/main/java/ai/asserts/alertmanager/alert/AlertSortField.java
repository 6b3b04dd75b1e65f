/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.alert;

import ai.asserts.alertmanager.error.ValidationException;
import ai.asserts.alertmanager.model.Alert;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Comparator;

import static java.util.Comparator.comparing;
import static java.util.Comparator.nullsLast;

@AllArgsConstructor
@Getter
public enum AlertSortField {
    STARTS_AT("startsAt", comparing(Alert::getStartsAt, nullsLast(Comparator.naturalOrder()))),
    ALERT_NAME("alertname", comparing(Alert::getName, nullsLast(Comparator.naturalOrder()))),
    SEVERITY("severity", comparing(Alert::getSeverity, nullsLast(Comparator.naturalOrder())));

    private final String id;
    private final Comparator<Alert> comparator;

    public static AlertSortField parse(String value) {
        for (AlertSortField field : values()) {
            if (field.id.equalsIgnoreCase(value)) {
                return field;
            }
        }
        throw new ValidationException("Invalid sort field [" + value + "], expected startsAt, alertname or severity");
    }
}
