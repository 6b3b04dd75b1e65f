/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.alert;

import ai.asserts.alertmanager.model.AlertStatus;
import lombok.AllArgsConstructor;
import lombok.Getter;

@AllArgsConstructor
@Getter
public enum Transition {
    FIRING_TO_FIRING(AlertStatus.firing, AlertStatus.firing),
    FIRING_TO_RESOLVED(AlertStatus.firing, AlertStatus.resolved),
    RESOLVED_TO_FIRING(AlertStatus.resolved, AlertStatus.firing),
    RESOLVED_TO_RESOLVED(AlertStatus.resolved, AlertStatus.resolved);

    private final AlertStatus from;
    private final AlertStatus to;

    public static Transition of(AlertStatus from, AlertStatus to) {
        if (from == AlertStatus.firing) {
            return to == AlertStatus.firing ? FIRING_TO_FIRING : FIRING_TO_RESOLVED;
        }
        return to == AlertStatus.firing ? RESOLVED_TO_FIRING : RESOLVED_TO_RESOLVED;
    }

    public boolean isStatusChange() {
        return from != to;
    }
}
