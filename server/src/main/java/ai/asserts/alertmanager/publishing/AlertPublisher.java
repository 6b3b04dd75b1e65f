/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.publishing;

import ai.asserts.alertmanager.alert.Deadline;
import ai.asserts.alertmanager.model.Alert;

public interface AlertPublisher {
    /**
     * Delivers one alert to the live targets.
     *
     * @throws ai.asserts.alertmanager.error.PublishException if no target accepted the alert
     */
    void publish(Alert alert, Deadline deadline);
}
