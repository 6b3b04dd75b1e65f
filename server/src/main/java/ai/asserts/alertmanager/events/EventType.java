/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.events;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

@AllArgsConstructor
@Getter
public enum EventType {
    ALERT_CREATED("alert_created"),
    ALERT_FIRING("alert_firing"),
    ALERT_RESOLVED("alert_resolved"),
    ALERT_INHIBITED("alert_inhibited"),
    ALERT_SILENCED("alert_silenced"),
    ALERT_FLAPPING("alert_flapping"),
    SILENCE_CREATED("silence_created"),
    SILENCE_UPDATED("silence_updated"),
    SILENCE_DELETED("silence_deleted"),
    SILENCE_EXPIRED("silence_expired"),
    TARGETS_REFRESHED("targets_refreshed");

    @JsonValue
    private final String id;
}
