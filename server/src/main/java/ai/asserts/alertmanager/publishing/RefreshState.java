/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.publishing;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

@AllArgsConstructor
@Getter
public enum RefreshState {
    /**
     * No refresh has run yet
     */
    IDLE("idle"),
    IN_PROGRESS("in_progress"),
    SUCCESS("success"),
    FAILURE("failure");

    @JsonValue
    private final String id;
}
