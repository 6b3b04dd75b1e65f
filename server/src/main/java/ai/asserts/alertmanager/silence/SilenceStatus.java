/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.silence;

import ai.asserts.alertmanager.error.ValidationException;

import java.time.Instant;
import java.util.stream.Stream;

public enum SilenceStatus {
    pending, active, expired;

    /**
     * Status is a pure function of the window and the evaluation time: before <code>startsAt</code> it is pending,
     * within <code>[startsAt, endsAt)</code> active and expired from <code>endsAt</code> onwards.
     */
    public static SilenceStatus of(Instant startsAt, Instant endsAt, Instant now) {
        if (now.isBefore(startsAt)) {
            return pending;
        } else if (now.isBefore(endsAt)) {
            return active;
        }
        return expired;
    }

    public static SilenceStatus parse(String value) {
        return Stream.of(values())
                .filter(status -> status.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new ValidationException("Invalid silence status [" + value + "]"));
    }
}
