/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.alert;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Point in time by which a request must finish. Stages check it before starting work and bound their blocking
 * calls by {@link #remaining()}.
 */
public final class Deadline {
    private static final Deadline NONE = new Deadline(null, Clock.systemUTC());

    private final Instant expiresAt;
    private final Clock clock;

    private Deadline(Instant expiresAt, Clock clock) {
        this.expiresAt = expiresAt;
        this.clock = clock;
    }

    public static Deadline after(Duration timeout, Clock clock) {
        return new Deadline(clock.instant().plus(timeout), clock);
    }

    public static Deadline none() {
        return NONE;
    }

    public boolean isExpired() {
        return expiresAt != null && !clock.instant().isBefore(expiresAt);
    }

    /**
     * @return time left, zero once expired. Unbounded deadlines report one day.
     */
    public Duration remaining() {
        if (expiresAt == null) {
            return Duration.ofDays(1);
        }
        Duration left = Duration.between(clock.instant(), expiresAt);
        return left.isNegative() ? Duration.ZERO : left;
    }
}
