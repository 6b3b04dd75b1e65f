/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.publishing;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * Immutable snapshot of the refresh manager. A new instance is published for every state change.
 */
@Getter
@Builder(toBuilder = true)
@EqualsAndHashCode
@ToString
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RefreshStatus {
    public static final RefreshStatus INITIAL = RefreshStatus.builder().state(RefreshState.IDLE).build();

    private final RefreshState state;
    private final Instant lastRefresh;
    private final Instant nextRefresh;
    private final int targetsDiscovered;
    private final int targetsValid;
    private final int targetsInvalid;
    private final int consecutiveFailures;
    private final String error;
    private final long refreshDurationMs;
}
