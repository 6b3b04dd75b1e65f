/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * A lifecycle notification. Events are never persisted; a subscriber that is not connected when an event is
 * published does not receive it.
 */
@Getter
@Builder
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public class Event {
    private final EventType type;
    private final Object data;
    private final Instant timestamp;
    private final String source;
}
