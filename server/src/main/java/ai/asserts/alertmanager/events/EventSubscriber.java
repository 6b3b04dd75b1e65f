/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.events;

public interface EventSubscriber {
    String getId();

    /**
     * Hands an event to the subscriber without blocking.
     *
     * @return <code>false</code> if the subscriber had no room and the event was dropped for it
     */
    boolean offer(Event event);

    long getDroppedCount();
}
