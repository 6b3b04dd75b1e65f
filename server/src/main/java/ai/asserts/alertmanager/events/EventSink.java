/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.events;

import java.io.IOException;

/**
 * The writing side of a streaming connection. An {@link IOException} means the client went away.
 */
public interface EventSink {
    void send(Event event) throws IOException;

    void keepAlive() throws IOException;
}
