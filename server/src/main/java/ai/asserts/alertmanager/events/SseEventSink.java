/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.events;

import lombok.AllArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;

@AllArgsConstructor
public class SseEventSink implements EventSink {
    private final SseEmitter emitter;
    private final EventJson eventJson;

    @Override
    public void send(Event event) throws IOException {
        emitter.send(SseEmitter.event().data(eventJson.toJson(event), MediaType.APPLICATION_JSON));
    }

    @Override
    public void keepAlive() throws IOException {
        emitter.send(SseEmitter.event().comment("keep-alive"));
    }
}
