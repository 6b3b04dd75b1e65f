/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.events;

import ai.asserts.alertmanager.ObjectMapperFactory;
import com.fasterxml.jackson.core.JsonProcessingException;
import lombok.AllArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Wire form shared by the streaming and the broadcast endpoints:
 * <code>{"type", "data", "timestamp", "source"}</code>.
 */
@Component
@AllArgsConstructor
public class EventJson {
    private final ObjectMapperFactory objectMapperFactory;

    public String toJson(Event event) throws JsonProcessingException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("type", event.getType());
        body.put("data", event.getData());
        body.put("timestamp", event.getTimestamp());
        body.put("source", event.getSource());
        return objectMapperFactory.getJsonMapper().writeValueAsString(body);
    }
}
