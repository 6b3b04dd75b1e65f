/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.events;

import ai.asserts.alertmanager.ObjectMapperFactory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class EventJsonTest {
    @Test
    public void toJson() throws JsonProcessingException {
        EventJson eventJson = new EventJson(new ObjectMapperFactory());
        Event event = Event.builder()
                .type(EventType.SILENCE_EXPIRED)
                .data(ImmutableMap.of("id", "s1"))
                .timestamp(Instant.parse("2023-06-01T10:00:00Z"))
                .source("silence-sweeper")
                .build();

        assertEquals("{\"type\":\"silence_expired\",\"data\":{\"id\":\"s1\"},"
                        + "\"timestamp\":\"2023-06-01T10:00:00Z\",\"source\":\"silence-sweeper\"}",
                eventJson.toJson(event));
    }
}
