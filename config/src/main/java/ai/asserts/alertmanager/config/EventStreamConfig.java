/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.config;

import ai.asserts.alertmanager.error.ValidationException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode
@ToString
@JsonIgnoreProperties(ignoreUnknown = true)
public class EventStreamConfig {
    /**
     * Capacity of each streaming connection's inbound queue
     */
    @JsonProperty("queue_size")
    @Builder.Default
    private int queueSize = 100;
    @JsonProperty("keep_alive_seconds")
    @Builder.Default
    private int keepAliveSeconds = 15;
    @JsonProperty("hub_queue_size")
    @Builder.Default
    private int hubQueueSize = 1000;

    public void validate() {
        if (queueSize < 1 || hubQueueSize < 1) {
            throw new ValidationException("event_stream queue sizes must be positive");
        } else if (keepAliveSeconds < 1) {
            throw new ValidationException("event_stream.keep_alive_seconds must be positive");
        }
    }
}
