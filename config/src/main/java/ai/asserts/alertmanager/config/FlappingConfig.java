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
public class FlappingConfig {
    @JsonProperty("window_seconds")
    @Builder.Default
    private int windowSeconds = 600;
    /**
     * Number of state transitions inside the window at which a fingerprint is reported as flapping
     */
    @Builder.Default
    private int threshold = 4;

    public void validate() {
        if (windowSeconds <= 0) {
            throw new ValidationException("flapping.window_seconds must be positive");
        } else if (threshold < 2) {
            throw new ValidationException("flapping.threshold must be at least 2");
        }
    }
}
