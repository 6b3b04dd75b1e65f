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
public class RefreshConfig {
    @JsonProperty("rate_limit_seconds")
    @Builder.Default
    private int rateLimitSeconds = 60;
    @JsonProperty("validation_timeout_ms")
    @Builder.Default
    private int validationTimeoutMs = 5000;

    public void validate() {
        if (rateLimitSeconds < 0) {
            throw new ValidationException("refresh.rate_limit_seconds must not be negative");
        } else if (validationTimeoutMs <= 0) {
            throw new ValidationException("refresh.validation_timeout_ms must be positive");
        }
    }
}
