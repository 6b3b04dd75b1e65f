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
public class SilenceConfig {
    /**
     * How long an expired silence is kept before the sweep purges it
     */
    @JsonProperty("gc_retention_seconds")
    @Builder.Default
    private long gcRetentionSeconds = 86400;
    @JsonProperty("max_matchers")
    @Builder.Default
    private int maxMatchers = 100;

    public void validate() {
        if (gcRetentionSeconds < 0) {
            throw new ValidationException("silences.gc_retention_seconds must not be negative");
        } else if (maxMatchers < 1) {
            throw new ValidationException("silences.max_matchers must be at least 1");
        }
    }
}
