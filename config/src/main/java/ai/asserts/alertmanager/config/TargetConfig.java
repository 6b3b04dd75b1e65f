/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.config;

import ai.asserts.alertmanager.error.ValidationException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.net.URI;
import java.util.Map;
import java.util.TreeMap;

import static org.springframework.util.StringUtils.hasLength;

/**
 * A candidate publishing target. Candidates are only used once they pass validation during a refresh.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode
@ToString
@JsonIgnoreProperties(ignoreUnknown = true)
public class TargetConfig {
    private String name;
    private String url;
    @Builder.Default
    private String type = "webhook";
    @Builder.Default
    private boolean enabled = true;
    @Builder.Default
    @ToString.Exclude
    private Map<String, String> headers = new TreeMap<>();

    public void validate(int index) {
        if (!hasLength(name)) {
            throw new ValidationException("targets[" + index + "] has no name");
        }
        if (!hasLength(url)) {
            throw new ValidationException("Target [" + name + "] has no url");
        }
        try {
            String scheme = URI.create(url).getScheme();
            if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
                throw new ValidationException("Target [" + name + "] url must be http or https");
            }
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Target [" + name + "] has malformed url [" + url + "]", e);
        }
    }
}
