/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.publishing;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

/**
 * A downstream receiver together with the outcome of its last validation.
 */
@Getter
@Builder(toBuilder = true)
@EqualsAndHashCode
@ToString
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PublishingTarget {
    private final String name;
    private final String url;
    private final String type;
    @JsonIgnore
    @ToString.Exclude
    @Builder.Default
    private final Map<String, String> headers = new TreeMap<>();
    private final boolean valid;
    private final Instant lastValidatedAt;
    private final String error;
}
