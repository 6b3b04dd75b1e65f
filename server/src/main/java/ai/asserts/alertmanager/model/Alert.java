/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import lombok.With;

import java.time.Instant;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * An alert as received from a monitoring source and as kept in the current state store. Stored instances are
 * treated as immutable; changes are made on copies.
 */
@Getter
@Setter
@ToString
@EqualsAndHashCode
@With
@Builder(toBuilder = true)
@AllArgsConstructor
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Alert {
    public static final String ALERT_NAME = "alertname";
    public static final String SEVERITY = "severity";

    private String fingerprint;
    private AlertStatus status;
    @Builder.Default
    private SortedMap<String, String> labels = new TreeMap<>();
    @Builder.Default
    private SortedMap<String, String> annotations = new TreeMap<>();
    private Instant startsAt;
    private Instant endsAt;
    private String generatorURL;

    @JsonIgnore
    public String getName() {
        return (labels != null) ? labels.get(ALERT_NAME) : null;
    }

    @JsonIgnore
    public String getSeverity() {
        return (labels != null) ? labels.get(SEVERITY) : null;
    }

    @JsonIgnore
    public boolean isFiring() {
        return status == AlertStatus.firing;
    }

    /**
     * @return a copy that shares no mutable state with this alert
     */
    public Alert copy() {
        return toBuilder()
                .labels(labels == null ? new TreeMap<>() : new TreeMap<>(labels))
                .annotations(annotations == null ? new TreeMap<>() : new TreeMap<>(annotations))
                .build();
    }
}
