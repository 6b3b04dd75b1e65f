/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.model;

import com.google.common.collect.ImmutableList;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Why an alert is, or is not, muted. Holds ids only: silence ids and fingerprints of inhibiting alerts.
 */
@Getter
@EqualsAndHashCode
@ToString
public class Suppression {
    public static final Suppression NONE = new Suppression(ImmutableList.of(), ImmutableList.of());

    private final List<String> silencedBy;
    private final List<String> inhibitedBy;

    public Suppression(List<String> silencedBy, List<String> inhibitedBy) {
        this.silencedBy = ImmutableList.copyOf(silencedBy);
        this.inhibitedBy = ImmutableList.copyOf(inhibitedBy);
    }

    public SuppressionState getState() {
        return isSuppressed() ? SuppressionState.suppressed : SuppressionState.active;
    }

    public boolean isSuppressed() {
        return !silencedBy.isEmpty() || !inhibitedBy.isEmpty();
    }

    public boolean isSilenced() {
        return !silencedBy.isEmpty();
    }

    public boolean isInhibited() {
        return !inhibitedBy.isEmpty();
    }
}
