/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.silence;

import ai.asserts.alertmanager.config.LabelMatcher;
import ai.asserts.alertmanager.config.LabelMatchers;
import com.google.common.collect.ImmutableList;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * An operator declared suppression window. Instances are immutable; every successful update produces a new instance
 * with the same id and the next version.
 */
@Getter
@ToString
@EqualsAndHashCode
public class Silence {
    private final String id;
    private final String createdBy;
    private final String comment;
    private final List<LabelMatcher> matchers;
    private final Instant startsAt;
    private final Instant endsAt;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final long version;
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private final LabelMatchers labelMatchers;

    @Builder(toBuilder = true)
    public Silence(String id, String createdBy, String comment, List<LabelMatcher> matchers, Instant startsAt,
                   Instant endsAt, Instant createdAt, Instant updatedAt, long version) {
        this.id = id;
        this.createdBy = createdBy;
        this.comment = comment;
        this.matchers = ImmutableList.copyOf(matchers);
        this.startsAt = startsAt;
        this.endsAt = endsAt;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
        this.version = version;
        this.labelMatchers = LabelMatchers.of(matchers);
    }

    public SilenceStatus getStatus(Instant now) {
        return SilenceStatus.of(startsAt, endsAt, now);
    }

    public boolean isActive(Instant now) {
        return getStatus(now) == SilenceStatus.active;
    }

    public boolean matches(Map<String, String> labels) {
        return labelMatchers.matches(labels);
    }

    /**
     * Two silences are duplicates when they select the same alerts over the same window.
     */
    public boolean isDuplicateOf(Silence other) {
        return labelMatchers.equals(other.labelMatchers)
                && startsAt.equals(other.startsAt)
                && endsAt.equals(other.endsAt);
    }
}
