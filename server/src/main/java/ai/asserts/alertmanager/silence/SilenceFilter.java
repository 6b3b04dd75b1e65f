/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.silence;

import ai.asserts.alertmanager.config.LabelMatcher;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Comparator;

@Getter
@Builder
@ToString
@EqualsAndHashCode
public class SilenceFilter {
    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT = 1000;

    private final SilenceStatus status;
    private final String createdBy;
    private final String matcherName;
    private final String matcherValue;
    private final Instant startsAfter;
    private final Instant startsBefore;
    private final Instant endsAfter;
    private final Instant endsBefore;
    @Builder.Default
    private final int limit = DEFAULT_LIMIT;
    @Builder.Default
    private final int offset = 0;
    @Builder.Default
    private final SilenceSortField sort = SilenceSortField.CREATED_AT;
    @Builder.Default
    private final boolean ascending = false;

    /**
     * Status is compared against the status derived at <code>now</code>, never a stored value.
     */
    public boolean matches(Silence silence, Instant now) {
        if (status != null && silence.getStatus(now) != status) {
            return false;
        } else if (createdBy != null && !createdBy.equals(silence.getCreatedBy())) {
            return false;
        } else if ((matcherName != null || matcherValue != null) && silence.getMatchers().stream()
                .noneMatch(this::matcherSelected)) {
            return false;
        } else if (startsAfter != null && silence.getStartsAt().isBefore(startsAfter)) {
            return false;
        } else if (startsBefore != null && silence.getStartsAt().isAfter(startsBefore)) {
            return false;
        } else if (endsAfter != null && silence.getEndsAt().isBefore(endsAfter)) {
            return false;
        } else {
            return endsBefore == null || !silence.getEndsAt().isAfter(endsBefore);
        }
    }

    public Comparator<Silence> comparator(Instant now) {
        Comparator<Silence> comparator;
        switch (sort) {
            case STARTS_AT:
                comparator = Comparator.comparing(Silence::getStartsAt);
                break;
            case ENDS_AT:
                comparator = Comparator.comparing(Silence::getEndsAt);
                break;
            case STATUS:
                comparator = Comparator.comparing(silence -> silence.getStatus(now));
                break;
            default:
                comparator = Comparator.comparing(Silence::getCreatedAt);
        }
        comparator = comparator.thenComparing(Silence::getId);
        return ascending ? comparator : comparator.reversed();
    }

    private boolean matcherSelected(LabelMatcher matcher) {
        return (matcherName == null || matcherName.equals(matcher.getName()))
                && (matcherValue == null || matcherValue.equals(matcher.getValue()));
    }
}
