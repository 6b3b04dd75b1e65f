/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.silence;

import ai.asserts.alertmanager.config.LabelMatcher;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.List;

/**
 * A partial update. Absent fields keep their current value. When <code>expectedVersion</code> is set the update is
 * rejected unless it matches the stored version.
 */
@Getter
@Builder
@ToString
public class SilenceUpdate {
    private final String comment;
    private final Instant endsAt;
    private final List<LabelMatcher> matchers;
    private final Long expectedVersion;
}
