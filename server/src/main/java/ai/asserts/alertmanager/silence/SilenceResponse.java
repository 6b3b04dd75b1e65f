/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.silence;

import ai.asserts.alertmanager.config.LabelMatcher;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.List;

@Getter
@Builder
@ToString
@EqualsAndHashCode
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SilenceResponse {
    private final String id;
    private final String createdBy;
    private final String comment;
    private final Instant startsAt;
    private final Instant endsAt;
    private final List<LabelMatcher> matchers;
    private final SilenceStatus status;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final long version;

    public static SilenceResponse of(Silence silence, Instant now) {
        return SilenceResponse.builder()
                .id(silence.getId())
                .createdBy(silence.getCreatedBy())
                .comment(silence.getComment())
                .startsAt(silence.getStartsAt())
                .endsAt(silence.getEndsAt())
                .matchers(silence.getMatchers())
                .status(silence.getStatus(now))
                .createdAt(silence.getCreatedAt())
                .updatedAt(silence.getUpdatedAt())
                .version(silence.getVersion())
                .build();
    }
}
