/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.silence;

import ai.asserts.alertmanager.DispatchConfigProvider;
import ai.asserts.alertmanager.config.LabelMatcher;
import ai.asserts.alertmanager.error.ConflictException;
import ai.asserts.alertmanager.error.DuplicateSilenceException;
import ai.asserts.alertmanager.error.NotFoundException;
import ai.asserts.alertmanager.error.ValidationException;
import ai.asserts.alertmanager.events.EventBus;
import ai.asserts.alertmanager.events.EventType;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.CollectionUtils;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.springframework.util.StringUtils.hasText;

/**
 * Owns silence CRUD and answers whether an alert is silenced. Reads are lock free. Creates are serialised so that
 * the duplicate check and the insert are atomic. Updates use optimistic concurrency on the silence version.
 */
@Slf4j
@Component
public class SilenceManager {
    public static final String EVENT_SOURCE = "silence-manager";
    static final int MAX_CREATED_BY = 255;
    static final int MIN_COMMENT = 3;
    static final int MAX_COMMENT = 1024;
    static final int MAX_MATCHER_VALUE = 1024;

    private final SilenceRepository repository;
    private final DispatchConfigProvider configProvider;
    private final EventBus eventBus;
    private final Clock clock;
    private final Lock createLock = new ReentrantLock();

    public SilenceManager(SilenceRepository repository, DispatchConfigProvider configProvider, EventBus eventBus,
                          Clock clock) {
        this.repository = repository;
        this.configProvider = configProvider;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    public Silence create(String createdBy, String comment, Instant startsAt, Instant endsAt,
                          List<LabelMatcher> matchers) {
        validate(createdBy, comment, startsAt, endsAt, matchers);
        Instant now = clock.instant();
        if (!endsAt.isAfter(now)) {
            throw new ValidationException("endsAt must be in the future",
                    ImmutableMap.of("endsAt", "must be in the future"));
        }
        Silence silence = Silence.builder()
                .id(UUID.randomUUID().toString())
                .createdBy(createdBy.trim())
                .comment(comment)
                .startsAt(startsAt)
                .endsAt(endsAt)
                .matchers(matchers)
                .createdAt(now)
                .version(1)
                .build();

        createLock.lock();
        try {
            Optional<Silence> duplicate = repository.findAll().stream()
                    .filter(existing -> existing.isDuplicateOf(silence))
                    .findFirst();
            if (duplicate.isPresent()) {
                log.info("Rejected duplicate of silence {} from {}", duplicate.get().getId(), createdBy);
                throw new DuplicateSilenceException(duplicate.get().getId());
            }
            repository.insert(silence);
        } finally {
            createLock.unlock();
        }

        log.info("Created silence {} by {} with matchers {} from {} to {}", silence.getId(), silence.getCreatedBy(),
                silence.getMatchers(), startsAt, endsAt);
        eventBus.publish(EventType.SILENCE_CREATED, SilenceResponse.of(silence, now), EVENT_SOURCE);
        return silence;
    }

    public Silence get(String id) {
        return repository.findById(id)
                .orElseThrow(() -> new NotFoundException("Silence " + id + " not found"));
    }

    public SilencePage list(SilenceFilter filter) {
        if (filter.getLimit() < 1 || filter.getLimit() > SilenceFilter.MAX_LIMIT) {
            throw new ValidationException("limit must be between 1 and " + SilenceFilter.MAX_LIMIT);
        } else if (filter.getOffset() < 0) {
            throw new ValidationException("offset must not be negative");
        }
        Instant now = clock.instant();
        List<Silence> matching = repository.findAll().stream()
                .filter(silence -> filter.matches(silence, now))
                .sorted(filter.comparator(now))
                .collect(Collectors.toList());
        List<Silence> page = matching.stream()
                .skip(filter.getOffset())
                .limit(filter.getLimit())
                .collect(Collectors.toList());
        return new SilencePage(page, matching.size(), filter.getLimit(), filter.getOffset());
    }

    public Silence update(String id, SilenceUpdate update) {
        Silence current = get(id);
        if (update.getExpectedVersion() != null && update.getExpectedVersion() != current.getVersion()) {
            throw new ConflictException("Silence " + id + " is at version " + current.getVersion() +
                    ", not " + update.getExpectedVersion());
        }
        Instant now = clock.instant();
        Silence updated = current.toBuilder()
                .comment(update.getComment() != null ? update.getComment() : current.getComment())
                .endsAt(update.getEndsAt() != null ? update.getEndsAt() : current.getEndsAt())
                .matchers(update.getMatchers() != null ? update.getMatchers() : current.getMatchers())
                .updatedAt(now)
                .version(current.getVersion() + 1)
                .build();
        validate(updated.getCreatedBy(), updated.getComment(), updated.getStartsAt(), updated.getEndsAt(),
                updated.getMatchers());

        if (!repository.replace(current.getVersion(), updated)) {
            throw new ConflictException("Silence " + id + " was modified concurrently, re-fetch and retry");
        }
        log.info("Updated silence {} to version {}", id, updated.getVersion());
        eventBus.publish(EventType.SILENCE_UPDATED, SilenceResponse.of(updated, now), EVENT_SOURCE);
        return updated;
    }

    public void delete(String id) {
        Silence silence = get(id);
        if (!repository.delete(id)) {
            throw new NotFoundException("Silence " + id + " not found");
        }
        log.info("Deleted silence {}", id);
        eventBus.publish(EventType.SILENCE_DELETED, SilenceResponse.of(silence, clock.instant()), EVENT_SOURCE);
    }

    /**
     * @return ids of the active silences whose matchers select the given labels
     */
    public List<String> getSilencingIds(Map<String, String> labels) {
        Instant now = clock.instant();
        return repository.findAll().stream()
                .filter(silence -> silence.isActive(now) && silence.matches(labels))
                .map(Silence::getId)
                .sorted()
                .collect(Collectors.toList());
    }

    public Map<SilenceStatus, Long> getStats() {
        Instant now = clock.instant();
        Map<SilenceStatus, Long> stats = new EnumMap<>(SilenceStatus.class);
        Stream.of(SilenceStatus.values()).forEach(status -> stats.put(status, 0L));
        repository.findAll().forEach(silence -> stats.merge(silence.getStatus(now), 1L, Long::sum));
        return stats;
    }

    @VisibleForTesting
    void validate(String createdBy, String comment, Instant startsAt, Instant endsAt,
                  List<LabelMatcher> matchers) {
        if (!hasText(createdBy) || createdBy.trim().length() > MAX_CREATED_BY) {
            throw new ValidationException("createdBy must be between 1 and " + MAX_CREATED_BY + " characters",
                    ImmutableMap.of("createdBy", "required, at most " + MAX_CREATED_BY + " characters"));
        }
        if (comment == null || comment.trim().length() < MIN_COMMENT || comment.length() > MAX_COMMENT) {
            throw new ValidationException("comment must be between " + MIN_COMMENT + " and " + MAX_COMMENT +
                    " characters", ImmutableMap.of("comment", MIN_COMMENT + "-" + MAX_COMMENT + " characters"));
        }
        if (startsAt == null || endsAt == null) {
            throw new ValidationException("startsAt and endsAt are required");
        }
        if (!endsAt.isAfter(startsAt)) {
            throw new ValidationException("endsAt must be after startsAt",
                    ImmutableMap.of("endsAt", "must be after startsAt"));
        }
        int maxMatchers = configProvider.getConfig().getSilences().getMaxMatchers();
        if (CollectionUtils.isEmpty(matchers)) {
            throw new ValidationException("At least one matcher is required",
                    ImmutableMap.of("matchers", "required"));
        }
        if (matchers.size() > maxMatchers) {
            throw new ValidationException("At most " + maxMatchers + " matchers are allowed",
                    ImmutableMap.of("matchers", "at most " + maxMatchers));
        }
        for (LabelMatcher matcher : matchers) {
            if (matcher == null) {
                throw new ValidationException("Matcher list contains an empty entry");
            }
            if (matcher.getValue().isEmpty() || matcher.getValue().length() > MAX_MATCHER_VALUE) {
                throw new ValidationException("Matcher value for [" + matcher.getName() + "] must be between 1 and " +
                        MAX_MATCHER_VALUE + " characters");
            }
        }
    }
}
