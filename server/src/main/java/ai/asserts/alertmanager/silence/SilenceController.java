/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.silence;

import ai.asserts.alertmanager.ObjectMapperFactory;
import ai.asserts.alertmanager.error.ValidationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.google.common.collect.ImmutableMap;
import com.google.common.hash.Hashing;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.CollectionUtils;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

import static org.springframework.http.MediaType.APPLICATION_JSON_VALUE;

@Slf4j
@RestController
@SuppressWarnings("unused")
public class SilenceController {
    private static final String SILENCES = "/api/v2/silences";
    private static final String SILENCE = "/api/v2/silences/{id}";
    private static final String SILENCES_CHECK = "/api/v2/silences/check";
    private static final String SILENCES_STATS = "/api/v2/silences/stats";

    private final SilenceManager silenceManager;
    private final ObjectMapperFactory objectMapperFactory;
    private final Clock clock;

    public SilenceController(SilenceManager silenceManager, ObjectMapperFactory objectMapperFactory, Clock clock) {
        this.silenceManager = silenceManager;
        this.objectMapperFactory = objectMapperFactory;
        this.clock = clock;
    }

    @PostMapping(path = SILENCES, produces = APPLICATION_JSON_VALUE, consumes = APPLICATION_JSON_VALUE)
    public ResponseEntity<SilenceResponse> create(@RequestBody CreateSilenceRequest request) {
        Silence silence = silenceManager.create(request.getCreatedBy(), request.getComment(),
                request.getStartsAt(), request.getEndsAt(), request.getMatchers());
        return ResponseEntity.status(HttpStatus.CREATED).body(SilenceResponse.of(silence, clock.instant()));
    }

    @GetMapping(path = SILENCES, produces = APPLICATION_JSON_VALUE)
    public ResponseEntity<ListSilencesResponse> list(
            @RequestParam(value = "status", required = false) String status,
            @RequestParam(value = "createdBy", required = false) String createdBy,
            @RequestParam(value = "matcherName", required = false) String matcherName,
            @RequestParam(value = "matcherValue", required = false) String matcherValue,
            @RequestParam(value = "startsAfter", required = false) String startsAfter,
            @RequestParam(value = "startsBefore", required = false) String startsBefore,
            @RequestParam(value = "endsAfter", required = false) String endsAfter,
            @RequestParam(value = "endsBefore", required = false) String endsBefore,
            @RequestParam(value = "limit", defaultValue = "100") int limit,
            @RequestParam(value = "offset", defaultValue = "0") int offset,
            @RequestParam(value = "sort", defaultValue = "created_at") String sort,
            @RequestParam(value = "order", defaultValue = "desc") String order,
            @RequestHeader(value = HttpHeaders.IF_NONE_MATCH, required = false) String ifNoneMatch) {
        if (!"asc".equalsIgnoreCase(order) && !"desc".equalsIgnoreCase(order)) {
            throw new ValidationException("order must be asc or desc");
        }
        SilenceFilter filter = SilenceFilter.builder()
                .status(status == null ? null : SilenceStatus.parse(status))
                .createdBy(createdBy)
                .matcherName(matcherName)
                .matcherValue(matcherValue)
                .startsAfter(parseTime("startsAfter", startsAfter))
                .startsBefore(parseTime("startsBefore", startsBefore))
                .endsAfter(parseTime("endsAfter", endsAfter))
                .endsBefore(parseTime("endsBefore", endsBefore))
                .limit(limit)
                .offset(offset)
                .sort(SilenceSortField.parse(sort))
                .ascending("asc".equalsIgnoreCase(order))
                .build();
        SilencePage page = silenceManager.list(filter);
        Instant now = clock.instant();
        ListSilencesResponse response = new ListSilencesResponse(
                page.getSilences().stream().map(silence -> SilenceResponse.of(silence, now))
                        .collect(Collectors.toList()),
                page.getTotal(), page.getLimit(), page.getOffset());

        String etag = etag(response);
        if (etag != null && etag.equals(ifNoneMatch)) {
            return ResponseEntity.status(HttpStatus.NOT_MODIFIED).eTag(etag).build();
        }
        ResponseEntity.BodyBuilder builder = ResponseEntity.ok();
        if (etag != null) {
            builder.eTag(etag);
        }
        return builder.body(response);
    }

    @GetMapping(path = SILENCE, produces = APPLICATION_JSON_VALUE)
    public ResponseEntity<SilenceResponse> get(@PathVariable("id") String id) {
        return ResponseEntity.ok(SilenceResponse.of(silenceManager.get(id), clock.instant()));
    }

    @PutMapping(path = SILENCE, produces = APPLICATION_JSON_VALUE, consumes = APPLICATION_JSON_VALUE)
    public ResponseEntity<SilenceResponse> update(@PathVariable("id") String id,
                                                  @RequestBody UpdateSilenceRequest request) {
        Silence updated = silenceManager.update(id, SilenceUpdate.builder()
                .comment(request.getComment())
                .endsAt(request.getEndsAt())
                .matchers(request.getMatchers())
                .expectedVersion(request.getVersion())
                .build());
        return ResponseEntity.ok(SilenceResponse.of(updated, clock.instant()));
    }

    @DeleteMapping(path = SILENCE)
    public ResponseEntity<Void> delete(@PathVariable("id") String id) {
        silenceManager.delete(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping(path = SILENCES_CHECK, produces = APPLICATION_JSON_VALUE, consumes = APPLICATION_JSON_VALUE)
    public ResponseEntity<CheckAlertResponse> check(@RequestBody CheckAlertRequest request) {
        if (CollectionUtils.isEmpty(request.getLabels())) {
            throw new ValidationException("labels are required");
        }
        List<String> ids = silenceManager.getSilencingIds(request.getLabels());
        return ResponseEntity.ok(new CheckAlertResponse(!ids.isEmpty(), ids));
    }

    @GetMapping(path = SILENCES_STATS, produces = APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Long>> stats() {
        Map<String, Long> stats = new TreeMap<>();
        silenceManager.getStats().forEach((status, count) -> stats.put(status.name(), count));
        stats.put("total", stats.values().stream().mapToLong(Long::longValue).sum());
        return ResponseEntity.ok(stats);
    }

    private String etag(ListSilencesResponse response) {
        try {
            byte[] body = objectMapperFactory.getJsonMapper().writeValueAsBytes(response);
            return "\"" + Hashing.sha256().hashBytes(body).toString().substring(0, 32) + "\"";
        } catch (JsonProcessingException e) {
            log.warn("Failed to compute ETag: {}", e.getMessage());
            return null;
        }
    }

    private static Instant parseTime(String name, String value) {
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new ValidationException("Invalid " + name + " [" + value + "], expected RFC3339 timestamp",
                    ImmutableMap.of(name, "RFC3339 timestamp"));
        }
    }
}
