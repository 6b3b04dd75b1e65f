/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.alert;

import ai.asserts.alertmanager.ObjectMapperFactory;
import ai.asserts.alertmanager.config.MatcherParser;
import ai.asserts.alertmanager.error.RequestTooLargeException;
import ai.asserts.alertmanager.error.ValidationException;
import ai.asserts.alertmanager.model.Alert;
import ai.asserts.alertmanager.model.AlertStatus;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;

import static org.springframework.http.MediaType.APPLICATION_JSON_VALUE;

@Slf4j
@RestController
@SuppressWarnings("unused")
public class AlertController {
    private static final String ALERTS = "/api/v2/alerts";

    private final AlertProcessingPipeline pipeline;
    private final AlertQueryService queryService;
    private final ObjectMapperFactory objectMapperFactory;
    private final Clock clock;
    private final Duration batchTimeout;
    private final int maxAlertsPerRequest;

    public AlertController(AlertProcessingPipeline pipeline, AlertQueryService queryService,
                           ObjectMapperFactory objectMapperFactory, Clock clock,
                           @Value("${alertmanager.batch_timeout_ms:30000}") long batchTimeoutMs,
                           @Value("${alertmanager.max_alerts_per_request:1000}") int maxAlertsPerRequest) {
        this.pipeline = pipeline;
        this.queryService = queryService;
        this.objectMapperFactory = objectMapperFactory;
        this.clock = clock;
        this.batchTimeout = Duration.ofMillis(batchTimeoutMs);
        this.maxAlertsPerRequest = maxAlertsPerRequest;
    }

    /**
     * Accepts a Prometheus v1 array of alerts or a v2 webhook group with an <code>alerts</code> field.
     */
    @PostMapping(path = ALERTS, produces = APPLICATION_JSON_VALUE, consumes = APPLICATION_JSON_VALUE)
    public ResponseEntity<IngestResponse> ingest(@RequestBody JsonNode body) {
        List<Alert> alerts = readAlerts(body);
        if (alerts.isEmpty()) {
            throw new ValidationException("no alerts in request");
        } else if (alerts.size() > maxAlertsPerRequest) {
            throw new RequestTooLargeException(
                    "request has " + alerts.size() + " alerts, maximum is " + maxAlertsPerRequest);
        } else if (alerts.stream().allMatch(alert -> alert == null || alert.getLabels() == null
                || alert.getLabels().isEmpty())) {
            throw new ValidationException("no alert in request has labels");
        }

        BatchResult result = pipeline.process(alerts, Deadline.after(batchTimeout, clock));
        IngestResponse response = IngestResponse.of(result, clock.instant());
        if (result.isSuccess()) {
            return ResponseEntity.ok(response);
        } else if (result.isFailure()) {
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
        }
        return ResponseEntity.status(HttpStatus.MULTI_STATUS).body(response);
    }

    @GetMapping(path = ALERTS, produces = APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> list(
            @RequestParam(value = "filter", required = false) String filter,
            @RequestParam(value = "status", required = false) String status,
            @RequestParam(value = "severity", required = false) String severity,
            @RequestParam(value = "startsAfter", required = false) String startsAfter,
            @RequestParam(value = "startsBefore", required = false) String startsBefore,
            @RequestParam(value = "silenced", required = false) Boolean silenced,
            @RequestParam(value = "inhibited", required = false) Boolean inhibited,
            @RequestParam(value = "limit", defaultValue = "100") int limit,
            @RequestParam(value = "offset", defaultValue = "0") int offset,
            @RequestParam(value = "sort", defaultValue = "startsAt") String sort,
            @RequestParam(value = "order", defaultValue = "desc") String order) {
        if (!"asc".equalsIgnoreCase(order) && !"desc".equalsIgnoreCase(order)) {
            throw new ValidationException("order must be asc or desc");
        }
        AlertQuery query = AlertQuery.builder()
                .matchers(MatcherParser.parse(filter))
                .status(parseStatus(status))
                .severity(severity)
                .startsAfter(parseTime("startsAfter", startsAfter))
                .startsBefore(parseTime("startsBefore", startsBefore))
                .silenced(silenced)
                .inhibited(inhibited)
                .limit(limit)
                .offset(offset)
                .sort(AlertSortField.parse(sort))
                .ascending("asc".equalsIgnoreCase(order))
                .build();
        AlertPage page = queryService.query(query);
        return ResponseEntity.ok(ImmutableMap.of(
                "status", IngestResponse.SUCCESS,
                "data", ImmutableMap.of(
                        "alerts", page.getAlerts(),
                        "total", page.getTotal(),
                        "limit", page.getLimit(),
                        "offset", page.getOffset())));
    }

    private List<Alert> readAlerts(JsonNode body) {
        JsonNode alerts = body;
        if (body != null && body.isObject()) {
            alerts = body.get("alerts");
        }
        if (alerts == null || !alerts.isArray()) {
            throw new ValidationException("expected an array of alerts or an object with an alerts array");
        }
        try {
            return objectMapperFactory.getJsonMapper().readerFor(new TypeReference<List<Alert>>() {
            }).readValue(alerts);
        } catch (IOException e) {
            throw new ValidationException("malformed alert: " + e.getMessage(), e);
        }
    }

    private static AlertStatus parseStatus(String status) {
        if (status == null) {
            return null;
        }
        try {
            return AlertStatus.valueOf(status.toLowerCase());
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid status [" + status + "], expected firing or resolved");
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
