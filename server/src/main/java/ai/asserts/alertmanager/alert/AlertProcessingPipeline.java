/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.alert;

import ai.asserts.alertmanager.enrichment.AlertFilter;
import ai.asserts.alertmanager.enrichment.Classification;
import ai.asserts.alertmanager.enrichment.EnrichmentService;
import ai.asserts.alertmanager.enrichment.FilterDecision;
import ai.asserts.alertmanager.error.PipelineTimeoutException;
import ai.asserts.alertmanager.error.ValidationException;
import ai.asserts.alertmanager.events.EventBus;
import ai.asserts.alertmanager.events.EventType;
import ai.asserts.alertmanager.history.AlertHistoryRepository;
import ai.asserts.alertmanager.history.AlertRecord;
import ai.asserts.alertmanager.metrics.DispatchMetricCollector;
import ai.asserts.alertmanager.model.Alert;
import ai.asserts.alertmanager.model.AlertStatus;
import ai.asserts.alertmanager.model.Fingerprints;
import ai.asserts.alertmanager.model.Suppression;
import ai.asserts.alertmanager.publishing.AlertPublisher;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableSortedMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static ai.asserts.alertmanager.metrics.MetricNames.ALERTS_PROCESSED;
import static ai.asserts.alertmanager.metrics.MetricNames.ALERT_FAILURES;
import static ai.asserts.alertmanager.metrics.MetricNames.ERROR_TYPE_LABEL;
import static ai.asserts.alertmanager.metrics.MetricNames.OUTCOME_LABEL;
import static ai.asserts.alertmanager.metrics.MetricNames.PIPELINE_LATENCY;
import static ai.asserts.alertmanager.metrics.MetricNames.REASON_LABEL;
import static ai.asserts.alertmanager.metrics.MetricNames.SUPPRESSED;
import static org.springframework.util.StringUtils.hasText;

/**
 * Runs each alert of a batch, in submission order, through deduplication, inhibition, silencing, enrichment,
 * filtering, persistence and publishing. A failure affects only the alert it happened on. Once the batch deadline
 * passes every remaining alert is failed as timed out.
 */
@Slf4j
@Component
public class AlertProcessingPipeline {
    public static final String EVENT_SOURCE = "alert-pipeline";

    private final Deduplicator deduplicator;
    private final SuppressionService suppressionService;
    private final EnrichmentService enrichmentService;
    private final AlertFilter alertFilter;
    private final AlertHistoryRepository historyRepository;
    private final AlertPublisher alertPublisher;
    private final EventBus eventBus;
    private final DispatchMetricCollector metricCollector;
    private final Clock clock;

    public AlertProcessingPipeline(Deduplicator deduplicator, SuppressionService suppressionService,
                                   EnrichmentService enrichmentService, AlertFilter alertFilter,
                                   AlertHistoryRepository historyRepository,
                                   AlertPublisher alertPublisher,
                                   EventBus eventBus, DispatchMetricCollector metricCollector, Clock clock) {
        this.deduplicator = deduplicator;
        this.suppressionService = suppressionService;
        this.enrichmentService = enrichmentService;
        this.alertFilter = alertFilter;
        this.historyRepository = historyRepository;
        this.alertPublisher = alertPublisher;
        this.eventBus = eventBus;
        this.metricCollector = metricCollector;
        this.clock = clock;
    }

    public BatchResult process(List<Alert> alerts, Deadline deadline) {
        List<AlertFailure> failures = new ArrayList<>();
        int processed = 0;
        for (int i = 0; i < alerts.size(); i++) {
            Alert alert = alerts.get(i);
            if (deadline.isExpired()) {
                log.warn("Batch deadline exceeded, failing {} unprocessed alerts", alerts.size() - i);
                for (int j = i; j < alerts.size(); j++) {
                    failures.add(failure(j, alerts.get(j), new PipelineTimeoutException("batch deadline exceeded")));
                }
                break;
            }

            long start = System.currentTimeMillis();
            try {
                String outcome = processOne(alert, deadline);
                processed++;
                metricCollector.increment(ALERTS_PROCESSED, OUTCOME_LABEL, outcome);
            } catch (Exception e) {
                AlertFailure failure = failure(i, alert, e);
                log.error("Failed to process alert {} at index {}, {}", failure.getFingerprint(), i,
                        failure.getErrorType().getId(), e);
                failures.add(failure);
            } finally {
                metricCollector.recordLatency(PIPELINE_LATENCY, ImmutableSortedMap.of(),
                        System.currentTimeMillis() - start);
            }
        }

        log.info("Processed batch of {} alerts, {} succeeded, {} failed", alerts.size(), processed, failures.size());
        return new BatchResult(alerts.size(), processed, failures);
    }

    /**
     * @return the outcome recorded in the processed alerts counter
     */
    @VisibleForTesting
    String processOne(Alert received, Deadline deadline) {
        Instant now = clock.instant();
        Alert alert = normalize(received, now);

        DedupResult dedup = deduplicator.deduplicate(alert, now);
        if (dedup.getAction() == DedupAction.ignored) {
            log.debug("Ignoring unchanged alert {}", alert.getFingerprint());
            return "ignored";
        }
        Alert current = dedup.getAlert();
        publishLifecycleEvents(dedup);

        Suppression suppression = suppressionService.evaluate(current);
        if (suppression.isInhibited()) {
            metricCollector.increment(SUPPRESSED, REASON_LABEL, "inhibited");
            eventBus.publish(EventType.ALERT_INHIBITED,
                    suppressionEvent(current, "inhibitedBy", suppression.getInhibitedBy()), EVENT_SOURCE);
        }
        if (suppression.isSilenced()) {
            metricCollector.increment(SUPPRESSED, REASON_LABEL, "silenced");
            eventBus.publish(EventType.ALERT_SILENCED,
                    suppressionEvent(current, "silencedBy", suppression.getSilencedBy()), EVENT_SOURCE);
        }

        checkDeadline(deadline, "enrichment");
        Classification classification = enrichmentService.enrich(current).orElse(null);
        FilterDecision decision = alertFilter.evaluate(current, classification);

        checkDeadline(deadline, "persist");
        historyRepository.save(AlertRecord.builder()
                .alert(current)
                .classification(classification)
                .suppression(suppression)
                .receivedAt(now)
                .build());

        if (suppression.isSuppressed()) {
            log.debug("Alert {} suppressed, not published", current.getFingerprint());
            return "suppressed";
        } else if (!decision.isAllowed()) {
            log.info("Alert {} filtered: {}", current.getFingerprint(), decision.getReason());
            return "filtered";
        }

        checkDeadline(deadline, "publish");
        alertPublisher.publish(current, deadline);
        return "published";
    }

    /**
     * Fills in what a sender may leave out. Timestamps before the epoch are the senders' zero value and are unset.
     */
    @VisibleForTesting
    static Alert normalize(Alert received, Instant now) {
        if (received == null || received.getLabels() == null || received.getLabels().isEmpty()) {
            throw new ValidationException("alert has no labels");
        }
        received.getLabels().forEach((name, value) -> {
            if (!hasText(name) || value == null) {
                throw new ValidationException("label [" + name + "] has no value");
            }
        });
        Alert alert = received.copy();
        if (alert.getStartsAt() != null && alert.getStartsAt().isBefore(Instant.EPOCH)) {
            alert.setStartsAt(null);
        }
        if (alert.getEndsAt() != null && alert.getEndsAt().isBefore(Instant.EPOCH)) {
            alert.setEndsAt(null);
        }
        if (!hasText(alert.getFingerprint())) {
            alert.setFingerprint(Fingerprints.of(alert.getLabels()));
        }
        if (alert.getStatus() == null) {
            boolean ended = alert.getEndsAt() != null && !alert.getEndsAt().isAfter(now);
            alert.setStatus(ended ? AlertStatus.resolved : AlertStatus.firing);
        }
        if (alert.getStartsAt() == null) {
            alert.setStartsAt(now);
        }
        if (alert.getStatus() == AlertStatus.resolved && alert.getEndsAt() == null) {
            alert.setEndsAt(now);
        }
        return alert;
    }

    private void publishLifecycleEvents(DedupResult dedup) {
        Alert current = dedup.getAlert();
        if (dedup.getAction() == DedupAction.created) {
            eventBus.publish(EventType.ALERT_CREATED, current, EVENT_SOURCE);
        }
        if (dedup.getAction() == DedupAction.created || dedup.getTransition().isStatusChange()) {
            eventBus.publish(current.isFiring() ? EventType.ALERT_FIRING : EventType.ALERT_RESOLVED, current,
                    EVENT_SOURCE);
        }
        if (dedup.isFlapping() && dedup.getTransition() != null && dedup.getTransition().isStatusChange()) {
            log.info("Alert {} {} is flapping", current.getFingerprint(), current.getName());
            eventBus.publish(EventType.ALERT_FLAPPING, current, EVENT_SOURCE);
        }
    }

    private static Map<String, Object> suppressionEvent(Alert alert, String key, List<String> ids) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("fingerprint", alert.getFingerprint());
        data.put("alertname", alert.getName());
        data.put("labels", alert.getLabels());
        data.put(key, ids);
        return data;
    }

    private static void checkDeadline(Deadline deadline, String stage) {
        if (deadline.isExpired()) {
            throw new PipelineTimeoutException("deadline exceeded before " + stage);
        }
    }

    private AlertFailure failure(int index, Alert alert, Exception e) {
        ProcessingErrorType errorType = ProcessingErrorType.classify(e);
        metricCollector.increment(ALERT_FAILURES, ERROR_TYPE_LABEL, errorType.getId());
        metricCollector.increment(ALERTS_PROCESSED, OUTCOME_LABEL, "failed");
        String fingerprint = null;
        String alertname = null;
        if (alert != null && alert.getLabels() != null && !alert.getLabels().isEmpty()) {
            fingerprint = hasText(alert.getFingerprint()) ? alert.getFingerprint()
                    : Fingerprints.of(alert.getLabels());
            alertname = alert.getName();
        }
        return AlertFailure.builder()
                .index(index)
                .fingerprint(fingerprint)
                .alertname(alertname)
                .error(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                .errorType(errorType)
                .build();
    }
}
