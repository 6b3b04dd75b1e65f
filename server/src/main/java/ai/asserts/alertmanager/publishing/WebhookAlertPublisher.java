/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.publishing;

import ai.asserts.alertmanager.TaskThreadPool;
import ai.asserts.alertmanager.alert.Deadline;
import ai.asserts.alertmanager.error.PipelineTimeoutException;
import ai.asserts.alertmanager.error.PublishException;
import ai.asserts.alertmanager.metrics.DispatchMetricCollector;
import ai.asserts.alertmanager.model.Alert;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static ai.asserts.alertmanager.metrics.MetricNames.OUTCOME_LABEL;
import static ai.asserts.alertmanager.metrics.MetricNames.PUBLISH;
import static ai.asserts.alertmanager.metrics.MetricNames.TARGET_LABEL;
import static org.springframework.http.HttpMethod.POST;

/**
 * Posts each alert to every live target in parallel. The alert counts as published when at least one target
 * accepts it. With no live targets publishing is skipped.
 */
@Slf4j
@Component
public class WebhookAlertPublisher implements AlertPublisher {
    private final PublishingTargetRegistry targetRegistry;
    private final RestTemplate restTemplate;
    private final TaskThreadPool taskThreadPool;
    private final DispatchMetricCollector metricCollector;

    public WebhookAlertPublisher(PublishingTargetRegistry targetRegistry, RestTemplate restTemplate,
                                 @Qualifier("publishing-thread-pool") TaskThreadPool taskThreadPool,
                                 DispatchMetricCollector metricCollector) {
        this.targetRegistry = targetRegistry;
        this.restTemplate = restTemplate;
        this.taskThreadPool = taskThreadPool;
        this.metricCollector = metricCollector;
    }

    @Override
    public void publish(Alert alert, Deadline deadline) {
        List<PublishingTarget> targets = targetRegistry.getTargets();
        if (targets.isEmpty()) {
            log.debug("No publishing targets, skipped {}", alert.getFingerprint());
            return;
        }

        List<Future<ResponseEntity<String>>> futures = new ArrayList<>();
        for (PublishingTarget target : targets) {
            HttpEntity<Map<String, Object>> request = new HttpEntity<>(payload(target, alert), headers(target));
            futures.add(taskThreadPool.getExecutorService().submit(() ->
                    restTemplate.exchange(target.getUrl(), POST, request, String.class)));
        }

        int failures = 0;
        int timeouts = 0;
        String lastError = null;
        for (int i = 0; i < futures.size(); i++) {
            PublishingTarget target = targets.get(i);
            Future<ResponseEntity<String>> future = futures.get(i);
            try {
                ResponseEntity<String> response = future.get(deadline.remaining().toMillis(), TimeUnit.MILLISECONDS);
                log.debug("Published {} to {}, got {}", alert.getFingerprint(), target.getName(),
                        response.getStatusCode());
                record(target, "success");
            } catch (TimeoutException e) {
                future.cancel(true);
                timeouts++;
                failures++;
                lastError = "timed out publishing to " + target.getName();
                record(target, "timeout");
            } catch (ExecutionException e) {
                failures++;
                lastError = target.getName() + ": " + e.getCause().getMessage();
                log.error("Error publishing {} to {}", alert.getFingerprint(), target.getName(), e.getCause());
                record(target, "failure");
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.forEach(f -> f.cancel(true));
                throw new PipelineTimeoutException("Interrupted while publishing " + alert.getFingerprint(), e);
            }
        }

        if (failures == targets.size()) {
            if (timeouts == failures) {
                throw new PipelineTimeoutException("Publishing timed out for all " + failures + " targets");
            }
            throw new PublishException("Publishing failed for all " + failures + " targets, last error " + lastError);
        }
    }

    private Map<String, Object> payload(PublishingTarget target, Alert alert) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("receiver", target.getName());
        payload.put("status", alert.getStatus());
        payload.put("alerts", ImmutableList.of(alert));
        return payload;
    }

    private HttpHeaders headers(PublishingTarget target) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (target.getHeaders() != null) {
            target.getHeaders().forEach(headers::set);
        }
        return headers;
    }

    private void record(PublishingTarget target, String outcome) {
        metricCollector.recordCounterValue(PUBLISH,
                ImmutableSortedMap.of(TARGET_LABEL, target.getName(), OUTCOME_LABEL, outcome), 1);
    }
}
