/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.enrichment;

import ai.asserts.alertmanager.DispatchConfigProvider;
import ai.asserts.alertmanager.config.EnrichmentConfig;
import ai.asserts.alertmanager.model.Alert;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Asks the remote classifier for a severity verdict. Errors propagate to the caller.
 */
@Slf4j
@Component
public class RemoteClassificationEnricher implements ClassificationEnricher {
    private final DispatchConfigProvider configProvider;
    private final RestTemplateBuilder restTemplateBuilder;
    private final Map<Integer, RestTemplate> restTemplates = new ConcurrentHashMap<>();

    public RemoteClassificationEnricher(DispatchConfigProvider configProvider,
                                        RestTemplateBuilder restTemplateBuilder) {
        this.configProvider = configProvider;
        this.restTemplateBuilder = restTemplateBuilder;
    }

    @Override
    public Optional<Classification> classify(Alert alert) {
        EnrichmentConfig config = configProvider.getConfig().getEnrichment();
        Map<String, Object> request = ImmutableMap.of(
                "fingerprint", alert.getFingerprint(),
                "labels", alert.getLabels(),
                "annotations", alert.getAnnotations(),
                "status", alert.getStatus().name());
        Classification classification = getRestTemplate(config.getTimeoutMs())
                .postForObject(config.getUrl(), request, Classification.class);
        log.debug("Classified {} as {}", alert.getFingerprint(), classification);
        return Optional.ofNullable(classification);
    }

    @VisibleForTesting
    RestTemplate getRestTemplate(int timeoutMs) {
        return restTemplates.computeIfAbsent(timeoutMs, timeout -> restTemplateBuilder
                .setConnectTimeout(Duration.ofMillis(timeout))
                .setReadTimeout(Duration.ofMillis(timeout))
                .build());
    }
}
