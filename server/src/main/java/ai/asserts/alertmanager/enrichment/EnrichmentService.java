/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.enrichment;

import ai.asserts.alertmanager.DispatchConfigProvider;
import ai.asserts.alertmanager.config.EnrichmentConfig;
import ai.asserts.alertmanager.metrics.DispatchMetricCollector;
import ai.asserts.alertmanager.model.Alert;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static ai.asserts.alertmanager.metrics.MetricNames.ENRICHMENT;
import static ai.asserts.alertmanager.metrics.MetricNames.OUTCOME_LABEL;

/**
 * Front for classification. Picks the remote or no-op enricher from the current configuration, caches verdicts by
 * fingerprint and never fails: any enricher error degrades to an unclassified alert.
 */
@Slf4j
@Component
public class EnrichmentService {
    private final DispatchConfigProvider configProvider;
    private final ClassificationEnricher remoteEnricher;
    private final DispatchMetricCollector metricCollector;
    private volatile CachedVerdicts verdicts;

    public EnrichmentService(DispatchConfigProvider configProvider, RemoteClassificationEnricher remoteEnricher,
                             DispatchMetricCollector metricCollector) {
        this.configProvider = configProvider;
        this.remoteEnricher = remoteEnricher;
        this.metricCollector = metricCollector;
    }

    public Optional<Classification> enrich(Alert alert) {
        EnrichmentConfig config = configProvider.getConfig().getEnrichment();
        ClassificationEnricher enricher = config.isEnabled() ? remoteEnricher : NoopClassificationEnricher.INSTANCE;
        if (!config.isEnabled()) {
            return enricher.classify(alert);
        }

        Cache<String, Classification> cache = getCache(config.getCacheTtlSeconds());
        Classification cached = cache.getIfPresent(alert.getFingerprint());
        if (cached != null) {
            metricCollector.increment(ENRICHMENT, OUTCOME_LABEL, "cache_hit");
            return Optional.of(cached);
        }
        try {
            Optional<Classification> classification = enricher.classify(alert);
            classification.ifPresent(c -> cache.put(alert.getFingerprint(), c));
            metricCollector.increment(ENRICHMENT, OUTCOME_LABEL, "success");
            return classification;
        } catch (Exception e) {
            log.warn("Enrichment failed for {}, continuing unclassified: {}", alert.getFingerprint(),
                    e.getMessage());
            metricCollector.increment(ENRICHMENT, OUTCOME_LABEL, "failure");
            return Optional.empty();
        }
    }

    private Cache<String, Classification> getCache(int ttlSeconds) {
        CachedVerdicts current = verdicts;
        if (current == null || current.ttlSeconds != ttlSeconds) {
            synchronized (this) {
                current = verdicts;
                if (current == null || current.ttlSeconds != ttlSeconds) {
                    current = new CachedVerdicts(ttlSeconds);
                    verdicts = current;
                }
            }
        }
        return current.cache;
    }

    private static class CachedVerdicts {
        private final int ttlSeconds;
        private final Cache<String, Classification> cache;

        CachedVerdicts(int ttlSeconds) {
            this.ttlSeconds = ttlSeconds;
            this.cache = CacheBuilder.newBuilder()
                    .maximumSize(10000)
                    .expireAfterWrite(ttlSeconds, TimeUnit.SECONDS)
                    .build();
        }
    }
}
