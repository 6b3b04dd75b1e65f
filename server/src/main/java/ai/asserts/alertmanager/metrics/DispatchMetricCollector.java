/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.metrics;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.util.concurrent.AtomicDouble;
import io.prometheus.client.Collector;
import io.prometheus.client.Collector.MetricFamilySamples.Sample;
import io.prometheus.client.CollectorRegistry;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters and latency sums for the dispatch pipeline, exposed through the Prometheus client registry.
 */
@Component
@Slf4j
public class DispatchMetricCollector extends Collector implements InitializingBean {
    private final ObjectProvider<CollectorRegistry> collectorRegistry;
    private final Cache<Key, AtomicLong> counters;
    private final Cache<Key, LatencyCounter> latencyCounters;

    public DispatchMetricCollector(ObjectProvider<CollectorRegistry> collectorRegistry) {
        this.collectorRegistry = collectorRegistry;
        counters = CacheBuilder.newBuilder()
                .expireAfterAccess(60, TimeUnit.MINUTES)
                .build();

        latencyCounters = CacheBuilder.newBuilder()
                .expireAfterAccess(60, TimeUnit.MINUTES)
                .build();
    }

    @Override
    public void afterPropertiesSet() {
        CollectorRegistry registry = collectorRegistry.getIfAvailable();
        if (registry != null) {
            register(registry);
        }
    }

    @Override
    public List<MetricFamilySamples> collect() {
        List<MetricFamilySamples> familySamples = new ArrayList<>();

        try {
            Map<String, List<Sample>> counterSamples = new TreeMap<>();
            counters.asMap().forEach((key, value) ->
                    counterSamples.computeIfAbsent(key.metricName, k -> new ArrayList<>())
                            .add(new Sample(key.metricName, key.labelNames, key.labelValues, value.get())));
            counterSamples.forEach((name, samples) ->
                    familySamples.add(new MetricFamilySamples(name, Type.COUNTER, "", samples)));

            Map<String, List<Sample>> latencySamples = new TreeMap<>();
            latencyCounters.asMap().forEach((key, latencyCounter) -> {
                latencySamples.computeIfAbsent(key.metricName + "_count", k -> new ArrayList<>())
                        .add(new Sample(key.metricName + "_count", key.labelNames, key.labelValues,
                                latencyCounter.getCount()));
                latencySamples.computeIfAbsent(key.metricName + "_sum", k -> new ArrayList<>())
                        .add(new Sample(key.metricName + "_sum", key.labelNames, key.labelValues,
                                latencyCounter.getValue()));
            });
            latencySamples.forEach((name, samples) ->
                    familySamples.add(new MetricFamilySamples(name, Type.COUNTER, "", samples)));
        } catch (Exception e) {
            log.error("Failed to collect metric samples", e);
        }

        return familySamples;
    }

    public void increment(String metricName, String labelName, String labelValue) {
        recordCounterValue(metricName, ImmutableSortedMap.of(labelName, labelValue), 1);
    }

    public void recordCounterValue(String metricName, SortedMap<String, String> inputLabels, int value) {
        Key key = key(metricName, inputLabels);
        try {
            AtomicLong atomicLong = counters.get(key, () -> {
                log.debug("Creating counter {}{}", key.metricName, inputLabels);
                return new AtomicLong();
            });
            atomicLong.addAndGet(value);
        } catch (ExecutionException e) {
            log.error("Failed to get counter", e);
        }
    }

    public void recordLatency(String metricName, SortedMap<String, String> inputLabels, double value) {
        Key key = key(metricName, inputLabels);
        try {
            latencyCounters.get(key, () -> {
                log.debug("Creating latency counters {}{}", key.metricName, inputLabels);
                return new LatencyCounter();
            }).increment(value);
        } catch (ExecutionException e) {
            log.error("Failed to get latency counter", e);
        }
    }

    public long getCounterValue(String metricName, SortedMap<String, String> inputLabels) {
        AtomicLong counter = counters.getIfPresent(key(metricName, inputLabels));
        return counter == null ? 0 : counter.get();
    }

    private static Key key(String metricName, SortedMap<String, String> inputLabels) {
        return Key.builder()
                .metricName(metricName)
                .labelNames(new ArrayList<>(inputLabels.keySet()))
                .labelValues(new ArrayList<>(inputLabels.values()))
                .build();
    }

    @Builder
    @EqualsAndHashCode
    @ToString
    @Getter
    public static class Key {
        private final String metricName;
        private final List<String> labelNames;
        private final List<String> labelValues;
    }

    public static class LatencyCounter {
        private final AtomicDouble valueTotal = new AtomicDouble(0);
        private final AtomicInteger count = new AtomicInteger(0);

        public void increment(Double value) {
            valueTotal.addAndGet(value);
            count.incrementAndGet();
        }

        public int getCount() {
            return count.intValue();
        }

        public double getValue() {
            return valueTotal.doubleValue();
        }
    }
}
