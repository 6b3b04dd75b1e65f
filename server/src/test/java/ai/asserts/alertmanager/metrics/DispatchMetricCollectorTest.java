/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.metrics;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import io.prometheus.client.Collector;
import io.prometheus.client.Collector.MetricFamilySamples.Sample;
import io.prometheus.client.CollectorRegistry;
import org.easymock.EasyMockSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;

import java.util.List;

import static io.prometheus.client.Collector.Type.COUNTER;
import static org.easymock.EasyMock.expect;
import static org.junit.jupiter.api.Assertions.assertAll;
import static org.junit.jupiter.api.Assertions.assertEquals;

public class DispatchMetricCollectorTest extends EasyMockSupport {
    private ObjectProvider<CollectorRegistry> registryProvider;
    private DispatchMetricCollector metricCollector;

    @BeforeEach
    @SuppressWarnings("unchecked")
    public void setup() {
        registryProvider = mock(ObjectProvider.class);
        metricCollector = new DispatchMetricCollector(registryProvider);
    }

    @Test
    void afterPropertiesSet_registers() {
        CollectorRegistry registry = mock(CollectorRegistry.class);
        expect(registryProvider.getIfAvailable()).andReturn(registry);
        registry.register(metricCollector);
        replayAll();
        metricCollector.afterPropertiesSet();
        verifyAll();
    }

    @Test
    void afterPropertiesSet_noRegistry() {
        expect(registryProvider.getIfAvailable()).andReturn(null);
        replayAll();
        metricCollector.afterPropertiesSet();
        verifyAll();
    }

    @Test
    void collect_counter() {
        replayAll();
        metricCollector.increment(MetricNames.SUPPRESSED, MetricNames.REASON_LABEL, "silenced");
        metricCollector.increment(MetricNames.SUPPRESSED, MetricNames.REASON_LABEL, "silenced");
        metricCollector.increment(MetricNames.SUPPRESSED, MetricNames.REASON_LABEL, "inhibited");

        List<Collector.MetricFamilySamples> collect = metricCollector.collect();
        assertAll(
                () -> assertEquals(1, collect.size()),
                () -> assertEquals(MetricNames.SUPPRESSED, collect.get(0).name),
                () -> assertEquals(COUNTER, collect.get(0).type),
                () -> assertEquals(2, collect.get(0).samples.size())
        );
        assertEquals(2L, metricCollector.getCounterValue(MetricNames.SUPPRESSED,
                ImmutableSortedMap.of(MetricNames.REASON_LABEL, "silenced")));
        assertEquals(1L, metricCollector.getCounterValue(MetricNames.SUPPRESSED,
                ImmutableSortedMap.of(MetricNames.REASON_LABEL, "inhibited")));
        assertEquals(0L, metricCollector.getCounterValue(MetricNames.SUPPRESSED,
                ImmutableSortedMap.of(MetricNames.REASON_LABEL, "other")));
        verifyAll();
    }

    @Test
    void collect_latency() {
        replayAll();
        metricCollector.recordLatency(MetricNames.PIPELINE_LATENCY, ImmutableSortedMap.of("stage", "publish"), 10.0D);
        metricCollector.recordLatency(MetricNames.PIPELINE_LATENCY, ImmutableSortedMap.of("stage", "publish"), 20.0D);

        List<Collector.MetricFamilySamples> collect = metricCollector.collect();
        Sample count = new Sample(MetricNames.PIPELINE_LATENCY + "_count",
                ImmutableList.of("stage"), ImmutableList.of("publish"), 2.0D);
        Sample sum = new Sample(MetricNames.PIPELINE_LATENCY + "_sum",
                ImmutableList.of("stage"), ImmutableList.of("publish"), 30.0D);
        assertAll(
                () -> assertEquals(2, collect.size()),
                () -> assertEquals(count, collect.get(0).samples.get(0)),
                () -> assertEquals(sum, collect.get(1).samples.get(0))
        );
        verifyAll();
    }
}
