/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;

@Configuration
@SuppressWarnings("unused")
public class BeanConfiguration {
    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder,
                                     @Value("${alertmanager.http.connect_timeout_ms:2000}") long connectTimeout,
                                     @Value("${alertmanager.http.read_timeout_ms:10000}") long readTimeout) {
        return builder
                .setConnectTimeout(Duration.ofMillis(connectTimeout))
                .setReadTimeout(Duration.ofMillis(readTimeout))
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean("publishing-thread-pool")
    public TaskThreadPool publishingPool(MeterRegistry meterRegistry,
                                         @Value("${alertmanager.publishing.threads:8}") int threads) {
        return new TaskThreadPool("publishing-thread-pool", threads, meterRegistry);
    }

    @Bean("refresh-trigger-thread-pool")
    public TaskThreadPool refreshTriggerPool(MeterRegistry meterRegistry) {
        return new TaskThreadPool("refresh-trigger-thread-pool", 1, meterRegistry);
    }

    @Bean("target-validation-thread-pool")
    public TaskThreadPool targetValidationPool(MeterRegistry meterRegistry) {
        return new TaskThreadPool("target-validation-thread-pool", 4, meterRegistry);
    }

    @Bean("event-stream-thread-pool")
    public TaskThreadPool eventStreamPool(MeterRegistry meterRegistry,
                                          @Value("${alertmanager.event_stream.max_connections:64}") int threads) {
        return new TaskThreadPool("event-stream-thread-pool", threads, meterRegistry);
    }

    @Bean("event-hub-thread-pool")
    public TaskThreadPool eventHubPool(MeterRegistry meterRegistry) {
        return new TaskThreadPool("event-hub-thread-pool", 1, meterRegistry);
    }
}
