/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager;

import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.ApplicationListener;
import org.springframework.context.ConfigurableApplicationContext;

import java.util.function.Supplier;

/**
 * Publishes the build coordinates of the running service as an info gauge once the application is ready.
 */
@Slf4j
public class BuildInfoEventListener implements ApplicationListener<ApplicationReadyEvent> {
    @Override
    public void onApplicationEvent(ApplicationReadyEvent event) {
        ConfigurableApplicationContext context = event.getApplicationContext();
        ObjectProvider<BuildProperties> buildProperties = context.getBeanProvider(BuildProperties.class);
        BuildProperties properties = buildProperties.getIfAvailable();
        if (properties == null) {
            log.info("Build info not available, skipping alertmanager_build_info");
            return;
        }
        MeterRegistry meterRegistry = context.getBean(MeterRegistry.class);
        Gauge infoGauge = builder(() -> 1)
                .description("Alert dispatch build info")
                .tag("version", properties.getVersion())
                .tag("artifact", properties.getArtifact())
                .tag("group", properties.getGroup())
                .register(meterRegistry);
        log.info("Alert dispatch {} version {} started", properties.getArtifact(), properties.getVersion());
        log.debug("Registered {}", infoGauge.getId());
    }

    @VisibleForTesting
    Gauge.Builder<Supplier<Number>> builder(Supplier<Number> f) {
        return Gauge.builder("alertmanager_build_info", f);
    }
}
