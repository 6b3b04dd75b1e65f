/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@Slf4j
@SpringBootApplication
@ComponentScan(basePackages = {"ai.asserts.alertmanager"})
@ConfigurationPropertiesScan(basePackages = {"ai.asserts.alertmanager"})
@EnableScheduling
public class AlertManagerApplication {
    public static void main(String[] args) {
        SpringApplication springApplication = new SpringApplication(AlertManagerApplication.class);
        springApplication.addListeners(new BuildInfoEventListener());
        springApplication.run(args);
    }
}
