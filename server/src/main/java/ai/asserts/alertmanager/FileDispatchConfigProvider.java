/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager;

import ai.asserts.alertmanager.config.DispatchConfig;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.FileSystemResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Loads the dispatch configuration from a YAML file or classpath resource and reloads it periodically. A reload that
 * fails to parse or validate leaves the previous configuration in effect.
 */
@Component
@Slf4j
public class FileDispatchConfigProvider implements DispatchConfigProvider {
    private final EnvironmentConfig environmentConfig;
    private final ObjectMapperFactory objectMapperFactory;
    private final String configFile;
    private final ReadWriteLock readWriteLock = new ReentrantReadWriteLock();
    private final ResourceLoader resourceLoader = new FileSystemResourceLoader();
    private DispatchConfig configCache;

    public FileDispatchConfigProvider(EnvironmentConfig environmentConfig,
                                      ObjectMapperFactory objectMapperFactory,
                                      @Value("${alertmanager.config.file:classpath:alert_dispatch_config.yml}")
                                      String configFile) {
        this.environmentConfig = environmentConfig;
        this.objectMapperFactory = objectMapperFactory;
        this.configFile = configFile;
        this.configCache = defaultConfig();
        load();
    }

    @Override
    public DispatchConfig getConfig() {
        readWriteLock.readLock().lock();
        try {
            return configCache;
        } finally {
            readWriteLock.readLock().unlock();
        }
    }

    @Override
    @Scheduled(fixedDelayString = "${alertmanager.config.reload.fixedDelay:60000}",
            initialDelayString = "${alertmanager.config.reload.fixedDelay:60000}")
    public void update() {
        if (environmentConfig.isDisabled()) {
            log.debug("Config reload off");
            return;
        }
        load();
    }

    @VisibleForTesting
    boolean load() {
        ObjectMapper objectMapper = objectMapperFactory.getObjectMapper();
        Resource resource = resourceLoader.getResource(configFile);
        DispatchConfig loaded;
        try (InputStream inputStream = resource.getInputStream()) {
            loaded = objectMapper.readValue(inputStream, new TypeReference<DispatchConfig>() {
            });
            if (loaded == null) {
                loaded = new DispatchConfig();
            }
            loaded.validateConfig();
        } catch (IOException e) {
            log.error("Failed to read dispatch configuration from " + configFile, e);
            return false;
        } catch (RuntimeException e) {
            log.error("Invalid dispatch configuration in " + configFile + ", keeping previous configuration", e);
            return false;
        }

        readWriteLock.writeLock().lock();
        try {
            if (!loaded.equals(configCache)) {
                log.info("Loaded dispatch configuration from {} with {} inhibit rules and {} targets", configFile,
                        loaded.getCompiledInhibitionRules().size(), loaded.getTargets().size());
            }
            configCache = loaded;
        } finally {
            readWriteLock.writeLock().unlock();
        }
        return true;
    }

    private static DispatchConfig defaultConfig() {
        DispatchConfig config = new DispatchConfig();
        config.validateConfig();
        return config;
    }
}
