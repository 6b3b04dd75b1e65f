/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.publishing;

import ai.asserts.alertmanager.DispatchConfigProvider;
import ai.asserts.alertmanager.EnvironmentConfig;
import ai.asserts.alertmanager.TaskThreadPool;
import ai.asserts.alertmanager.config.RefreshConfig;
import ai.asserts.alertmanager.config.TargetConfig;
import ai.asserts.alertmanager.error.RefreshInProgressException;
import ai.asserts.alertmanager.error.RefreshRateLimitedException;
import ai.asserts.alertmanager.error.ServiceUnavailableException;
import ai.asserts.alertmanager.events.EventBus;
import ai.asserts.alertmanager.events.EventType;
import ai.asserts.alertmanager.metrics.DispatchMetricCollector;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableSortedMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

import static ai.asserts.alertmanager.metrics.MetricNames.OUTCOME_LABEL;
import static ai.asserts.alertmanager.metrics.MetricNames.REFRESH;
import static ai.asserts.alertmanager.metrics.MetricNames.REFRESH_LATENCY;

/**
 * Keeps the live set of publishing targets current. Refreshes run on a timer and on demand. One atomic flag gates
 * all executions, so a trigger that finds a refresh running is rejected instead of queued. On-demand triggers are
 * also limited to one per rate limit window. A failed refresh keeps the last known good target set.
 */
@Slf4j
@Component
public class RefreshManager implements InitializingBean, DisposableBean {
    public static final String EVENT_SOURCE = "refresh-manager";

    private final TargetDiscovery targetDiscovery;
    private final TargetValidator targetValidator;
    private final PublishingTargetRegistry targetRegistry;
    private final DispatchConfigProvider configProvider;
    private final EnvironmentConfig environmentConfig;
    private final EventBus eventBus;
    private final DispatchMetricCollector metricCollector;
    private final TaskThreadPool triggerThreadPool;
    private final TaskThreadPool validationThreadPool;
    private final Clock clock;
    private final Duration refreshInterval;

    private final AtomicBoolean inProgress = new AtomicBoolean(false);
    private final AtomicBoolean running = new AtomicBoolean(false);
    /**
     * Only read and written by the holder of the in-progress gate
     */
    private Instant lastTrigger;
    private volatile RefreshStatus status = RefreshStatus.INITIAL;

    public RefreshManager(TargetDiscovery targetDiscovery, TargetValidator targetValidator,
                          PublishingTargetRegistry targetRegistry, DispatchConfigProvider configProvider,
                          EnvironmentConfig environmentConfig, EventBus eventBus,
                          DispatchMetricCollector metricCollector,
                          @Qualifier("refresh-trigger-thread-pool") TaskThreadPool triggerThreadPool,
                          @Qualifier("target-validation-thread-pool") TaskThreadPool validationThreadPool,
                          Clock clock,
                          @Value("${alertmanager.targets.refresh.fixedDelay:300000}") long refreshIntervalMs) {
        this.targetDiscovery = targetDiscovery;
        this.targetValidator = targetValidator;
        this.targetRegistry = targetRegistry;
        this.configProvider = configProvider;
        this.environmentConfig = environmentConfig;
        this.eventBus = eventBus;
        this.metricCollector = metricCollector;
        this.triggerThreadPool = triggerThreadPool;
        this.validationThreadPool = validationThreadPool;
        this.clock = clock;
        this.refreshInterval = Duration.ofMillis(refreshIntervalMs);
    }

    @Override
    public void afterPropertiesSet() {
        start();
    }

    @Override
    public void destroy() {
        stop();
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            log.info("Refresh manager started, interval {}", refreshInterval);
        }
    }

    public void stop() {
        if (running.compareAndSet(true, false)) {
            log.info("Refresh manager stopped");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Starts an asynchronous refresh.
     *
     * @throws RefreshInProgressException  if a refresh is already running
     * @throws RefreshRateLimitedException if the previous on-demand trigger is inside the rate limit window
     */
    public void refreshNow() {
        if (!running.get()) {
            throw new ServiceUnavailableException("Refresh manager is stopped");
        }
        if (!inProgress.compareAndSet(false, true)) {
            metricCollector.increment(REFRESH, OUTCOME_LABEL, "in_progress");
            throw new RefreshInProgressException();
        }

        Instant now = clock.instant();
        RefreshConfig config = configProvider.getConfig().getRefresh();
        if (lastTrigger != null) {
            Instant allowedAt = lastTrigger.plusSeconds(config.getRateLimitSeconds());
            if (now.isBefore(allowedAt)) {
                inProgress.set(false);
                metricCollector.increment(REFRESH, OUTCOME_LABEL, "rate_limited");
                log.warn("Refresh rejected, last trigger at {}", lastTrigger);
                throw new RefreshRateLimitedException(Duration.between(now, allowedAt));
            }
        }
        lastTrigger = now;
        status = status.toBuilder().state(RefreshState.IN_PROGRESS).build();

        try {
            triggerThreadPool.getExecutorService().submit(() -> {
                try {
                    doRefresh();
                } finally {
                    inProgress.set(false);
                }
            });
        } catch (RejectedExecutionException e) {
            inProgress.set(false);
            log.error("Failed to start refresh", e);
            throw new ServiceUnavailableException("Refresh could not be started");
        }
        log.info("Refresh triggered");
    }

    @Scheduled(fixedDelayString = "${alertmanager.targets.refresh.fixedDelay:300000}",
            initialDelayString = "${alertmanager.targets.refresh.initialDelay:30000}")
    public void periodicRefresh() {
        if (environmentConfig.isDisabled() || !running.get()) {
            log.debug("Periodic target refresh off");
            return;
        }
        if (!inProgress.compareAndSet(false, true)) {
            log.info("Periodic target refresh skipped, a refresh is already in progress");
            return;
        }
        status = status.toBuilder().state(RefreshState.IN_PROGRESS).build();
        try {
            doRefresh();
        } finally {
            inProgress.set(false);
        }
    }

    public RefreshStatus getStatus() {
        return status;
    }

    public boolean isInProgress() {
        return inProgress.get();
    }

    /**
     * Caller must hold the in-progress gate.
     */
    @VisibleForTesting
    void doRefresh() {
        Instant startedAt = clock.instant();
        RefreshStatus previous = status;
        RefreshStatus.RefreshStatusBuilder next = previous.toBuilder()
                .lastRefresh(startedAt)
                .nextRefresh(startedAt.plus(refreshInterval));
        try {
            List<TargetConfig> candidates = targetDiscovery.discover();
            List<PublishingTarget> targets = validateAll(candidates);
            List<PublishingTarget> valid = targets.stream()
                    .filter(PublishingTarget::isValid)
                    .collect(Collectors.toList());
            next.targetsDiscovered(candidates.size())
                    .targetsValid(valid.size())
                    .targetsInvalid(targets.size() - valid.size());
            if (!candidates.isEmpty() && valid.isEmpty()) {
                throw new IllegalStateException("None of " + candidates.size() + " candidate targets is valid");
            }
            targetRegistry.replace(valid);
            next.state(RefreshState.SUCCESS).consecutiveFailures(0).error(null);
            metricCollector.increment(REFRESH, OUTCOME_LABEL, "success");
            log.info("Refreshed publishing targets, {} valid of {}", valid.size(), candidates.size());
        } catch (Exception e) {
            log.error("Target refresh failed", e);
            next.state(RefreshState.FAILURE)
                    .consecutiveFailures(previous.getConsecutiveFailures() + 1)
                    .error(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            metricCollector.increment(REFRESH, OUTCOME_LABEL, "failure");
        }

        long durationMs = Duration.between(startedAt, clock.instant()).toMillis();
        metricCollector.recordLatency(REFRESH_LATENCY, ImmutableSortedMap.of(), durationMs);
        RefreshStatus completed = next.refreshDurationMs(durationMs).build();
        status = completed;
        eventBus.publish(EventType.TARGETS_REFRESHED, completed, EVENT_SOURCE);
    }

    private List<PublishingTarget> validateAll(List<TargetConfig> candidates) {
        long timeoutMs = configProvider.getConfig().getRefresh().getValidationTimeoutMs();
        List<Future<PublishingTarget>> futures = new ArrayList<>();
        candidates.forEach(candidate -> futures.add(
                validationThreadPool.getExecutorService().submit(() -> targetValidator.validate(candidate))));

        List<PublishingTarget> targets = new ArrayList<>();
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        for (int i = 0; i < futures.size(); i++) {
            TargetConfig candidate = candidates.get(i);
            Future<PublishingTarget> future = futures.get(i);
            try {
                long remaining = Math.max(0, deadline - System.nanoTime());
                targets.add(future.get(remaining, TimeUnit.NANOSECONDS));
            } catch (TimeoutException e) {
                future.cancel(true);
                log.warn("Validation of target {} timed out", candidate.getName());
                targets.add(invalid(candidate, "validation timed out after " + timeoutMs + "ms"));
            } catch (ExecutionException e) {
                log.warn("Validation of target {} failed", candidate.getName(), e.getCause());
                targets.add(invalid(candidate, String.valueOf(e.getCause().getMessage())));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.forEach(f -> f.cancel(true));
                throw new IllegalStateException("Interrupted while validating targets", e);
            }
        }
        return targets;
    }

    private PublishingTarget invalid(TargetConfig candidate, String error) {
        return PublishingTarget.builder()
                .name(candidate.getName())
                .url(candidate.getUrl())
                .type(candidate.getType())
                .valid(false)
                .lastValidatedAt(clock.instant())
                .error(error)
                .build();
    }
}
