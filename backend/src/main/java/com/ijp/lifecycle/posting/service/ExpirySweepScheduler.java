package com.ijp.lifecycle.posting.service;

import com.ijp.lifecycle.config.LifecycleProperties;
import com.ijp.lifecycle.posting.model.SweepSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.FixedDelayTask;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Registers the periodic sweep with the clamped interval and initial delay from {@link LifecycleProperties}.
 */
@Component
@ConditionalOnProperty(prefix = "lifecycle.sweeper", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ExpirySweepScheduler implements SchedulingConfigurer {
    private static final Logger log = LoggerFactory.getLogger(ExpirySweepScheduler.class);

    private final ExpirySweeper sweeper;
    private final LifecycleProperties properties;

    public ExpirySweepScheduler(ExpirySweeper sweeper, LifecycleProperties properties) {
        this.sweeper = sweeper;
        this.properties = properties;
    }

    @Override
    public void configureTasks(ScheduledTaskRegistrar registrar) {
        Duration interval = Duration.ofMillis(properties.getSweeper().getIntervalMs());
        Duration initialDelay = Duration.ofMillis(properties.getSweeper().getInitialDelayMs());
        registrar.addFixedDelayTask(new FixedDelayTask(this::runScheduledSweep, interval, initialDelay));
        log.info("Expiry sweep scheduled every {} (first run after {})", interval, initialDelay);
    }

    public void runScheduledSweep() {
        try {
            SweepSummary summary = sweeper.run();
            if (summary.skippedReason() != null) {
                log.debug("Scheduled expiry sweep skipped: {}", summary.skippedReason());
            }
        } catch (RuntimeException e) {
            log.warn("Scheduled expiry sweep failed", e);
        }
    }
}
