package com.awardengine.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.FixedDelayTask;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Periodic award check. Awards are not evaluated every frame but on a coarse
 * heartbeat, after an initial delay; see {@link AwardEngineProperties}.
 *
 * <p>Each tick refreshes GLOBAL key figures from the registered
 * {@link GlobalProgressSource}s, then runs {@link AwardEngine#evaluateAndFire()}.
 * A failing tick is logged and the schedule carries on.
 *
 * <p>Disabled with {@code award-engine.heartbeat.enabled=false}.
 */
@Component
@ConditionalOnProperty(prefix = "award-engine.heartbeat", name = "enabled", havingValue = "true", matchIfMissing = true)
public class AwardHeartbeat implements SchedulingConfigurer {

    private static final Logger log = LoggerFactory.getLogger(AwardHeartbeat.class);

    private final AwardEngine engine;
    private final ObjectProvider<GlobalProgressSource> progressSources;
    private final AwardEngineProperties.Heartbeat settings;

    public AwardHeartbeat(AwardEngine engine,
                          ObjectProvider<GlobalProgressSource> progressSources,
                          AwardEngineProperties properties) {
        this.engine = engine;
        this.progressSources = progressSources;
        this.settings = properties.heartbeat();
    }

    @Override
    public void configureTasks(ScheduledTaskRegistrar registrar) {
        log.info("Award heartbeat every {} after an initial delay of {}",
            settings.interval(), settings.initialDelay());
        registrar.addFixedDelayTask(new FixedDelayTask(this::tick, settings.interval(), settings.initialDelay()));
    }

    /**
     * One heartbeat: refresh global totals, then evaluate.
     */
    public void tick() {
        progressSources.orderedStream().forEach(this::refreshFrom);
        try {
            List<String> fired = engine.evaluateAndFire();
            if (!fired.isEmpty()) {
                log.info("Heartbeat awarded {}", fired);
            }
        } catch (RuntimeException ex) {
            log.error("Award evaluation failed, will retry pending awards on next heartbeat", ex);
        }
    }

    private void refreshFrom(GlobalProgressSource source) {
        try {
            engine.refreshGlobalMetrics(source.globalTotals());
        } catch (RuntimeException ex) {
            log.warn("Could not refresh global key figures from {}: {}",
                source.getClass().getSimpleName(), ex.getMessage());
        }
    }
}
