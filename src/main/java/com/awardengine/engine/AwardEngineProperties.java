package com.awardengine.engine;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Configuration properties for the award engine, prefix {@code award-engine.*}.
 *
 * <p>Defaults: heartbeat enabled, first evaluation 6 seconds after start-up so
 * notifications do not land on the loading screen, then every 2 seconds.
 */
@ConfigurationProperties(prefix = "award-engine")
public record AwardEngineProperties(@DefaultValue Heartbeat heartbeat) {

    public record Heartbeat(
        @DefaultValue("true") boolean enabled,
        @DefaultValue("6s") Duration initialDelay,
        @DefaultValue("2s") Duration interval
    ) {
        public Heartbeat {
            if (initialDelay.isNegative()) {
                throw new IllegalArgumentException("award-engine.heartbeat.initial-delay must not be negative");
            }
            if (interval.isZero() || interval.isNegative()) {
                throw new IllegalArgumentException("award-engine.heartbeat.interval must be positive");
            }
        }
    }
}
