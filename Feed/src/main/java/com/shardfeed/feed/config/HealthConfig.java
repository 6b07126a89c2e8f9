package com.shardfeed.feed.config;

import com.shardfeed.feed.core.exception.ConfigurationException;
import com.typesafe.config.Config;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.time.Duration;

@Singleton
public final class HealthConfig {
    private final Duration interval;
    private final double poolUtilizationThreshold;

    @Inject
    public HealthConfig(Config config) {
        Config health = config.getConfig("health");
        this.interval = Duration.ofMillis(ConfigurationException.requirePositive("health.interval-ms",
                                                                                 health.getInt("interval-ms")));
        this.poolUtilizationThreshold = health.getDouble("pool-utilization-threshold");
        if (!(poolUtilizationThreshold > 0.0 && poolUtilizationThreshold <= 1.0)) {
            throw new ConfigurationException("health.pool-utilization-threshold must be in (0, 1], got: "
                                             + poolUtilizationThreshold);
        }
    }

    public Duration getInterval() {
        return interval;
    }

    public double getPoolUtilizationThreshold() {
        return poolUtilizationThreshold;
    }
}
