package com.shardfeed.feed.config;

import com.shardfeed.feed.core.exception.ConfigurationException;
import com.typesafe.config.Config;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.time.Duration;

@Singleton
public final class MetricsConfig {
    private final int port;
    private final Duration reportInterval;

    @Inject
    public MetricsConfig(Config config) {
        this.port = config.getInt("metrics.port");
        this.reportInterval = Duration.ofSeconds(
            ConfigurationException.requirePositive("metrics.report-interval-seconds",
                                                   config.getInt("metrics.report-interval-seconds")));
    }

    public int getPort() {
        return port;
    }

    public Duration getReportInterval() {
        return reportInterval;
    }
}
