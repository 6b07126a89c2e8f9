package com.shardfeed.feed.config;

import com.shardfeed.feed.core.exception.ConfigurationException;
import com.typesafe.config.Config;

import javax.inject.Inject;
import javax.inject.Singleton;

@Singleton
public final class CacheConfig {
    private final int recordCapacity;
    private final int feedCapacity;

    @Inject
    public CacheConfig(Config config) {
        Config cache = config.getConfig("cache");
        this.recordCapacity = ConfigurationException.requirePositive("cache.record-capacity",
                                                                     cache.getInt("record-capacity"));
        this.feedCapacity = ConfigurationException.requirePositive("cache.feed-capacity",
                                                                   cache.getInt("feed-capacity"));
    }

    public int getRecordCapacity() {
        return recordCapacity;
    }

    public int getFeedCapacity() {
        return feedCapacity;
    }
}
