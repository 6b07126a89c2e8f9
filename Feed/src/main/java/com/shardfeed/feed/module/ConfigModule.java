package com.shardfeed.feed.module;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import javax.inject.Singleton;

/**
 * application.conf 로딩. 테스트는 Config를 직접 넘겨서 덮어씀
 */
public final class ConfigModule extends AbstractModule {
    private final Config override;

    public ConfigModule() {
        this(null);
    }

    public ConfigModule(Config override) {
        this.override = override;
    }

    @Provides
    @Singleton
    Config provideConfig() {
        Config config = ConfigFactory.load();
        return override == null ? config : override.withFallback(config).resolve();
    }
}
