package com.shardfeed.feed.module;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.shardfeed.feed.alert.AlertChannel;
import com.shardfeed.feed.alert.AlertDispatcher;
import com.shardfeed.feed.alert.AlertSender;
import com.shardfeed.feed.alert.ChannelKind;
import com.shardfeed.feed.alert.ChatAlertChannel;
import com.shardfeed.feed.alert.EmailAlertChannel;
import com.shardfeed.feed.alert.LogAlertChannel;
import com.shardfeed.feed.config.AlertConfig;
import com.shardfeed.feed.config.HealthConfig;
import com.shardfeed.feed.metrics.MetricsCollector;
import com.shardfeed.feed.scheduler.PoolHealthCheck;
import com.shardfeed.feed.shard.ShardManager;

import javax.inject.Singleton;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * 알림 채널 + 주기 작업
 */
public final class SchedulerModule extends AbstractModule {

    @Provides
    @Singleton
    AlertDispatcher provideAlertDispatcher(AlertConfig config, AlertSender sender, MetricsCollector metrics) {
        List<AlertChannel> channels = new ArrayList<>();
        for (ChannelKind kind : config.getChannels()) {
            channels.add(switch (kind) {
                case LOG -> new LogAlertChannel();
                case EMAIL -> new EmailAlertChannel(sender, config.getEmailRecipient());
                case CHAT -> new ChatAlertChannel(sender, config.getChatRoom());
            });
        }
        return new AlertDispatcher(channels, metrics);
    }

    @Provides
    @Singleton
    PoolHealthCheck providePoolHealthCheck(ShardManager shardManager,
                                           AlertDispatcher dispatcher,
                                           HealthConfig config,
                                           Clock clock) {
        return new PoolHealthCheck(shardManager, dispatcher, config.getPoolUtilizationThreshold(), clock);
    }
}
