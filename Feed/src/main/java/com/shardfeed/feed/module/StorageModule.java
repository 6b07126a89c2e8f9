package com.shardfeed.feed.module;

import com.google.inject.AbstractModule;
import com.shardfeed.feed.alert.AlertSender;
import com.shardfeed.feed.alert.LoggingAlertSender;
import com.shardfeed.feed.repository.InMemorySocialGraph;
import com.shardfeed.feed.repository.SocialGraph;
import com.shardfeed.feed.storage.InMemoryStorageBackend;
import com.shardfeed.feed.storage.StorageBackend;

/**
 * 외부 협력자 바인딩
 *
 * 실제 스토리지/소셜 그래프/알림 transport로 교체할 때 이 모듈만 바꾸면 됨
 */
public final class StorageModule extends AbstractModule {

    @Override
    protected void configure() {
        bind(StorageBackend.class).to(InMemoryStorageBackend.class);
        bind(SocialGraph.class).to(InMemorySocialGraph.class);
        bind(AlertSender.class).to(LoggingAlertSender.class);
    }
}
