package com.shardfeed.feed.module;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.shardfeed.feed.cache.LruCache;
import com.shardfeed.feed.config.CacheConfig;
import com.shardfeed.feed.config.RankingConfig;
import com.shardfeed.feed.config.ShardConfig;
import com.shardfeed.feed.metrics.MetricsCollector;
import com.shardfeed.feed.repository.ContentStore;
import com.shardfeed.feed.repository.DataAccessLayer;
import com.shardfeed.feed.repository.ShardedContentStore;
import com.shardfeed.feed.repository.SocialGraph;
import com.shardfeed.feed.service.feed.FeedPage;
import com.shardfeed.feed.service.feed.FeedRanker;
import com.shardfeed.feed.service.feed.FeedScorer;
import com.shardfeed.feed.service.feed.FeedService;
import com.shardfeed.feed.shard.ShardDescriptor;
import com.shardfeed.feed.shard.ShardManager;
import com.shardfeed.feed.storage.StorageBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.inject.Named;
import javax.inject.Singleton;
import java.time.Clock;

public final class ServiceModule extends AbstractModule {
    private static final Logger log = LoggerFactory.getLogger(ServiceModule.class);

    public static final String RECORD_CACHE = "recordCache";
    public static final String FEED_CACHE = "feedCache";

    @Provides
    @Singleton
    Clock provideClock() {
        return Clock.systemUTC();
    }

    /**
     * 설정된 파티션으로 링/풀 초기화
     */
    @Provides
    @Singleton
    ShardManager provideShardManager(ShardConfig config, MetricsCollector metrics) {
        ShardManager shardManager = new ShardManager(config.getVirtualNodes(), metrics);
        for (ShardDescriptor descriptor : config.getPartitions()) {
            shardManager.addShard(descriptor);
        }
        log.info("ShardManager initialized: partitions={} virtualNodes={}",
                 shardManager.partitionIds(), config.getVirtualNodes());
        return shardManager;
    }

    @Provides
    @Singleton
    @Named(RECORD_CACHE)
    LruCache<String, byte[]> provideRecordCache(CacheConfig config, MetricsCollector metrics) {
        LruCache<String, byte[]> cache = new LruCache<>("records", config.getRecordCapacity());
        metrics.bindCache(cache);
        return cache;
    }

    @Provides
    @Singleton
    @Named(FEED_CACHE)
    LruCache<String, FeedPage> provideFeedCache(CacheConfig config, MetricsCollector metrics) {
        LruCache<String, FeedPage> cache = new LruCache<>("feeds", config.getFeedCapacity());
        metrics.bindCache(cache);
        return cache;
    }

    @Provides
    @Singleton
    DataAccessLayer provideDataAccessLayer(ShardManager shardManager,
                                           StorageBackend backend,
                                           @Named(RECORD_CACHE) LruCache<String, byte[]> recordCache,
                                           MetricsCollector metrics) {
        return new DataAccessLayer(shardManager, backend, recordCache, metrics);
    }

    @Provides
    @Singleton
    ShardedContentStore provideShardedContentStore(DataAccessLayer dataAccessLayer) {
        return new ShardedContentStore(dataAccessLayer);
    }

    @Provides
    @Singleton
    ContentStore provideContentStore(ShardedContentStore store) {
        return store;
    }

    @Provides
    @Singleton
    FeedScorer provideFeedScorer(RankingConfig config) {
        return new FeedScorer(config.getWeights());
    }

    @Provides
    @Singleton
    FeedRanker provideFeedRanker(SocialGraph socialGraph,
                                 ContentStore contentStore,
                                 FeedScorer scorer,
                                 RankingConfig config,
                                 Clock clock,
                                 MetricsCollector metrics) {
        return new FeedRanker(socialGraph, contentStore, scorer,
                              config.getCandidateWindow(), config.getMaxFailedFollowees(), clock, metrics);
    }

    @Provides
    @Singleton
    FeedService provideFeedService(FeedRanker ranker,
                                   @Named(FEED_CACHE) LruCache<String, FeedPage> feedCache,
                                   RankingConfig config) {
        return new FeedService(ranker, feedCache, config.getPageSize());
    }
}
