package com.shardfeed.feed.metrics;

import com.shardfeed.feed.cache.LruCache;
import com.shardfeed.feed.repository.AccessStatus;
import com.shardfeed.feed.shard.PartitionConnectionPool;
import com.shardfeed.feed.shard.RouteStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.util.ArrayList;
import java.util.List;

@Singleton
public final class MetricsCollector {
    private static final Logger log = LoggerFactory.getLogger(MetricsCollector.class);

    private final MeterRegistry registry;

    @Inject
    public MetricsCollector(MeterRegistry registry) {
        this.registry = registry;
    }

    public MeterRegistry registry() {
        return registry;
    }

    // ==================== CACHE ====================

    /**
     * LruCache 통계를 FunctionCounter/Gauge로 노출 (캐시 이름 태그)
     */
    public void bindCache(LruCache<?, ?> cache) {
        String name = cache.name();
        FunctionCounter.builder("cache.hits", cache, c -> c.stats().hits())
                .tag("cache", name)
                .register(registry);
        FunctionCounter.builder("cache.misses", cache, c -> c.stats().misses())
                .tag("cache", name)
                .register(registry);
        FunctionCounter.builder("cache.evictions", cache, c -> c.stats().evictions())
                .tag("cache", name)
                .register(registry);
        Gauge.builder("cache.size", cache, LruCache::size)
                .tag("cache", name)
                .register(registry);

        log.debug("Cache metrics bound: cache={} capacity={}", name, cache.capacity());
    }

    // ==================== SHARD / POOL ====================

    /**
     * 파티션 풀 Gauge 등록
     */
    public void bindPool(PartitionConnectionPool pool) {
        String partition = pool.getPartitionId();
        Gauge.builder("shard.pool.active", pool, PartitionConnectionPool::active)
                .tag("partition", partition)
                .register(registry);
        Gauge.builder("shard.pool.available", pool, PartitionConnectionPool::available)
                .tag("partition", partition)
                .register(registry);
        Gauge.builder("shard.pool.misuse", pool, PartitionConnectionPool::misuseCount)
                .tag("partition", partition)
                .register(registry);
        Gauge.builder("shard.pool.utilization", pool, PartitionConnectionPool::utilization)
                .tag("partition", partition)
                .register(registry);
    }

    /**
     * 제거된 파티션의 meter 정리
     */
    public void unbindPool(String partition) {
        List<Meter> meters = new ArrayList<>();
        for (String name : List.of("shard.pool.active", "shard.pool.available", "shard.pool.misuse",
                                   "shard.pool.utilization")) {
            meters.addAll(registry.find(name).tag("partition", partition).meters());
        }
        meters.forEach(registry::remove);
    }

    /**
     * routeAndAcquire 결과 카운터
     */
    public void recordRoute(String partition, RouteStatus status) {
        Counter.builder("shard.route")
               .tag("partition", partition)
               .tag("status", status.name())
               .register(registry)
               .increment();
    }

    // ==================== DATA ACCESS ====================

    public void recordAccess(String operation, AccessStatus status) {
        Counter.builder("storage.access")
               .tag("operation", operation)
               .tag("status", status.name())
               .register(registry)
               .increment();
    }

    public void recordBackendError(String operation, String partition, String errorType) {
        Counter.builder("storage.backend.errors")
               .tag("operation", operation)
               .tag("partition", partition)
               .tag("error", errorType)
               .register(registry)
               .increment();
    }

    public void recordBackendLatency(Timer.Sample sample, String operation, String partition) {
        // Timer.Builder는 tag 호출 시 내부 상태가 바뀌므로 매번 새로 생성
        sample.stop(Timer.builder("storage.backend.latency")
                .description("Backend read/write latency per partition")
                .publishPercentileHistogram()
                .tag("operation", operation)
                .tag("partition", partition)
                .register(registry));
    }

    // ==================== FEED ====================

    public Timer.Sample startTimer() {
        return Timer.start(registry);
    }

    public void recordRankLatency(Timer.Sample sample, boolean partial) {
        sample.stop(Timer.builder("feed.rank.latency")
                .description("Feed ranking latency")
                .publishPercentiles(0.5, 0.95, 0.99)
                .tag("partial", String.valueOf(partial))
                .register(registry));
    }

    public void recordFolloweeFetchFailure() {
        Counter.builder("feed.followee.fetch.failures")
               .description("Followee timelines skipped during ranking")
               .register(registry)
               .increment();
    }

    public void recordPartialFeed() {
        Counter.builder("feed.partial")
               .description("Feed pages returned with partial=true")
               .register(registry)
               .increment();
    }

    // ==================== ALERTS ====================

    public void recordAlert(String channel, String severity) {
        Counter.builder("alerts.delivered")
               .tag("channel", channel)
               .tag("severity", severity)
               .register(registry)
               .increment();
    }

    public void recordAlertFailure(String channel) {
        Counter.builder("alerts.failed")
               .tag("channel", channel)
               .register(registry)
               .increment();
    }
}
