package com.shardfeed.feed.metrics;

import com.shardfeed.feed.scheduler.PeriodicTask;
import com.shardfeed.feed.shard.ConsistentHashRing;
import com.shardfeed.feed.shard.ShardManager;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * 주기적 메트릭 요약 로그
 */
@Singleton
public final class MetricsReporter implements PeriodicTask {
    private static final Logger log = LoggerFactory.getLogger(MetricsReporter.class);

    private final MeterRegistry registry;
    private final ShardManager shardManager;

    @Inject
    public MetricsReporter(MeterRegistry registry, ShardManager shardManager) {
        this.registry = registry;
        this.shardManager = shardManager;
    }

    @Override
    public String name() {
        return "metrics-report";
    }

    @Override
    public void onTick() {
        log.info(report());
    }

    /**
     * 리포트 문자열 생성 (AsyncAppender에 한 번만 enqueue 되도록 한 줄로 묶음)
     */
    public String report() {
        StringBuilder sb = new StringBuilder(2048);
        sb.append("========== METRICS REPORT ==========\n");

        // Caches
        registry.find("cache.hits").functionCounters().forEach(hits -> {
            String cache = hits.getId().getTag("cache");
            double misses = registry.find("cache.misses").tag("cache", cache).functionCounters().stream()
                                    .mapToDouble(c -> c.count()).sum();
            double total = hits.count() + misses;
            sb.append(String.format("cache[%s] hits=%d misses=%d hitRate=%.3f\n",
                    cache, (long) hits.count(), (long) misses, total == 0 ? 0.0 : hits.count() / total));
        });

        // Pools + ring ownership
        ConsistentHashRing.Snapshot ring = shardManager.ringSnapshot();
        Map<String, Double> shares = ring.ownershipShares();
        registry.find("shard.pool.utilization").gauges().forEach(gauge -> {
            String partition = gauge.getId().getTag("partition");
            sb.append(String.format("pool[%s] utilization=%.2f ringShare=%.3f\n",
                    partition, gauge.value(), shares.getOrDefault(partition, 0.0)));
        });

        // Route failures
        registry.find("shard.route").counters().forEach(counter -> {
            if (counter.count() > 0 && !"ACQUIRED".equals(counter.getId().getTag("status"))) {
                sb.append(String.format("shard.route[%s] = %d\n",
                        counter.getId().getTags(), (long) counter.count()));
            }
        });

        // Backend errors
        registry.find("storage.backend.errors").counters().forEach(counter -> {
            if (counter.count() > 0) {
                sb.append(String.format("storage.backend.errors[%s] = %d\n",
                        counter.getId().getTags(), (long) counter.count()));
            }
        });

        // Ranking latency
        registry.find("feed.rank.latency").timers().forEach(timer -> {
            if (timer.count() > 0) {
                sb.append(String.format("feed.rank.latency[%s] count=%d mean=%.2fms max=%.2fms\n",
                        timer.getId().getTags(),
                        timer.count(),
                        timer.mean(TimeUnit.MILLISECONDS),
                        timer.max(TimeUnit.MILLISECONDS)));
            }
        });

        registry.find("feed.partial").counters().forEach(counter ->
                sb.append(String.format("feed.partial = %d\n", (long) counter.count())));

        sb.append("====================================");
        return sb.toString();
    }
}
