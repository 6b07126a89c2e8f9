package com.shardfeed.feed.scheduler;

import com.shardfeed.feed.alert.Alert;
import com.shardfeed.feed.alert.AlertDispatcher;
import com.shardfeed.feed.alert.Severity;
import com.shardfeed.feed.shard.Partition;
import com.shardfeed.feed.shard.PartitionConnectionPool;
import com.shardfeed.feed.shard.ShardManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 파티션 풀 상태 점검
 *
 * - utilization >= threshold → WARNING
 * - 비활성 파티션 → WARNING
 * - 상태가 바뀔 때만 알림 (정상 복귀 시 INFO)
 *
 * 측정된 utilization만 사용한다. 자동 scale-out 판단은 하지 않음.
 */
public final class PoolHealthCheck implements PeriodicTask {
    private static final Logger log = LoggerFactory.getLogger(PoolHealthCheck.class);

    private final ShardManager shardManager;
    private final AlertDispatcher dispatcher;
    private final double utilizationThreshold;
    private final Clock clock;

    // 알림이 나간 상태 (partition id)
    private final Set<String> saturated = new HashSet<>();
    private final Set<String> inactive = new HashSet<>();

    public PoolHealthCheck(ShardManager shardManager,
                           AlertDispatcher dispatcher,
                           double utilizationThreshold,
                           Clock clock) {
        this.shardManager = shardManager;
        this.dispatcher = dispatcher;
        this.utilizationThreshold = utilizationThreshold;
        this.clock = clock;
    }

    @Override
    public String name() {
        return "pool-health";
    }

    @Override
    public void onTick() {
        for (Alert alert : check()) {
            dispatcher.dispatch(alert);
        }
    }

    /**
     * 현재 상태를 점검하고 새로 발생한(또는 해소된) 알림만 반환
     */
    public synchronized List<Alert> check() {
        List<Alert> alerts = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        for (Partition partition : shardManager.partitions()) {
            String id = partition.getPartitionId();
            PartitionConnectionPool pool = partition.getPool();
            seen.add(id);

            double utilization = pool.utilization();
            log.debug("Pool health: partition={} active={} utilization={}", id, pool.active(), utilization);

            if (utilization >= utilizationThreshold) {
                if (saturated.add(id)) {
                    alerts.add(alert(Severity.WARNING, id, String.format(
                        "pool utilization %.2f >= %.2f (active=%d, capacity=%d)",
                        utilization, utilizationThreshold, pool.active(), pool.capacity())));
                }
            } else if (saturated.remove(id)) {
                alerts.add(alert(Severity.INFO, id, String.format(
                    "pool utilization recovered to %.2f", utilization)));
            }

            if (!partition.isActive()) {
                if (inactive.add(id)) {
                    alerts.add(alert(Severity.WARNING, id, "partition is inactive"));
                }
            } else if (inactive.remove(id)) {
                alerts.add(alert(Severity.INFO, id, "partition is active again"));
            }
        }

        // 제거된 파티션 상태는 잊음
        saturated.retainAll(seen);
        inactive.retainAll(seen);
        return alerts;
    }

    private Alert alert(Severity severity, String partitionId, String message) {
        return new Alert(severity, "pool-health:" + partitionId, message, clock.instant());
    }

    public double getUtilizationThreshold() {
        return utilizationThreshold;
    }
}
