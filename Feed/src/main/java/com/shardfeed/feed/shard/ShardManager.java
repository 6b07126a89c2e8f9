package com.shardfeed.feed.shard;

import com.shardfeed.feed.core.exception.ConfigurationException;
import com.shardfeed.feed.metrics.MetricsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Hash Ring + 파티션별 커넥션 풀 조합
 *
 * 아키텍처:
 * - key → ConsistentHashRing → partitionId → PartitionConnectionPool.acquire()
 * - RoutingTable(링 스냅샷 + 파티션 맵)을 volatile로 교체 (copy-on-write)
 * - addShard/removeShard는 mutationLock으로 직렬화
 * - routeAndAcquire는 RoutingTable 하나만 읽으므로 변경 중에도 일관된 상태를 봄
 *
 * 락은 acquire/release 구간에만 잡힘, 백엔드 I/O 동안에는 잡지 않음
 */
public final class ShardManager implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ShardManager.class);

    private final ConsistentHashRing ring;
    private final MetricsCollector metrics;
    private final Object mutationLock = new Object();
    private volatile RoutingTable table;

    public ShardManager(int virtualNodes, MetricsCollector metrics) {
        this.ring = new ConsistentHashRing(virtualNodes);
        this.metrics = metrics;
        this.table = new RoutingTable(ring.snapshot(), Map.of());
    }

    /**
     * key 라우팅 + 커넥션 대여
     *
     * @param key 샤딩 키 (e.g. 소유 userId)
     * @return ACQUIRED(lease) 또는 NO_PARTITION / INACTIVE / EXHAUSTED
     */
    public RouteResult routeAndAcquire(String key) {
        RoutingTable current = table;

        Optional<String> target = current.ring().lookup(key);
        if (target.isEmpty()) {
            metrics.recordRoute("none", RouteStatus.NO_PARTITION);
            return RouteResult.unavailable(RouteStatus.NO_PARTITION, null);
        }

        String partitionId = target.get();
        Partition partition = current.partitions().get(partitionId);
        if (partition == null) {
            // 링과 맵은 같은 스냅샷에서 오므로 발생하면 안 됨
            throw new IllegalStateException("Ring references unknown partition: " + partitionId);
        }

        RouteResult result = acquireFrom(partition);
        metrics.recordRoute(partitionId, result.status());
        return result;
    }

    /**
     * 비활성이거나 풀이 닫혔으면 INACTIVE
     *
     * 스냅샷을 읽은 뒤 removeShard가 풀을 닫을 수 있으므로 빈 acquire는 closed 여부로 구분
     */
    static RouteResult acquireFrom(Partition partition) {
        String partitionId = partition.getPartitionId();
        if (!partition.isActive()) {
            return RouteResult.unavailable(RouteStatus.INACTIVE, partitionId);
        }

        PartitionConnectionPool pool = partition.getPool();
        return pool.acquire()
                .map(handle -> RouteResult.acquired(new Lease(partitionId, handle)))
                .orElseGet(() -> RouteResult.unavailable(
                        pool.isClosed() ? RouteStatus.INACTIVE : RouteStatus.EXHAUSTED, partitionId));
    }

    /**
     * 라우팅만 수행 (커넥션 대여 없음, 진단용)
     */
    public Optional<String> route(String key) {
        return table.ring().lookup(key);
    }

    public void release(Lease lease) {
        release(lease.partitionId(), lease.handle());
    }

    /**
     * 커넥션 반납 (해당 파티션 풀로 전달)
     *
     * 알 수 없는 파티션(이미 제거됨)은 no-op + WARN
     */
    public void release(String partitionId, ConnectionHandle handle) {
        Partition partition = table.partitions().get(partitionId);
        if (partition == null) {
            log.warn("Release for unknown partition ignored: partition={} handle={}", partitionId, handle);
            return;
        }
        partition.getPool().release(handle);
    }

    /**
     * 샤드 추가: 풀 생성 → 링에 가상 노드 삽입 → RoutingTable 교체
     */
    public void addShard(ShardDescriptor descriptor) {
        synchronized (mutationLock) {
            String partitionId = descriptor.partitionId();
            if (table.partitions().containsKey(partitionId)) {
                throw new ConfigurationException("Shard already exists: " + partitionId,
                                                 ConfigurationException.DUPLICATE_SHARD);
            }

            Partition partition = new Partition(descriptor);
            ring.addPartition(partitionId);

            Map<String, Partition> partitions = new LinkedHashMap<>(table.partitions());
            partitions.put(partitionId, partition);
            table = new RoutingTable(ring.snapshot(), partitions);

            metrics.bindPool(partition.getPool());
            log.info("Shard added: partition={} region={} poolCapacity={} active={}",
                     partitionId, descriptor.region(), descriptor.poolCapacity(), descriptor.active());
        }
    }

    /**
     * 샤드 제거: 링에서 제거 → RoutingTable 교체 → 풀 종료
     *
     * 데이터 마이그레이션 완료 확인은 운영 절차 (여기서 강제하지 않음)
     *
     * @return false if the shard did not exist
     */
    public boolean removeShard(String partitionId) {
        Partition removed;
        synchronized (mutationLock) {
            if (!table.partitions().containsKey(partitionId)) {
                return false;
            }

            ring.removePartition(partitionId);

            Map<String, Partition> partitions = new LinkedHashMap<>(table.partitions());
            removed = partitions.remove(partitionId);
            table = new RoutingTable(ring.snapshot(), partitions);
        }

        removed.getPool().close();
        metrics.unbindPool(partitionId);
        log.info("Shard removed: partition={} region={}", partitionId, removed.getRegion());
        return true;
    }

    /**
     * 파티션 활성/비활성 (제거 전 drain 용도)
     *
     * @return false if the shard does not exist
     */
    public boolean setActive(String partitionId, boolean active) {
        Partition partition = table.partitions().get(partitionId);
        if (partition == null) {
            return false;
        }
        partition.setActive(active);
        log.info("Shard {}: partition={}", active ? "activated" : "deactivated", partitionId);
        return true;
    }

    public Set<String> partitionIds() {
        return table.partitions().keySet();
    }

    public Optional<Partition> partition(String partitionId) {
        return Optional.ofNullable(table.partitions().get(partitionId));
    }

    public Collection<Partition> partitions() {
        return table.partitions().values();
    }

    public List<ShardDescriptor> descriptors() {
        List<ShardDescriptor> result = new ArrayList<>();
        for (Partition partition : table.partitions().values()) {
            result.add(partition.getDescriptor());
        }
        return result;
    }

    public ConsistentHashRing.Snapshot ringSnapshot() {
        return table.ring();
    }

    @PreDestroy
    @Override
    public void close() {
        List<String> ids;
        synchronized (mutationLock) {
            ids = new ArrayList<>(table.partitions().keySet());
        }
        for (String partitionId : ids) {
            removeShard(partitionId);
        }
        log.info("ShardManager closed: {} shards removed", ids.size());
    }

    /**
     * 링 스냅샷 + 파티션 맵 (불변 쌍)
     */
    private record RoutingTable(ConsistentHashRing.Snapshot ring, Map<String, Partition> partitions) {
        RoutingTable {
            partitions = Collections.unmodifiableMap(partitions);
        }
    }
}
