package com.shardfeed.feed.shard;

import com.shardfeed.feed.core.exception.ConfigurationException;
import com.shardfeed.feed.metrics.MetricsCollector;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("샤드 매니저")
class ShardManagerTest {

    private SimpleMeterRegistry registry;
    private ShardManager shardManager;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        shardManager = new ShardManager(64, new MetricsCollector(registry));
    }

    @AfterEach
    void tearDown() {
        shardManager.close();
    }

    @Test
    @DisplayName("파티션이 없으면 NO_PARTITION")
    void testNoPartition() {
        RouteResult result = shardManager.routeAndAcquire("user-1");

        assertEquals(RouteStatus.NO_PARTITION, result.status());
        assertNull(result.lease());
        assertNull(result.partitionId());
    }

    @Test
    @DisplayName("라우팅 + 대여 + 반납")
    void testRouteAcquireRelease() {
        shardManager.addShard(ShardDescriptor.of("p1", "kr-1", 2));
        shardManager.addShard(ShardDescriptor.of("p2", "kr-2", 2));

        RouteResult result = shardManager.routeAndAcquire("user-42");

        assertTrue(result.isAcquired());
        assertEquals(shardManager.route("user-42").orElseThrow(), result.partitionId());
        PartitionConnectionPool pool = shardManager.partition(result.partitionId()).orElseThrow().getPool();
        assertEquals(1, pool.active());

        shardManager.release(result.lease());
        assertEquals(0, pool.active());
    }

    @Test
    @DisplayName("풀 고갈 시 EXHAUSTED, 반납 후 다시 ACQUIRED")
    void testExhausted() {
        shardManager.addShard(ShardDescriptor.of("p1", "kr-1", 1));

        RouteResult first = shardManager.routeAndAcquire("k");
        RouteResult second = shardManager.routeAndAcquire("k");

        assertTrue(first.isAcquired());
        assertEquals(RouteStatus.EXHAUSTED, second.status());
        assertEquals("p1", second.partitionId());
        assertTrue(second.status().isRetryable());

        shardManager.release(first.lease());
        assertTrue(shardManager.routeAndAcquire("k").isAcquired());
    }

    @Test
    @DisplayName("비활성 파티션은 INACTIVE")
    void testInactive() {
        shardManager.addShard(new ShardDescriptor("p1", "kr-1", false, 2));

        assertEquals(RouteStatus.INACTIVE, shardManager.routeAndAcquire("k").status());

        assertTrue(shardManager.setActive("p1", true));
        assertTrue(shardManager.routeAndAcquire("k").isAcquired());
        assertFalse(shardManager.setActive("missing", true));
    }

    @Test
    @DisplayName("라우팅 후 풀이 닫히면 EXHAUSTED가 아니라 INACTIVE")
    void testClosedPoolAfterRoutingIsInactive() {
        shardManager.addShard(ShardDescriptor.of("p1", "kr-1", 2));
        Partition routed = shardManager.partition("p1").orElseThrow();

        // 라우팅 스냅샷을 읽은 직후 샤드가 제거된 상황
        assertTrue(shardManager.removeShard("p1"));
        RouteResult result = ShardManager.acquireFrom(routed);

        assertEquals(RouteStatus.INACTIVE, result.status());
        assertEquals("p1", result.partitionId());
        assertNull(result.lease());
    }

    @Test
    @DisplayName("동시 샤드 추가/제거 중에도 라우팅은 변경 전 또는 후 링만 봄")
    void testConcurrentRoutingDuringResharding() throws Exception {
        shardManager.close();
        shardManager = new ShardManager(100, new MetricsCollector(registry));
        shardManager.addShard(ShardDescriptor.of("p1", "kr-1", 8));
        shardManager.addShard(ShardDescriptor.of("p2", "kr-2", 8));

        Map<String, String> withoutP3 = owners(Set.of("p1", "p2"));
        Map<String, String> withP3 = owners(Set.of("p1", "p2", "p3"));

        int routers = 6;
        ExecutorService executor = Executors.newFixedThreadPool(routers + 1);
        CountDownLatch start = new CountDownLatch(1);
        AtomicBoolean resharding = new AtomicBoolean(true);

        try {
            Future<?> mutator = executor.submit(() -> {
                start.await();
                try {
                    for (int i = 0; i < 300; i++) {
                        shardManager.addShard(ShardDescriptor.of("p3", "kr-3", 4));
                        shardManager.removeShard("p3");
                    }
                } finally {
                    resharding.set(false);
                }
                return null;
            });

            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < routers; t++) {
                int seed = t;
                futures.add(executor.submit(() -> {
                    start.await();
                    int i = seed;
                    while (resharding.get() || i < 2_000) {
                        String key = "user-" + (i++ % 200);
                        RouteResult result = shardManager.routeAndAcquire(key);
                        assertNotEquals(RouteStatus.NO_PARTITION, result.status());
                        if (result.isAcquired()) {
                            String partitionId = result.partitionId();
                            assertTrue(partitionId.equals(withoutP3.get(key)) || partitionId.equals(withP3.get(key)),
                                       key + " routed to " + partitionId);
                            shardManager.release(result.lease());
                        }
                    }
                    return null;
                }));
            }

            start.countDown();
            mutator.get(30, TimeUnit.SECONDS);
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(List.of("p1", "p2"), new ArrayList<>(shardManager.partitionIds()));
        shardManager.partitions().forEach(p -> assertEquals(0, p.getPool().active(), p.getPartitionId()));
    }

    @Test
    @DisplayName("중복 샤드 추가는 ConfigurationException")
    void testDuplicateShard() {
        shardManager.addShard(ShardDescriptor.of("p1", "kr-1", 2));

        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> shardManager.addShard(ShardDescriptor.of("p1", "kr-2", 4)));
        assertEquals(ConfigurationException.DUPLICATE_SHARD, e.getErrorCode());
    }

    @Test
    @DisplayName("샤드 제거 후 키는 남은 파티션으로, 늦게 온 반납은 no-op")
    void testRemoveShard() {
        shardManager.addShard(ShardDescriptor.of("p1", "kr-1", 2));
        shardManager.addShard(ShardDescriptor.of("p2", "kr-2", 2));

        String key = findKeyOwnedBy("p2");
        RouteResult lease = shardManager.routeAndAcquire(key);
        assertEquals("p2", lease.partitionId());

        assertTrue(shardManager.removeShard("p2"));
        assertFalse(shardManager.removeShard("p2"));

        assertEquals(Optional.of("p1"), shardManager.route(key));
        assertEquals("p1", shardManager.routeAndAcquire(key).partitionId());

        // 제거된 파티션의 lease 반납은 예외 없이 무시
        assertDoesNotThrow(() -> shardManager.release(lease.lease()));
        assertEquals(List.of("p1"), new ArrayList<>(shardManager.partitionIds()));
    }

    @Test
    @DisplayName("풀 gauge 등록/해제")
    void testPoolMetrics() {
        shardManager.addShard(ShardDescriptor.of("p1", "kr-1", 4));
        shardManager.routeAndAcquire("k");

        assertEquals(0.25, registry.get("shard.pool.utilization").tag("partition", "p1").gauge().value(), 1e-9);
        assertEquals(1.0, registry.get("shard.route").tag("status", "ACQUIRED").counter().count(), 1e-9);

        shardManager.removeShard("p1");
        assertNull(registry.find("shard.pool.utilization").tag("partition", "p1").gauge());
    }

    @Test
    @DisplayName("descriptors는 추가 순서 유지")
    void testDescriptors() {
        ShardDescriptor p1 = ShardDescriptor.of("p1", "kr-1", 2);
        ShardDescriptor p2 = new ShardDescriptor("p2", "kr-2", false, 3);
        shardManager.addShard(p1);
        shardManager.addShard(p2);

        assertEquals(List.of(p1, p2), shardManager.descriptors());
        assertEquals(2, shardManager.ringSnapshot().partitions().size());
    }

    private static Map<String, String> owners(Set<String> partitionIds) {
        ConsistentHashRing ring = new ConsistentHashRing(100);
        partitionIds.forEach(ring::addPartition);
        Map<String, String> result = new HashMap<>();
        for (int i = 0; i < 200; i++) {
            String key = "user-" + i;
            result.put(key, ring.lookup(key).orElseThrow());
        }
        return result;
    }

    private String findKeyOwnedBy(String partitionId) {
        for (int i = 0; i < 10_000; i++) {
            String key = "user-" + i;
            if (shardManager.route(key).orElseThrow().equals(partitionId)) {
                return key;
            }
        }
        throw new AssertionError("no key routed to " + partitionId);
    }
}
