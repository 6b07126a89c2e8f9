package com.shardfeed.feed.shard;

import com.shardfeed.feed.core.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Consistent Hash 링 (partitionId 기반)
 *
 * - 파티션당 가상 노드 V개: 위치 = H(id + ":" + i)
 * - 해시: FNV-1a 32bit + murmur3 fmix32 (unsigned, 0 ~ 2^32-1)
 * - lookup: H(key) 이상인 첫 위치, 없으면 가장 작은 위치로 wrap
 *
 * 동시성: copy-on-write
 * - add/remove는 mutationLock으로 직렬화, 새 불변 Snapshot을 volatile로 publish
 * - lookup은 Snapshot 하나만 읽음 → 변경 전/후 중 하나만 보임
 *
 * 가상 노드 위치 충돌 시 partitionId가 작은 쪽이 점유
 * - remove는 남은 파티션으로 위치를 다시 계산 → 링은 파티션 집합만으로 결정됨 (추가 순서 무관)
 */
public final class ConsistentHashRing {
    private static final Logger log = LoggerFactory.getLogger(ConsistentHashRing.class);

    public static final int DEFAULT_VIRTUAL_NODES = 128;
    static final long RING_SIZE = 1L << 32;

    private final int virtualNodes;
    private final Object mutationLock = new Object();
    private volatile Snapshot snapshot = Snapshot.EMPTY;

    public ConsistentHashRing() {
        this(DEFAULT_VIRTUAL_NODES);
    }

    public ConsistentHashRing(int virtualNodes) {
        this.virtualNodes = ConfigurationException.requirePositive("virtual-nodes", virtualNodes);
    }

    /**
     * 파티션 추가 (가상 노드 V개 삽입)
     *
     * @return false if partition already on the ring
     */
    public boolean addPartition(String partitionId) {
        requireId(partitionId);

        synchronized (mutationLock) {
            Snapshot current = snapshot;
            if (current.partitions().contains(partitionId)) {
                return false;
            }

            TreeMap<Long, String> positions = new TreeMap<>(current.positions());
            int collisions = place(positions, partitionId);

            Set<String> partitions = new TreeSet<>(current.partitions());
            partitions.add(partitionId);
            snapshot = new Snapshot(positions, partitions);

            if (collisions > 0) {
                log.warn("Virtual node collisions on add: partition={} collisions={}", partitionId, collisions);
            }
            log.info("Partition added to ring: partition={} vnodes={} totalVnodes={}",
                     partitionId, virtualNodes, positions.size());
            return true;
        }
    }

    /**
     * 파티션 제거 (해당 id의 가상 노드 전부 제거)
     *
     * @return false if partition was not on the ring
     */
    public boolean removePartition(String partitionId) {
        requireId(partitionId);

        synchronized (mutationLock) {
            Snapshot current = snapshot;
            if (!current.partitions().contains(partitionId)) {
                return false;
            }

            Set<String> partitions = new TreeSet<>(current.partitions());
            partitions.remove(partitionId);

            // 충돌로 가려져 있던 다른 파티션의 위치가 되살아나도록 전체 재계산
            TreeMap<Long, String> positions = new TreeMap<>();
            for (String remaining : partitions) {
                place(positions, remaining);
            }
            snapshot = new Snapshot(positions, partitions);

            log.info("Partition removed from ring: partition={} totalVnodes={}", partitionId, positions.size());
            return true;
        }
    }

    /**
     * key → partitionId
     *
     * @return empty only when the ring has no partitions
     */
    public Optional<String> lookup(String key) {
        return snapshot.lookup(key);
    }

    /**
     * 현재 링 상태 (불변)
     */
    public Snapshot snapshot() {
        return snapshot;
    }

    public boolean contains(String partitionId) {
        return snapshot.partitions().contains(partitionId);
    }

    public Set<String> partitions() {
        return snapshot.partitions();
    }

    public int getVirtualNodesPerPartition() {
        return virtualNodes;
    }

    /**
     * 전체 가상 노드 개수 (디버깅용)
     */
    public int getVirtualNodeCount() {
        return snapshot.positions().size();
    }

    /**
     * 파티션의 가상 노드 V개 배치
     *
     * @return 다른 파티션과 위치가 겹친 가상 노드 수
     */
    private int place(TreeMap<Long, String> positions, String partitionId) {
        int collisions = 0;
        for (int i = 0; i < virtualNodes; i++) {
            long position = hash(partitionId + ":" + i);
            String previous = positions.get(position);
            if (previous != null && !previous.equals(partitionId)) {
                collisions++;
            }
            positions.merge(position, partitionId,
                    (existing, added) -> existing.compareTo(added) <= 0 ? existing : added);
        }
        return collisions;
    }

    /**
     * FNV-1a 32bit + fmix32
     *
     * - FNV-1a만으로는 "p1:0", "p1:1" 같은 접미사 변화가 상위 비트로 잘 퍼지지 않음
     * - fmix32로 avalanche 보강
     *
     * @param key 해시할 문자열
     * @return unsigned 32bit 값 (long)
     */
    static long hash(String key) {
        final int FNV_PRIME = 0x01000193;
        final int FNV_OFFSET = 0x811C9DC5;

        byte[] data = key.getBytes(StandardCharsets.UTF_8);
        int hash = FNV_OFFSET;

        for (byte b : data) {
            hash ^= (b & 0xFF);
            hash *= FNV_PRIME;
        }

        hash ^= hash >>> 16;
        hash *= 0x85EBCA6B;
        hash ^= hash >>> 13;
        hash *= 0xC2B2AE35;
        hash ^= hash >>> 16;

        return hash & 0xFFFFFFFFL;
    }

    private static void requireId(String partitionId) {
        if (partitionId == null || partitionId.isEmpty()) {
            throw new ConfigurationException("partitionId must not be empty");
        }
    }

    /**
     * 링 스냅샷 (불변)
     *
     * @param positions 가상 노드 위치 → partitionId
     * @param partitions 링에 올라간 파티션 id
     */
    public record Snapshot(NavigableMap<Long, String> positions, Set<String> partitions) {
        static final Snapshot EMPTY = new Snapshot(new TreeMap<>(), Set.of());

        public Snapshot {
            positions = Collections.unmodifiableNavigableMap(positions);
            partitions = Collections.unmodifiableSet(partitions);
        }

        public Optional<String> lookup(String key) {
            if (key == null) {
                throw new NullPointerException("key");
            }
            if (positions.isEmpty()) {
                return Optional.empty();
            }

            Map.Entry<Long, String> entry = positions.ceilingEntry(hash(key));

            // 링 끝까지 갔으면 처음으로
            if (entry == null) {
                entry = positions.firstEntry();
            }
            return Optional.of(entry.getValue());
        }

        public boolean isEmpty() {
            return positions.isEmpty();
        }

        /**
         * 파티션별 링 점유 비율 (0.0 ~ 1.0)
         *
         * 위치 p의 구간 = (이전 위치, p], 첫 위치는 마지막 위치에서 wrap
         */
        public Map<String, Double> ownershipShares() {
            Map<String, Double> shares = new LinkedHashMap<>();
            if (positions.isEmpty()) {
                return shares;
            }

            long previous = positions.lastKey() - RING_SIZE;
            for (Map.Entry<Long, String> entry : positions.entrySet()) {
                long arc = entry.getKey() - previous;
                shares.merge(entry.getValue(), (double) arc / RING_SIZE, Double::sum);
                previous = entry.getKey();
            }
            return shares;
        }
    }
}
