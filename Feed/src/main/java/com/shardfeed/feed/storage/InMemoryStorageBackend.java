package com.shardfeed.feed.storage;

import com.shardfeed.feed.core.exception.BackendException;
import com.shardfeed.feed.shard.ConnectionHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.inject.Singleton;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 파티션별 메모리 맵 백엔드 (로컬 실행/테스트용)
 *
 * - handle.partitionId()로 파티션 맵 선택
 * - failPartition()으로 장애 주입 (read/write 모두 BackendException)
 */
@Singleton
public final class InMemoryStorageBackend implements StorageBackend {
    private static final Logger log = LoggerFactory.getLogger(InMemoryStorageBackend.class);

    private final Map<String, Map<String, byte[]>> partitions = new ConcurrentHashMap<>();
    private final Set<String> failingPartitions = ConcurrentHashMap.newKeySet();

    @Override
    public byte[] read(ConnectionHandle handle, String key) {
        checkAvailable(handle, key, BackendException.READ_FAILED);

        byte[] value = partition(handle.partitionId()).get(key);
        return value == null ? null : value.clone();
    }

    @Override
    public void write(ConnectionHandle handle, String key, byte[] value) {
        checkAvailable(handle, key, BackendException.WRITE_FAILED);

        partition(handle.partitionId()).put(key, value.clone());
    }

    private void checkAvailable(ConnectionHandle handle, String key, int code) {
        if (failingPartitions.contains(handle.partitionId())) {
            throw new BackendException(
                String.format("Partition %s unavailable (key=%s)", handle.partitionId(), key), code);
        }
    }

    private Map<String, byte[]> partition(String partitionId) {
        return partitions.computeIfAbsent(partitionId, id -> new ConcurrentHashMap<>());
    }

    /**
     * 장애 주입
     */
    public void failPartition(String partitionId) {
        failingPartitions.add(partitionId);
        log.warn("Fault injected: partition={} now failing", partitionId);
    }

    public void healPartition(String partitionId) {
        if (failingPartitions.remove(partitionId)) {
            log.info("Fault cleared: partition={}", partitionId);
        }
    }

    /**
     * 파티션에 저장된 키 목록 (마이그레이션 확인용)
     */
    public Set<String> keysOn(String partitionId) {
        return new TreeSet<>(partition(partitionId).keySet());
    }

    public int keyCount(String partitionId) {
        return partition(partitionId).size();
    }
}
