package com.shardfeed.feed.repository;

import com.shardfeed.feed.cache.CacheStats;
import com.shardfeed.feed.cache.LruCache;
import com.shardfeed.feed.core.exception.BackendException;
import com.shardfeed.feed.metrics.MetricsCollector;
import com.shardfeed.feed.shard.Lease;
import com.shardfeed.feed.shard.RouteResult;
import com.shardfeed.feed.shard.ShardManager;
import com.shardfeed.feed.storage.StorageBackend;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 샤딩된 key-value 접근 계층 (read-through + write-invalidate)
 *
 * readThrough:
 * 1. 로컬 LRU 캐시 확인 → hit이면 즉시 반환
 * 2. miss → ShardManager.routeAndAcquire(shardKey)
 * 3. 락 없이 백엔드 read → 캐시 적재 → 커넥션 반납
 *
 * write:
 * - 백엔드 write 후 캐시 무효화 (실패해도 무효화, 절대 갱신하지 않음)
 *
 * NOT_FOUND / BACKEND_ERROR는 캐시하지 않는다.
 */
public final class DataAccessLayer {
    private static final Logger log = LoggerFactory.getLogger(DataAccessLayer.class);

    private static final String OP_READ = "read";
    private static final String OP_WRITE = "write";

    private final ShardManager shardManager;
    private final StorageBackend backend;
    private final LruCache<String, byte[]> cache;
    private final MetricsCollector metrics;

    // read 도중 write가 끝나면 오래된 값을 적재하지 않기 위한 write 시퀀스
    private final ReentrantLock populateLock = new ReentrantLock();
    private long writeSequence;

    public DataAccessLayer(ShardManager shardManager,
                           StorageBackend backend,
                           LruCache<String, byte[]> cache,
                           MetricsCollector metrics) {
        this.shardManager = shardManager;
        this.backend = backend;
        this.cache = cache;
        this.metrics = metrics;
    }

    public AccessResult<byte[]> readThrough(String key) {
        return readThrough(key, key);
    }

    /**
     * @param shardKey 라우팅 키 (같은 shardKey의 레코드는 같은 파티션)
     * @param key 레코드 키
     */
    public AccessResult<byte[]> readThrough(String shardKey, String key) {
        Objects.requireNonNull(shardKey, "shardKey");
        Objects.requireNonNull(key, "key");
        String recordKey = recordKey(shardKey, key);

        byte[] cached = cache.get(recordKey);
        if (cached != null) {
            metrics.recordAccess(OP_READ, AccessStatus.OK);
            return AccessResult.ok(cached.clone(), null);
        }

        long observedSequence = currentWriteSequence();

        RouteResult route = shardManager.routeAndAcquire(shardKey);
        if (!route.isAcquired()) {
            log.debug("Read unavailable: key={} partition={} status={}",
                      recordKey, route.partitionId(), route.status());
            return record(OP_READ, AccessResult.unavailable(route.status(), route.partitionId()));
        }

        Lease lease = route.lease();
        String partitionId = lease.partitionId();
        Timer.Sample sample = metrics.startTimer();
        byte[] value;
        try {
            value = backend.read(lease.handle(), recordKey);
        } catch (BackendException e) {
            log.error("Backend read failed: key={} partition={} code={}",
                      recordKey, partitionId, e.getErrorCode(), e);
            metrics.recordBackendError(OP_READ, partitionId, e.getClass().getSimpleName());
            return record(OP_READ, AccessResult.backendError(partitionId, e.getMessage()));
        } finally {
            metrics.recordBackendLatency(sample, OP_READ, partitionId);
            shardManager.release(lease);
        }

        if (value == null) {
            return record(OP_READ, AccessResult.notFound(partitionId));
        }

        populate(recordKey, value, observedSequence);
        return record(OP_READ, AccessResult.ok(value, partitionId));
    }

    public AccessResult<Void> write(String key, byte[] value) {
        return write(key, key, value);
    }

    /**
     * 백엔드 write + 캐시 무효화
     */
    public AccessResult<Void> write(String shardKey, String key, byte[] value) {
        Objects.requireNonNull(shardKey, "shardKey");
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        String recordKey = recordKey(shardKey, key);

        RouteResult route = shardManager.routeAndAcquire(shardKey);
        if (!route.isAcquired()) {
            log.debug("Write unavailable: key={} partition={} status={}",
                      recordKey, route.partitionId(), route.status());
            return record(OP_WRITE, AccessResult.unavailable(route.status(), route.partitionId()));
        }

        Lease lease = route.lease();
        String partitionId = lease.partitionId();
        Timer.Sample sample = metrics.startTimer();
        try {
            backend.write(lease.handle(), recordKey, value.clone());
            return record(OP_WRITE, AccessResult.ok(null, partitionId));
        } catch (BackendException e) {
            log.error("Backend write failed: key={} partition={} code={}",
                      recordKey, partitionId, e.getErrorCode(), e);
            metrics.recordBackendError(OP_WRITE, partitionId, e.getClass().getSimpleName());
            return record(OP_WRITE, AccessResult.backendError(partitionId, e.getMessage()));
        } finally {
            metrics.recordBackendLatency(sample, OP_WRITE, partitionId);
            shardManager.release(lease);
            invalidateInternal(recordKey);
        }
    }

    /**
     * 캐시 엔트리 명시적 무효화
     */
    public boolean invalidate(String shardKey, String key) {
        return invalidateInternal(recordKey(shardKey, key));
    }

    public CacheStats cacheStats() {
        return cache.stats();
    }

    private boolean invalidateInternal(String recordKey) {
        populateLock.lock();
        try {
            writeSequence++;
            return cache.invalidate(recordKey);
        } finally {
            populateLock.unlock();
        }
    }

    private void populate(String recordKey, byte[] value, long observedSequence) {
        populateLock.lock();
        try {
            if (writeSequence == observedSequence) {
                cache.put(recordKey, value.clone());
            }
        } finally {
            populateLock.unlock();
        }
    }

    private long currentWriteSequence() {
        populateLock.lock();
        try {
            return writeSequence;
        } finally {
            populateLock.unlock();
        }
    }

    private <T> AccessResult<T> record(String operation, AccessResult<T> result) {
        metrics.recordAccess(operation, result.status());
        return result;
    }

    /**
     * shardKey와 key가 같으면 key, 다르면 "shardKey|key"
     *
     * 각 부분의 '\'와 '|' 앞에 '\'를 붙임 → 단일 키 "a|b"와 (a, b) 쌍은 다른 키
     */
    static String recordKey(String shardKey, String key) {
        String escapedShardKey = escape(shardKey);
        return shardKey.equals(key) ? escapedShardKey : escapedShardKey + "|" + escape(key);
    }

    private static String escape(String part) {
        if (part.indexOf('|') < 0 && part.indexOf('\\') < 0) {
            return part;
        }
        return part.replace("\\", "\\\\").replace("|", "\\|");
    }
}
