package com.shardfeed.feed.shard;

import com.shardfeed.feed.core.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 파티션별 고정 크기 커넥션 풀
 *
 * - acquire(): 비차단. 고갈 시 Optional.empty()
 * - release(): 대여 중이 아닌 핸들은 no-op + WARN 로그
 * - free 스택(LIFO) → acquire/release/acquire 시 같은 핸들 반환
 * - 불변식: |free| + |active| == capacity (위반 시 IllegalStateException)
 *
 * 대기(timeout) 정책은 호출자 책임. 대여한 핸들을 release하지 않으면 용량이 샌다.
 */
public final class PartitionConnectionPool implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PartitionConnectionPool.class);

    // 전역 풀 세대 카운터 (재추가된 파티션의 핸들 구분)
    private static final AtomicLong GENERATION_COUNTER = new AtomicLong(0);

    private final String partitionId;
    private final long generation;
    private final ConnectionHandle[] handles;
    private final boolean[] leased;
    private final Deque<Integer> free;
    private final ReentrantLock lock = new ReentrantLock();

    private int active;
    private boolean closed;
    private long misuseCount;

    public PartitionConnectionPool(String partitionId, int capacity) {
        ConfigurationException.requirePositive("pool capacity (" + partitionId + ")", capacity);

        this.partitionId = partitionId;
        this.generation = GENERATION_COUNTER.incrementAndGet();
        this.handles = new ConnectionHandle[capacity];
        this.leased = new boolean[capacity];
        this.free = new ArrayDeque<>(capacity);

        // slot 0이 스택 top에 오도록 역순 push
        for (int slot = capacity - 1; slot >= 0; slot--) {
            handles[slot] = new ConnectionHandle(partitionId, slot, generation);
            free.push(slot);
        }

        log.info("Connection pool initialized: partition={} capacity={} generation={}",
                 partitionId, capacity, generation);
    }

    /**
     * 핸들 대여
     *
     * @return handle, or empty if the pool is exhausted or closed
     */
    public Optional<ConnectionHandle> acquire() {
        lock.lock();
        try {
            if (closed || free.isEmpty()) {
                return Optional.empty();
            }
            int slot = free.pop();
            leased[slot] = true;
            active++;
            checkInvariant();
            return Optional.of(handles[slot]);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 핸들 반납
     *
     * @return true if the handle went back to the free set, false for misuse (no-op)
     */
    public boolean release(ConnectionHandle handle) {
        if (handle == null) {
            return false;
        }

        lock.lock();
        try {
            if (!ownsLease(handle)) {
                misuseCount++;
                log.warn("Ignoring release of handle not leased from pool: handle={} pool={} closed={}",
                         handle, partitionId, closed);
                return false;
            }
            leased[handle.slot()] = false;
            active--;
            free.push(handle.slot());
            checkInvariant();
            return true;
        } finally {
            lock.unlock();
        }
    }

    private boolean ownsLease(ConnectionHandle handle) {
        return !closed
                && handle.poolGeneration() == generation
                && partitionId.equals(handle.partitionId())
                && handle.slot() >= 0
                && handle.slot() < handles.length
                && leased[handle.slot()];
    }

    private void checkInvariant() {
        if (free.size() + active != handles.length) {
            throw new IllegalStateException(String.format(
                "Pool invariant violated: partition=%s free=%d active=%d capacity=%d",
                partitionId, free.size(), active, handles.length));
        }
    }

    public String getPartitionId() {
        return partitionId;
    }

    public int capacity() {
        return handles.length;
    }

    public int available() {
        lock.lock();
        try {
            return free.size();
        } finally {
            lock.unlock();
        }
    }

    public int active() {
        lock.lock();
        try {
            return active;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 사용률 (active / capacity)
     */
    public double utilization() {
        return (double) active() / handles.length;
    }

    public long misuseCount() {
        lock.lock();
        try {
            return misuseCount;
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 풀 종료: 이후 acquire는 empty, release는 no-op
     */
    @Override
    public void close() {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            if (active > 0) {
                log.warn("Pool closed with outstanding leases: partition={} active={}", partitionId, active);
            }
        } finally {
            lock.unlock();
        }
        log.info("Connection pool closed: partition={}", partitionId);
    }
}
