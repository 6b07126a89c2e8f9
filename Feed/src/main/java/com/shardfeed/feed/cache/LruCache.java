package com.shardfeed.feed.cache;

import com.shardfeed.feed.core.exception.ConfigurationException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 고정 용량 LRU 캐시 (arena + index)
 *
 * 구조:
 * - 노드는 슬롯 배열(keys/values/prev/next)에 저장, 정수 인덱스로 참조
 * - index: key → slot (O(1) 조회)
 * - 이중 연결 리스트: head = MRU, tail = 다음 eviction 대상
 * - freeSlots: 비어있는 슬롯 스택
 *
 * 동시성: 단일 ReentrantLock (get도 recency를 바꾸므로 read lock 불가)
 * TTL 없음, 용량 초과 시에만 eviction
 */
public final class LruCache<K, V> {
    private static final int NIL = -1;

    private final String name;
    private final int capacity;
    private final Object[] keys;
    private final Object[] values;
    private final int[] prev;
    private final int[] next;
    private final int[] freeSlots;
    private final Map<K, Integer> index;
    private final ReentrantLock lock = new ReentrantLock();

    private int freeTop;
    private int head = NIL;
    private int tail = NIL;

    // 통계 (lock 안에서만 갱신)
    private long hits;
    private long misses;
    private long inserts;
    private long evictions;
    private long invalidations;

    public LruCache(String name, int capacity) {
        ConfigurationException.requirePositive("cache capacity (" + name + ")", capacity);

        this.name = name;
        this.capacity = capacity;
        this.keys = new Object[capacity];
        this.values = new Object[capacity];
        this.prev = new int[capacity];
        this.next = new int[capacity];
        this.freeSlots = new int[capacity];
        this.index = new HashMap<>(capacity * 2);

        // 슬롯 0이 먼저 나오도록 역순으로 push
        for (int i = 0; i < capacity; i++) {
            freeSlots[i] = capacity - 1 - i;
        }
        this.freeTop = capacity;
    }

    /**
     * 조회 (hit 시 MRU로 이동)
     *
     * @param key 캐시 키
     * @return value or null (캐시 미스 시)
     */
    @SuppressWarnings("unchecked")
    public V get(K key) {
        Objects.requireNonNull(key, "key");

        lock.lock();
        try {
            Integer slot = index.get(key);
            if (slot == null) {
                misses++;
                return null;
            }
            moveToHead(slot);
            hits++;
            return (V) values[slot];
        } finally {
            lock.unlock();
        }
    }

    /**
     * 삽입/갱신
     *
     * - 기존 키: 값 덮어쓰기 + MRU
     * - 신규 키 + 용량 초과: tail 1개 eviction 후 삽입
     */
    public void put(K key, V value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");

        lock.lock();
        try {
            Integer existing = index.get(key);
            if (existing != null) {
                values[existing] = value;
                moveToHead(existing);
                return;
            }

            if (index.size() == capacity) {
                evictTail();
            }

            int slot = freeSlots[--freeTop];
            keys[slot] = key;
            values[slot] = value;
            linkAtHead(slot);
            index.put(key, slot);
            inserts++;

            assertConsistent();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 명시적 무효화
     *
     * @return true if key was present
     */
    public boolean invalidate(K key) {
        Objects.requireNonNull(key, "key");

        lock.lock();
        try {
            Integer slot = index.remove(key);
            if (slot == null) {
                return false;
            }
            unlink(slot);
            releaseSlot(slot);
            invalidations++;
            return true;
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            while (head != NIL) {
                int slot = head;
                index.remove(keyAt(slot));
                unlink(slot);
                releaseSlot(slot);
            }
            assertConsistent();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return index.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    public String name() {
        return name;
    }

    /**
     * MRU → LRU 순서의 키 스냅샷 (모니터링/테스트용)
     */
    public List<K> keysByRecency() {
        lock.lock();
        try {
            List<K> result = new ArrayList<>(index.size());
            for (int slot = head; slot != NIL; slot = next[slot]) {
                result.add(keyAt(slot));
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    public CacheStats stats() {
        lock.lock();
        try {
            return new CacheStats(hits, misses, inserts, evictions, invalidations);
        } finally {
            lock.unlock();
        }
    }

    // ==================== 내부 (lock 보유 가정) ====================

    private void evictTail() {
        int slot = tail;
        if (slot == NIL) {
            throw new IllegalStateException("Cache '" + name + "' is full but recency list is empty");
        }
        index.remove(keyAt(slot));
        unlink(slot);
        releaseSlot(slot);
        evictions++;
    }

    private void moveToHead(int slot) {
        if (slot == head) {
            return;
        }
        unlink(slot);
        linkAtHead(slot);
    }

    private void linkAtHead(int slot) {
        prev[slot] = NIL;
        next[slot] = head;
        if (head != NIL) {
            prev[head] = slot;
        }
        head = slot;
        if (tail == NIL) {
            tail = slot;
        }
    }

    private void unlink(int slot) {
        int p = prev[slot];
        int n = next[slot];
        if (p != NIL) {
            next[p] = n;
        } else {
            head = n;
        }
        if (n != NIL) {
            prev[n] = p;
        } else {
            tail = p;
        }
        prev[slot] = NIL;
        next[slot] = NIL;
    }

    private void releaseSlot(int slot) {
        keys[slot] = null;
        values[slot] = null;
        freeSlots[freeTop++] = slot;
    }

    @SuppressWarnings("unchecked")
    private K keyAt(int slot) {
        return (K) keys[slot];
    }

    private void assertConsistent() {
        if (index.size() + freeTop != capacity) {
            throw new IllegalStateException(String.format(
                "Cache '%s' arena corrupted: entries=%d free=%d capacity=%d",
                name, index.size(), freeTop, capacity));
        }
    }

    @Override
    public String toString() {
        return String.format("LruCache{name=%s, size=%d, capacity=%d}", name, size(), capacity);
    }
}
