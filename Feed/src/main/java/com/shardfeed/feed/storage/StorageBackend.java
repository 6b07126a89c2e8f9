package com.shardfeed.feed.storage;

import com.shardfeed.feed.core.exception.BackendException;
import com.shardfeed.feed.shard.ConnectionHandle;

/**
 * 파티션 스토리지 백엔드 (외부 협력자)
 *
 * - 대여한 커넥션 핸들로만 접근
 * - 와이어 포맷은 정의하지 않음 (opaque bytes)
 * - 구현체는 호출자 타임아웃으로 취소 가능해야 함
 */
public interface StorageBackend {

    /**
     * @return stored bytes, or null if the key is absent
     * @throws BackendException on read failure
     */
    byte[] read(ConnectionHandle handle, String key);

    /**
     * @throws BackendException on write failure
     */
    void write(ConnectionHandle handle, String key, byte[] value);
}
