package com.shardfeed.feed.storage;

import com.shardfeed.feed.core.exception.BackendException;
import com.shardfeed.feed.shard.ConnectionHandle;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("메모리 스토리지 백엔드")
class InMemoryStorageBackendTest {

    private static final ConnectionHandle P1 = new ConnectionHandle("p1", 0, 1);
    private static final ConnectionHandle P2 = new ConnectionHandle("p2", 0, 1);

    @Test
    @DisplayName("파티션별로 분리 저장")
    void testPartitionsAreSeparate() {
        InMemoryStorageBackend backend = new InMemoryStorageBackend();
        backend.write(P1, "k", new byte[]{1});

        assertArrayEquals(new byte[]{1}, backend.read(P1, "k"));
        assertNull(backend.read(P2, "k"));
        assertEquals(Set.of("k"), backend.keysOn("p1"));
        assertEquals(0, backend.keyCount("p2"));
    }

    @Test
    @DisplayName("장애 주입 시 read/write 모두 BackendException")
    void testFaultInjection() {
        InMemoryStorageBackend backend = new InMemoryStorageBackend();
        backend.failPartition("p1");

        BackendException read = assertThrows(BackendException.class, () -> backend.read(P1, "k"));
        assertEquals(BackendException.READ_FAILED, read.getErrorCode());
        BackendException write = assertThrows(BackendException.class, () -> backend.write(P1, "k", new byte[0]));
        assertEquals(BackendException.WRITE_FAILED, write.getErrorCode());
        assertTrue(write.isRetryable());

        backend.healPartition("p1");
        assertNull(backend.read(P1, "k"));
    }
}
