package com.shardfeed.feed.shard;

public enum RouteStatus {
    ACQUIRED,       // 커넥션 대여 성공
    NO_PARTITION,   // 링이 비어있음
    INACTIVE,       // 파티션 비활성 (drain 중 또는 제거됨)
    EXHAUSTED;      // 풀 고갈

    public boolean isRetryable() {
        return this == EXHAUSTED || this == INACTIVE;
    }
}
