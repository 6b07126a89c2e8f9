package com.shardfeed.feed.repository;

public enum AccessStatus {
    OK,
    NOT_FOUND,      // 백엔드에 키 없음 (캐시하지 않음)
    UNAVAILABLE,    // 라우팅 실패 (빈 링, 비활성 파티션, 풀 고갈)
    BACKEND_ERROR;  // 백엔드 read/write 실패 (캐시하지 않음)

    public boolean isSuccess() {
        return this == OK;
    }
}
