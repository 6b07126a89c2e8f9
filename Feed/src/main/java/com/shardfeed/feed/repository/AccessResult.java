package com.shardfeed.feed.repository;

import com.shardfeed.feed.shard.RouteStatus;

/**
 * DataAccessLayer 결과 (예외 대신 typed result)
 *
 * @param status 결과 코드
 * @param value OK일 때만 non-null (write는 항상 null)
 * @param partitionId 접근한 파티션 (캐시 hit 또는 라우팅 실패 시 null 가능)
 * @param routeStatus UNAVAILABLE일 때 원인
 * @param detail 실패 메시지
 */
public record AccessResult<T>(
    AccessStatus status,
    T value,
    String partitionId,
    RouteStatus routeStatus,
    String detail
) {
    public static <T> AccessResult<T> ok(T value, String partitionId) {
        return new AccessResult<>(AccessStatus.OK, value, partitionId, null, null);
    }

    public static <T> AccessResult<T> notFound(String partitionId) {
        return new AccessResult<>(AccessStatus.NOT_FOUND, null, partitionId, null, null);
    }

    public static <T> AccessResult<T> unavailable(RouteStatus routeStatus, String partitionId) {
        return new AccessResult<>(AccessStatus.UNAVAILABLE, null, partitionId, routeStatus,
                                  "route failed: " + routeStatus);
    }

    public static <T> AccessResult<T> backendError(String partitionId, String detail) {
        return new AccessResult<>(AccessStatus.BACKEND_ERROR, null, partitionId, null, detail);
    }

    public boolean isSuccess() {
        return status.isSuccess();
    }
}
