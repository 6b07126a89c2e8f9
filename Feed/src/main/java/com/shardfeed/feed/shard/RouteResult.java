package com.shardfeed.feed.shard;

/**
 * routeAndAcquire 결과 (예외 대신 typed result)
 *
 * @param status 결과 코드
 * @param partitionId 라우팅된 파티션 (NO_PARTITION이면 null)
 * @param lease ACQUIRED일 때만 non-null
 */
public record RouteResult(RouteStatus status, String partitionId, Lease lease) {

    public static RouteResult acquired(Lease lease) {
        return new RouteResult(RouteStatus.ACQUIRED, lease.partitionId(), lease);
    }

    public static RouteResult unavailable(RouteStatus status, String partitionId) {
        if (status == RouteStatus.ACQUIRED) {
            throw new IllegalArgumentException("ACQUIRED result requires a lease");
        }
        return new RouteResult(status, partitionId, null);
    }

    public boolean isAcquired() {
        return status == RouteStatus.ACQUIRED;
    }
}
