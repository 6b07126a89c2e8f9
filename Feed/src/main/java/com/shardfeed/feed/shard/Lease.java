package com.shardfeed.feed.shard;

/**
 * routeAndAcquire 결과로 빌려준 커넥션
 *
 * 호출자는 반드시 ShardManager.release(lease)로 반납해야 한다.
 */
public record Lease(String partitionId, ConnectionHandle handle) {
}
