package com.shardfeed.feed.shard;

import com.shardfeed.feed.core.exception.ConfigurationException;

/**
 * 파티션 설정 (운영자가 용량 추가 시 생성)
 */
public record ShardDescriptor(String partitionId, String region, boolean active, int poolCapacity) {

    public ShardDescriptor {
        if (partitionId == null || partitionId.isEmpty()) {
            throw new ConfigurationException("partitionId must not be empty");
        }
        if (region == null || region.isEmpty()) {
            throw new ConfigurationException("region must not be empty: partition=" + partitionId);
        }
        ConfigurationException.requirePositive("pool capacity (" + partitionId + ")", poolCapacity);
    }

    public static ShardDescriptor of(String partitionId, String region, int poolCapacity) {
        return new ShardDescriptor(partitionId, region, true, poolCapacity);
    }
}
