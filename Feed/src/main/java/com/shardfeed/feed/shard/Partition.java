package com.shardfeed.feed.shard;

/**
 * 파티션 런타임 상태 (descriptor + 풀 + active 플래그)
 */
public final class Partition {
    private final ShardDescriptor descriptor;
    private final PartitionConnectionPool pool;
    private volatile boolean active;

    Partition(ShardDescriptor descriptor) {
        this.descriptor = descriptor;
        this.pool = new PartitionConnectionPool(descriptor.partitionId(), descriptor.poolCapacity());
        this.active = descriptor.active();
    }

    public String getPartitionId() {
        return descriptor.partitionId();
    }

    public String getRegion() {
        return descriptor.region();
    }

    public ShardDescriptor getDescriptor() {
        return descriptor;
    }

    public PartitionConnectionPool getPool() {
        return pool;
    }

    public boolean isActive() {
        return active;
    }

    void setActive(boolean active) {
        this.active = active;
    }
}
