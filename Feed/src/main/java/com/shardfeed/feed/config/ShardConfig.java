package com.shardfeed.feed.config;

import com.shardfeed.feed.core.exception.ConfigurationException;
import com.shardfeed.feed.shard.ShardDescriptor;
import com.typesafe.config.Config;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.util.ArrayList;
import java.util.List;

/**
 * shard {
 *   virtual-nodes = 128
 *   pool-capacity = 16
 *   partitions = [ { id = "p1", region = "ap-northeast-2" }, ... ]
 * }
 *
 * 파티션별 pool-capacity / active 는 생략 시 기본값 사용
 */
@Singleton
public final class ShardConfig {
    private final int virtualNodes;
    private final int poolCapacity;
    private final List<ShardDescriptor> partitions;

    @Inject
    public ShardConfig(Config config) {
        Config shard = config.getConfig("shard");
        this.virtualNodes = ConfigurationException.requirePositive("shard.virtual-nodes",
                                                                   shard.getInt("virtual-nodes"));
        this.poolCapacity = ConfigurationException.requirePositive("shard.pool-capacity",
                                                                   shard.getInt("pool-capacity"));

        List<ShardDescriptor> descriptors = new ArrayList<>();
        for (Config partition : shard.getConfigList("partitions")) {
            int capacity = partition.hasPath("pool-capacity") ? partition.getInt("pool-capacity") : poolCapacity;
            boolean active = !partition.hasPath("active") || partition.getBoolean("active");
            descriptors.add(new ShardDescriptor(partition.getString("id"), partition.getString("region"),
                                                active, capacity));
        }
        this.partitions = List.copyOf(descriptors);
    }

    public int getVirtualNodes() {
        return virtualNodes;
    }

    public int getPoolCapacity() {
        return poolCapacity;
    }

    public List<ShardDescriptor> getPartitions() {
        return partitions;
    }
}
