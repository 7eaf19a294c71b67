package io.allocations.source;

import io.allocations.core.Cluster;

@FunctionalInterface
public interface UsageSourceFactory {
    UsageSource forCluster(Cluster cluster);
}
