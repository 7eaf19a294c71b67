package io.allocations.slurm;

import io.allocations.core.Cluster;
import io.allocations.source.UsageSource;
import io.allocations.source.UsageSourceFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One {@link SlurmUsageSource} per cluster name, all sharing a command runner.
 */
public class SlurmUsageSources implements UsageSourceFactory {
    private final CommandRunner runner;
    private final String sacctmgr;
    private final String sshare;
    private final Map<String, UsageSource> byCluster = new ConcurrentHashMap<>();

    public SlurmUsageSources(CommandRunner runner, String sacctmgr, String sshare) {
        this.runner = runner;
        this.sacctmgr = sacctmgr;
        this.sshare = sshare;
    }

    @Override
    public UsageSource forCluster(Cluster cluster) {
        return byCluster.computeIfAbsent(cluster.name(), name -> new SlurmUsageSource(name, runner, sacctmgr, sshare));
    }
}
