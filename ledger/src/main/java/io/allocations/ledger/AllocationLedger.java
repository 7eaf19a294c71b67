package io.allocations.ledger;

import io.allocations.core.Cluster;
import io.allocations.source.UsageSourceException;

import java.util.List;
import java.util.Optional;

/**
 * Persistent record of clusters, teams and the allocations they hold.
 */
public interface AllocationLedger {
    List<Cluster> enabledClusters() throws LedgerException;

    Optional<Cluster> findCluster(String name) throws LedgerException;

    /**
     * Run the work in one transaction. Commits when it returns normally, rolls back when it throws.
     */
    <T> T inTransaction(LedgerWork<T> work) throws LedgerException, UsageSourceException;
}
