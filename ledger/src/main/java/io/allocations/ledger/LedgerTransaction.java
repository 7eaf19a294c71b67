package io.allocations.ledger;

import io.allocations.core.Allocation;
import io.allocations.core.Team;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Reads and writes that observe one consistent view of the ledger. Obtained from
 * {@link AllocationLedger#inTransaction(LedgerWork)} and only valid inside that call.
 */
public interface LedgerTransaction {
    Optional<Team> findTeam(String name) throws LedgerException;

    /**
     * Approved allocations of the team on the cluster in the given state, earliest expiration first
     * (ties broken by allocation id).
     */
    List<Allocation> allocations(long teamId, long clusterId, AllocationState state, LocalDate today) throws LedgerException;

    /** Sum of awarded units over the partition; 0 when it is empty. */
    long sumAwarded(long teamId, long clusterId, AllocationState state, LocalDate today) throws LedgerException;

    /** Sum of recorded final usage over expired allocations; 0 when there are none. */
    long sumFinalUsage(long teamId, long clusterId, LocalDate today) throws LedgerException;

    /**
     * Record the final usage of an allocation. The value is written at most once.
     *
     * @throws AlreadyClosedException if a final usage is already recorded
     */
    void closeAllocation(long allocationId, long finalUsage) throws LedgerException;
}
