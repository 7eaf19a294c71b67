package io.allocations.reconcile;

import io.allocations.core.Allocation;

import java.util.List;

/**
 * What happened to one account on one cluster during a pass.
 *
 * @param newLimit the limit pushed to the accounting system, or null when none was set
 * @param closed   allocations whose final usage this unit recorded
 * @param error    failure description when the unit failed or timed out
 */
public record UnitResult(AccountKey key, Outcome outcome, Long newLimit, List<Allocation> closed, String error) {

    public enum Outcome {
        /** Allocations closed out as needed and the limit recomputed. */
        UPDATED,
        /** Account unknown to the ledger, frozen at its current usage. */
        LOCKED_ORPHAN,
        /** Reserved account, left untouched. */
        SKIPPED_RESERVED,
        /** Another unit for the same account was in progress. */
        SKIPPED_BUSY,
        FAILED,
        TIMED_OUT
    }

    public UnitResult {
        closed = closed == null ? List.of() : List.copyOf(closed);
    }

    public static UnitResult updated(AccountKey key, long newLimit, List<Allocation> closed) {
        return new UnitResult(key, Outcome.UPDATED, newLimit, closed, null);
    }

    public static UnitResult lockedOrphan(AccountKey key, long limit) {
        return new UnitResult(key, Outcome.LOCKED_ORPHAN, limit, List.of(), null);
    }

    public static UnitResult skippedReserved(AccountKey key) {
        return new UnitResult(key, Outcome.SKIPPED_RESERVED, null, List.of(), null);
    }

    public static UnitResult skippedBusy(AccountKey key) {
        return new UnitResult(key, Outcome.SKIPPED_BUSY, null, List.of(), null);
    }

    public static UnitResult failed(AccountKey key, Exception e) {
        return new UnitResult(key, Outcome.FAILED, null, List.of(), String.valueOf(e));
    }

    public static UnitResult timedOut(AccountKey key, String message) {
        return new UnitResult(key, Outcome.TIMED_OUT, null, List.of(), message);
    }

    public boolean isFailure() { return outcome == Outcome.FAILED || outcome == Outcome.TIMED_OUT; }
}
