package io.allocations.core;

import java.time.LocalDate;

/**
 * One award of service units on one cluster under one request.
 * <p>
 * {@code awarded} is null until the request is approved and never changes afterwards. {@code finalUsage} stays
 * null until the allocation is closed out after expiring; once set it is a frozen snapshot.
 * {@code expire} is the parent request's expiration date, carried along for ordering close-outs.
 */
public record Allocation(
        long id,
        long requestId,
        long clusterId,
        long requested,
        Long awarded,
        Long finalUsage,
        LocalDate expire
) {
    public long awardedOrZero() { return awarded == null ? 0L : awarded; }

    public boolean isClosed() { return finalUsage != null; }

    public Allocation withFinalUsage(long finalUsage) {
        return new Allocation(id, requestId, clusterId, requested, awarded, finalUsage, expire);
    }
}
