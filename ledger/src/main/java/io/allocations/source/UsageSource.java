package io.allocations.source;

import java.util.Set;

/**
 * Narrow view of the batch scheduler's accounting system, scoped to one cluster.
 * Quantities are billed service units and are never negative.
 */
public interface UsageSource {
    /** Name of the cluster every call is scoped to. */
    String cluster();

    /** Accounts the accounting system currently recognizes on this cluster. */
    Set<String> listAccounts() throws UsageSourceException;

    /** Cumulative billed usage of the account. */
    long getUsage(String account) throws UsageSourceException;

    /** Usage ceiling currently enforced for the account. */
    long getLimit(String account) throws UsageSourceException;

    /**
     * Replace the enforced ceiling. Implementations must be idempotent: setting the same value twice has the
     * effect of setting it once.
     */
    void setLimit(String account, long limit) throws UsageSourceException;
}
