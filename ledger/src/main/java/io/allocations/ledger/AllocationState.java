package io.allocations.ledger;

/**
 * Partitions of an account's approved allocations on a cluster, relative to a given day.
 * Allocations under requests that are not approved belong to none of them.
 */
public enum AllocationState {
    /** {@code active <= today < expire} */
    ACTIVE("r.active_date <= ? AND r.expire_date > ?", 2),
    /** {@code expire <= today}, final usage not yet recorded */
    CLOSING("r.expire_date <= ? AND a.final_usage IS NULL", 1),
    /** {@code expire <= today}, final usage recorded */
    HISTORICAL("r.expire_date <= ? AND a.final_usage IS NOT NULL", 1);

    private final String predicate;
    private final int dateParameters;

    AllocationState(String predicate, int dateParameters) {
        this.predicate = predicate;
        this.dateParameters = dateParameters;
    }

    String predicate() { return predicate; }
    int dateParameters() { return dateParameters; }
}
