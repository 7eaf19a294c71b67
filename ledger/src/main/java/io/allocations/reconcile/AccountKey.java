package io.allocations.reconcile;

/**
 * Identity of one unit of reconciliation work. At most one unit per key runs at a time.
 */
public record AccountKey(String cluster, String account) {
    @Override
    public String toString() { return cluster + "/" + account; }
}
