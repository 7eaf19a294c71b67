package io.allocations.core;

/**
 * A compute cluster whose accounts are reconciled against the ledger. Disabled clusters keep their
 * history but are left out of reconciliation passes.
 */
public record Cluster(long id, String name, String description, boolean enabled) {
}
