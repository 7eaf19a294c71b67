package io.allocations.error;

import io.allocations.reconcile.AccountKey;

import java.util.List;

/**
 * Records reconciliation failures for operators.
 */
public interface FailureSink extends AutoCloseable {
    void acceptFailure(String stage, AccountKey key, Exception e);

    /** Most recent failures as JSON objects, newest last. */
    default List<String> recent(int limit) { return List.of(); }

    @Override default void close() {}
}
