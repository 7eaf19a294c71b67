package io.allocations.ledger;

import io.allocations.source.UsageSourceException;

/**
 * Work executed inside a single ledger transaction.
 */
@FunctionalInterface
public interface LedgerWork<T> {
    T run(LedgerTransaction tx) throws LedgerException, UsageSourceException;
}
