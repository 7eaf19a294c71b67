package io.allocations.ledger;

/**
 * Failure reading or writing the allocation ledger.
 */
public class LedgerException extends Exception {
    public LedgerException(String message) { super(message); }
    public LedgerException(String message, Throwable cause) { super(message, cause); }
}
