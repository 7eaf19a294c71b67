package io.allocations.ledger;

/**
 * The relational store failed. The current unit of work is abandoned and picked up again by the next pass.
 */
public class LedgerUnavailableException extends LedgerException {
    public LedgerUnavailableException(String message, Throwable cause) { super(message, cause); }
}
