package io.allocations.ledger;

/**
 * Raised when closing out an allocation whose final usage has already been recorded.
 */
public class AlreadyClosedException extends LedgerException {
    private final long allocationId;
    private final long existingFinalUsage;

    public AlreadyClosedException(long allocationId, long existingFinalUsage) {
        super("Allocation " + allocationId + " is already closed with final usage " + existingFinalUsage);
        this.allocationId = allocationId;
        this.existingFinalUsage = existingFinalUsage;
    }

    public long allocationId() { return allocationId; }
    public long existingFinalUsage() { return existingFinalUsage; }
}
