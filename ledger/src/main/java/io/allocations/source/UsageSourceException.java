package io.allocations.source;

/**
 * Failure reported by a {@link UsageSource}.
 */
public class UsageSourceException extends Exception {
    public UsageSourceException(String message) { super(message); }
    public UsageSourceException(String message, Throwable cause) { super(message, cause); }
}
