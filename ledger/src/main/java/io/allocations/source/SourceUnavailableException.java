package io.allocations.source;

/**
 * The accounting system could not be reached or did not answer in time. Callers may retry.
 */
public class SourceUnavailableException extends UsageSourceException {
    public SourceUnavailableException(String message) { super(message); }
    public SourceUnavailableException(String message, Throwable cause) { super(message, cause); }
}
