package io.allocations.source;

/**
 * The accounting system does not know the account. Never retried.
 */
public class AccountNotFoundException extends UsageSourceException {
    private final String cluster;
    private final String account;

    public AccountNotFoundException(String cluster, String account) {
        super("Account " + account + " not found on cluster " + cluster);
        this.cluster = cluster;
        this.account = account;
    }

    public String cluster() { return cluster; }
    public String account() { return account; }
}
