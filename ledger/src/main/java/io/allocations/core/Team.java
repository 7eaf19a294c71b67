package io.allocations.core;

/**
 * A team holding allocations. The name doubles as the account name in the external accounting system.
 */
public record Team(long id, String name, boolean active) {
}
