package io.allocations.slurm;

import io.allocations.source.UsageSourceException;

import java.util.List;

/**
 * Runs an external command and returns what it wrote to standard output.
 */
@FunctionalInterface
public interface CommandRunner {
    String run(List<String> command) throws UsageSourceException;
}
