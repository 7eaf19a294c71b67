package io.allocations.service;

import io.allocations.slurm.CommandRunner;
import io.allocations.source.SourceUnavailableException;
import io.allocations.source.UsageSourceException;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Answers sacctmgr and sshare invocations from in-memory usage and limits, the way a single Slurm cluster would.
 */
public class FakeSlurm implements CommandRunner {
    private final Map<String, Long> usage = new TreeMap<>();
    private final Map<String, Long> limits = new TreeMap<>();
    private final Set<String> down = new HashSet<>();

    public synchronized FakeSlurm account(String account, long currentUsage, long currentLimit) {
        usage.put(account, currentUsage);
        limits.put(account, currentLimit);
        return this;
    }

    public synchronized FakeSlurm unavailableFor(String account) {
        down.add(account);
        return this;
    }

    public synchronized long limit(String account) { return limits.get(account); }

    @Override
    public synchronized String run(List<String> command) throws UsageSourceException {
        String account = arg(command, "account=");
        if (account == null && command.contains("-A")) account = command.get(command.indexOf("-A") + 1);
        if (account != null && down.contains(account)) throw new SourceUnavailableException("slurmctld not responding");

        if (command.get(0).equals("sshare")) {
            return usage.containsKey(account) ? "CLUSTER: smp\ncpu=4,billing=" + usage.get(account) + "\n" : "CLUSTER: smp\n";
        }
        if (command.contains("withassoc")) return String.join("\n", usage.keySet()) + "\n";
        if (command.contains("modify")) {
            limits.put(account, Long.parseLong(arg(command, "GrpTRESMins=billing=")));
            return "";
        }
        if (command.contains("association")) return limits.containsKey(account) ? "billing=" + limits.get(account) + "\n" : "";
        throw new IllegalStateException("Unexpected command " + command);
    }

    private static String arg(List<String> command, String prefix) {
        for (String a : command) {
            if (a.startsWith(prefix)) return a.substring(prefix.length());
        }
        return null;
    }
}
