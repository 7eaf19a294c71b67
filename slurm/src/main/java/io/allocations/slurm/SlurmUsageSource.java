package io.allocations.slurm;

import io.allocations.source.AccountNotFoundException;
import io.allocations.source.UsageSource;
import io.allocations.source.UsageSourceException;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Usage and limits of one Slurm cluster, read with {@code sshare} and {@code sacctmgr}. Quantities are the
 * {@code billing} TRES, in minutes for limits ({@code GrpTRESMins}) and raw units for usage ({@code GrpTRESRaw}).
 */
public class SlurmUsageSource implements UsageSource {
    private static final Pattern NAME = Pattern.compile("[A-Za-z0-9._-]+");
    private static final String BILLING = "billing=";

    private final String cluster;
    private final CommandRunner runner;
    private final String sacctmgr;
    private final String sshare;

    public SlurmUsageSource(String cluster, CommandRunner runner, String sacctmgr, String sshare) {
        this.cluster = checkName(cluster);
        this.runner = Objects.requireNonNull(runner);
        this.sacctmgr = Objects.requireNonNull(sacctmgr);
        this.sshare = Objects.requireNonNull(sshare);
    }

    @Override
    public String cluster() { return cluster; }

    @Override
    public Set<String> listAccounts() throws UsageSourceException {
        String out = runner.run(List.of(sacctmgr, "show", "-nP", "account", "withassoc",
                "where", "parents=root", "cluster=" + cluster, "format=Account"));
        return new LinkedHashSet<>(rows(out));
    }

    @Override
    public long getUsage(String account) throws UsageSourceException {
        checkName(account);
        String out = runner.run(List.of(sshare, "-nP", "-A", account, "-M", cluster, "--format=GrpTRESRaw"));
        return billing(firstRow(out, account), account);
    }

    @Override
    public long getLimit(String account) throws UsageSourceException {
        checkName(account);
        String out = runner.run(List.of(sacctmgr, "show", "-nP", "association",
                "where", "account=" + account, "cluster=" + cluster, "format=GrpTRESMins"));
        return billing(firstRow(out, account), account);
    }

    @Override
    public void setLimit(String account, long limit) throws UsageSourceException {
        checkName(account);
        if (limit < 0) throw new IllegalArgumentException("Limit must not be negative: " + limit);
        runner.run(List.of(sacctmgr, "modify", "-i", "account", "where", "account=" + account,
                "cluster=" + cluster, "set", "GrpTRESMins=" + BILLING + limit));
    }

    private String firstRow(String out, String account) throws AccountNotFoundException {
        List<String> rows = rows(out);
        if (rows.isEmpty()) throw new AccountNotFoundException(cluster, account);
        return rows.get(0);
    }

    /** Non-blank lines, minus the {@code CLUSTER:} banner sshare prints when given {@code -M}. */
    static List<String> rows(String out) {
        List<String> rows = new ArrayList<>();
        for (String line : out.split("\\R")) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("CLUSTER:")) continue;
            rows.add(trimmed);
        }
        return rows;
    }

    /** The {@code billing} entry of a TRES list such as {@code cpu=4,mem=100,billing=250}; 0 when absent. */
    long billing(String tres, String account) throws UsageSourceException {
        for (String entry : tres.split(",")) {
            String e = entry.trim();
            if (!e.startsWith(BILLING)) continue;
            try {
                return Long.parseLong(e.substring(BILLING.length()));
            } catch (NumberFormatException ex) {
                throw new UsageSourceException("Unreadable billing value '" + e + "' for " + cluster + "/" + account, ex);
            }
        }
        return 0;
    }

    static String checkName(String name) {
        if (name == null || !NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("Not a valid Slurm name: " + name);
        }
        return name;
    }
}
