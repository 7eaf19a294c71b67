package io.allocations.slurm;

import io.allocations.core.Cluster;
import io.allocations.source.AccountNotFoundException;
import io.allocations.source.SourceUnavailableException;
import io.allocations.source.UsageSourceException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SlurmUsageSourceTest {
    private final ScriptedCommandRunner runner = new ScriptedCommandRunner();
    private final SlurmUsageSource source = new SlurmUsageSource("smp", runner, "sacctmgr", "sshare");

    @Test
    void lists_accounts_under_root() throws Exception {
        runner.reply("physics\nchem\n\nroot\n");

        assertEquals(Set.of("physics", "chem", "root"), source.listAccounts());
        assertEquals(List.of("sacctmgr", "show", "-nP", "account", "withassoc", "where", "parents=root",
                "cluster=smp", "format=Account"), runner.commands.get(0));
    }

    @Test
    void usage_is_billing_entry_of_raw_tres() throws Exception {
        runner.reply("CLUSTER: smp\ncpu=1200,mem=4096,energy=0,node=3,billing=1300,fs/disk=0\n");

        assertEquals(1300, source.getUsage("physics"));
        assertEquals(List.of("sshare", "-nP", "-A", "physics", "-M", "smp", "--format=GrpTRESRaw"), runner.commands.get(0));
    }

    @Test
    void limit_is_billing_minutes_of_the_association() throws Exception {
        runner.reply("billing=1500\n");

        assertEquals(1500, source.getLimit("physics"));
        assertEquals(List.of("sacctmgr", "show", "-nP", "association", "where", "account=physics", "cluster=smp",
                "format=GrpTRESMins"), runner.commands.get(0));
    }

    @Test
    void blank_output_means_no_association() {
        runner.reply("\n");
        assertThrows(AccountNotFoundException.class, () -> source.getLimit("physics"));
    }

    @Test
    void limit_without_billing_entry_is_zero() throws Exception {
        runner.reply("cpu=10\n");
        assertEquals(0, source.getLimit("physics"));
    }

    @Test
    void account_with_no_rows_is_not_found() {
        runner.reply("CLUSTER: smp\n");

        AccountNotFoundException e = assertThrows(AccountNotFoundException.class, () -> source.getUsage("ghost"));
        assertEquals("ghost", e.account());
        assertEquals("smp", e.cluster());
    }

    @Test
    void set_limit_modifies_billing_minutes() throws Exception {
        source.setLimit("physics", 1500);

        assertEquals(List.of("sacctmgr", "modify", "-i", "account", "where", "account=physics", "cluster=smp",
                "set", "GrpTRESMins=billing=1500"), runner.commands.get(0));
    }

    @Test
    void garbage_billing_value_is_reported() {
        runner.reply("billing=lots\n");
        UsageSourceException e = assertThrows(UsageSourceException.class, () -> source.getUsage("physics"));
        assertFalse(e instanceof SourceUnavailableException);
    }

    @Test
    void runner_failures_propagate() {
        runner.fail(new SourceUnavailableException("slurmdbd down"));
        assertThrows(SourceUnavailableException.class, () -> source.listAccounts());
    }

    @Test
    void unsafe_names_never_reach_the_command_line() {
        assertThrows(IllegalArgumentException.class, () -> source.getUsage("physics; rm -rf /"));
        assertThrows(IllegalArgumentException.class, () -> source.setLimit("a b", 1));
        assertThrows(IllegalArgumentException.class, () -> new SlurmUsageSource("smp cluster", runner, "sacctmgr", "sshare"));
        assertTrue(runner.commands.isEmpty());
    }

    @Test
    void factory_reuses_one_source_per_cluster() {
        SlurmUsageSources sources = new SlurmUsageSources(runner, "sacctmgr", "sshare");
        Cluster smp = new Cluster(1, "smp", null, true);

        assertSame(sources.forCluster(smp), sources.forCluster(smp));
        assertEquals("gpu", sources.forCluster(new Cluster(2, "gpu", null, true)).cluster());
    }
}
