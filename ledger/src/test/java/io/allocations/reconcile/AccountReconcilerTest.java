package io.allocations.reconcile;

import com.codahale.metrics.MetricRegistry;
import io.allocations.core.Allocation;
import io.allocations.core.Cluster;
import io.allocations.core.Team;
import io.allocations.ledger.AllocationLedger;
import io.allocations.ledger.AllocationState;
import io.allocations.ledger.LedgerException;
import io.allocations.ledger.LedgerTransaction;
import io.allocations.ledger.LedgerWork;
import io.allocations.ledger.TestLedger;
import io.allocations.metrics.Metrics;
import io.allocations.source.InMemoryUsageSource;
import io.allocations.source.SourceUnavailableException;
import io.allocations.source.UsageSourceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AccountReconcilerTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-15T12:00:00Z"), ZoneOffset.UTC);

    private TestLedger t;
    private Cluster cluster;
    private Team team;
    private InMemoryUsageSource source;
    private MetricRegistry registry;
    private AccountReconciler reconciler;

    @BeforeEach
    void setup() throws Exception {
        t = TestLedger.create();
        cluster = t.cluster("smp");
        team = t.team("physics");
        source = new InMemoryUsageSource("smp");
        registry = new MetricRegistry();
        reconciler = new AccountReconciler(t.ledger, Set.of("root"), CLOCK, new Metrics(registry));
    }

    @Test
    void closes_expired_allocation_and_sets_history_plus_active_awards() throws Exception {
        t.award(team, cluster, 1000, LocalDate.of(2024, 1, 1), LocalDate.of(2025, 1, 1));
        Allocation closing = t.award(team, cluster, 500, LocalDate.of(2023, 1, 1), LocalDate.of(2024, 1, 1));
        source.account("physics", 1300, 1200);

        UnitResult result = reconciler.reconcile(cluster, source, "physics");

        assertEquals(UnitResult.Outcome.UPDATED, result.outcome());
        assertEquals(500L, t.allocation(closing.id()).finalUsage());
        assertEquals(1500L, result.newLimit());
        assertEquals(List.of(new InMemoryUsageSource.SetLimitCall("physics", 1500)), source.setLimitCalls());
        assertEquals(1, result.closed().size());
        assertEquals(1, registry.counter(Metrics.ALLOCATIONS_CLOSED).getCount());
    }

    @Test
    void second_run_without_new_usage_changes_nothing() throws Exception {
        t.award(team, cluster, 1000, LocalDate.of(2024, 1, 1), LocalDate.of(2025, 1, 1));
        Allocation closing = t.award(team, cluster, 500, LocalDate.of(2023, 1, 1), LocalDate.of(2024, 1, 1));
        source.account("physics", 1300, 1200);

        UnitResult first = reconciler.reconcile(cluster, source, "physics");
        UnitResult second = reconciler.reconcile(cluster, source, "physics");

        assertEquals(first.newLimit(), second.newLimit());
        assertTrue(second.closed().isEmpty());
        assertEquals(500L, t.allocation(closing.id()).finalUsage());
        assertEquals(1, t.closedCount());
    }

    @Test
    void earlier_expiring_allocation_is_charged_first() throws Exception {
        // created out of expiration order on purpose
        Allocation later = t.award(team, cluster, 500, LocalDate.of(2023, 3, 1), LocalDate.of(2024, 3, 1));
        Allocation earlier = t.award(team, cluster, 300, LocalDate.of(2023, 2, 1), LocalDate.of(2024, 2, 1));
        source.account("physics", 400, 800);

        UnitResult result = reconciler.reconcile(cluster, source, "physics");

        assertEquals(300L, t.allocation(earlier.id()).finalUsage());
        assertEquals(100L, t.allocation(later.id()).finalUsage());
        assertEquals(List.of(earlier.id(), later.id()), result.closed().stream().map(Allocation::id).toList());
        assertEquals(400L, result.newLimit());
    }

    @Test
    void final_usage_never_exceeds_award_nor_goes_negative() throws Exception {
        Allocation a = t.award(team, cluster, 200, LocalDate.of(2023, 2, 1), LocalDate.of(2024, 2, 1));
        Allocation b = t.award(team, cluster, 300, LocalDate.of(2023, 3, 1), LocalDate.of(2024, 3, 1));
        Allocation c = t.award(team, cluster, 400, LocalDate.of(2023, 4, 1), LocalDate.of(2024, 4, 1));
        source.account("physics", 350, 900);

        reconciler.reconcile(cluster, source, "physics");

        assertEquals(200L, t.allocation(a.id()).finalUsage());
        assertEquals(150L, t.allocation(b.id()).finalUsage());
        assertEquals(0L, t.allocation(c.id()).finalUsage());
        assertEquals(350, source.limit("physics"));
    }

    @Test
    void usage_beyond_awards_is_capped_at_total_award() throws Exception {
        Allocation a = t.award(team, cluster, 500, LocalDate.of(2023, 1, 1), LocalDate.of(2024, 1, 1));
        source.account("physics", 9000, 500);

        reconciler.reconcile(cluster, source, "physics");

        assertEquals(500L, t.allocation(a.id()).finalUsage());
        assertEquals(500, source.limit("physics"));
    }

    @Test
    void history_already_in_limit_is_not_charged_again() throws Exception {
        Allocation old = t.award(team, cluster, 400, LocalDate.of(2022, 1, 1), LocalDate.of(2023, 1, 1));
        t.ledger.inTransaction(tx -> { tx.closeAllocation(old.id(), 350); return null; });
        Allocation closing = t.award(team, cluster, 500, LocalDate.of(2023, 1, 1), LocalDate.of(2024, 1, 1));
        t.award(team, cluster, 1000, LocalDate.of(2024, 1, 1), LocalDate.of(2025, 1, 1));
        // limit left by the previous run: 350 history, 500 closing, 1000 active
        source.account("physics", 550, 1850);

        UnitResult result = reconciler.reconcile(cluster, source, "physics");

        assertEquals(200L, t.allocation(closing.id()).finalUsage());
        assertEquals(350L + 200L + 1000L, result.newLimit());
    }

    @Test
    void account_without_team_is_locked_at_current_usage() throws Exception {
        t.award(team, cluster, 1000, LocalDate.of(2023, 1, 1), LocalDate.of(2024, 1, 1));
        source.account("ghost", 777, 5000);

        UnitResult result = reconciler.reconcile(cluster, source, "ghost");

        assertEquals(UnitResult.Outcome.LOCKED_ORPHAN, result.outcome());
        assertEquals(List.of(new InMemoryUsageSource.SetLimitCall("ghost", 777)), source.setLimitCalls());
        assertEquals(0, t.closedCount());
        assertEquals(1, registry.counter(Metrics.ORPHANS_LOCKED).getCount());
    }

    @Test
    void reserved_account_is_never_touched() throws Exception {
        source.account("root", 1, 2);

        UnitResult result = reconciler.reconcile(cluster, source, "root");

        assertEquals(UnitResult.Outcome.SKIPPED_RESERVED, result.outcome());
        assertEquals(0, source.calls());
    }

    @Test
    void failed_limit_push_converges_on_next_run() throws Exception {
        t.award(team, cluster, 1000, LocalDate.of(2024, 1, 1), LocalDate.of(2025, 1, 1));
        Allocation closing = t.award(team, cluster, 500, LocalDate.of(2023, 1, 1), LocalDate.of(2024, 1, 1));
        source.account("physics", 1300, 1200).failNextSetLimits(1);

        assertThrows(SourceUnavailableException.class, () -> reconciler.reconcile(cluster, source, "physics"));
        assertEquals(500L, t.allocation(closing.id()).finalUsage());
        assertEquals(1200, source.limit("physics"));

        UnitResult retried = reconciler.reconcile(cluster, source, "physics");
        assertEquals(1500L, retried.newLimit());
        assertEquals(500L, t.allocation(closing.id()).finalUsage());
    }

    @Test
    void source_failure_while_reading_rolls_back_close_outs() throws Exception {
        Allocation closing = t.award(team, cluster, 500, LocalDate.of(2023, 1, 1), LocalDate.of(2024, 1, 1));
        source.account("physics", 100, 500).failAccount("physics", new SourceUnavailableException("down"));

        assertThrows(SourceUnavailableException.class, () -> reconciler.reconcile(cluster, source, "physics"));
        assertNull(t.allocation(closing.id()).finalUsage());
    }

    @Test
    void concurrently_closed_allocation_keeps_its_value_and_reduces_the_delta() throws Exception {
        Allocation earlier = t.award(team, cluster, 300, LocalDate.of(2023, 2, 1), LocalDate.of(2024, 2, 1));
        Allocation later = t.award(team, cluster, 500, LocalDate.of(2023, 3, 1), LocalDate.of(2024, 3, 1));
        source.account("physics", 400, 800);
        AccountReconciler racing = new AccountReconciler(new RacingLedger(t.ledger, earlier.id(), 100),
                Set.of("root"), CLOCK, new Metrics(registry));

        UnitResult result = racing.reconcile(cluster, source, "physics");

        assertEquals(100L, t.allocation(earlier.id()).finalUsage());
        assertEquals(300L, t.allocation(later.id()).finalUsage());
        assertEquals(List.of(later.id()), result.closed().stream().map(Allocation::id).toList());
        assertEquals(400L, result.newLimit());
    }

    @Test
    void delta_clamps_negative_history_and_negative_delta() {
        assertEquals(1300, AccountReconciler.deltaToApportion(1300, 1200, 1000, 500));
        assertEquals(200, AccountReconciler.deltaToApportion(550, 1850, 1000, 500));
        assertEquals(0, AccountReconciler.deltaToApportion(100, 5000, 0, 0));
    }

    /** Closes one allocation behind the reconciler's back right before it tries to. */
    private static final class RacingLedger implements AllocationLedger {
        private final AllocationLedger delegate;
        private final long allocationId;
        private final long racedFinal;

        RacingLedger(AllocationLedger delegate, long allocationId, long racedFinal) {
            this.delegate = delegate;
            this.allocationId = allocationId;
            this.racedFinal = racedFinal;
        }

        @Override
        public List<Cluster> enabledClusters() throws LedgerException { return delegate.enabledClusters(); }

        @Override
        public Optional<Cluster> findCluster(String name) throws LedgerException { return delegate.findCluster(name); }

        @Override
        public <T> T inTransaction(LedgerWork<T> work) throws LedgerException, UsageSourceException {
            return delegate.inTransaction(tx -> work.run(new LedgerTransaction() {
                @Override
                public Optional<Team> findTeam(String name) throws LedgerException { return tx.findTeam(name); }

                @Override
                public List<Allocation> allocations(long teamId, long clusterId, AllocationState state, LocalDate today) throws LedgerException {
                    return tx.allocations(teamId, clusterId, state, today);
                }

                @Override
                public long sumAwarded(long teamId, long clusterId, AllocationState state, LocalDate today) throws LedgerException {
                    return tx.sumAwarded(teamId, clusterId, state, today);
                }

                @Override
                public long sumFinalUsage(long teamId, long clusterId, LocalDate today) throws LedgerException {
                    return tx.sumFinalUsage(teamId, clusterId, today);
                }

                @Override
                public void closeAllocation(long id, long finalUsage) throws LedgerException {
                    if (id == allocationId) tx.closeAllocation(id, racedFinal);
                    tx.closeAllocation(id, finalUsage);
                }
            }));
        }
    }
}
