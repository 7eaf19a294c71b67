package io.allocations.reconcile;

import com.codahale.metrics.Counter;
import io.allocations.core.Allocation;
import io.allocations.core.Cluster;
import io.allocations.core.Team;
import io.allocations.ledger.AllocationLedger;
import io.allocations.ledger.AllocationState;
import io.allocations.ledger.AlreadyClosedException;
import io.allocations.ledger.LedgerException;
import io.allocations.ledger.LedgerTransaction;
import io.allocations.metrics.Metrics;
import io.allocations.source.UsageSource;
import io.allocations.source.UsageSourceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Brings one account's enforced limit on one cluster in line with the ledger.
 * <p>
 * The limit pushed to the accounting system is always {@code historicalUsage + activeAwarded}: the frozen usage
 * of every closed allocation plus the units awarded to allocations in force today. Allocations that expired
 * since the last run are closed out first, earliest expiration first, by charging them the usage that accrued
 * beyond what the previous limit already folded into history:
 * <pre>
 *   delta = currentUsage - max(0, currentLimit - activeAwarded - closingAwarded)
 *   final = min(delta, awarded); delta = max(0, delta - final)
 * </pre>
 * The delta assumes the current limit was set by a previous run of this same computation. A limit edited by
 * hand in the accounting system makes it unreliable.
 * <p>
 * Ledger reads and close-outs happen in one transaction; the new limit is pushed after it commits. If pushing
 * fails the ledger is ahead of the accounting system, and the next run converges because the closed
 * allocations then count as history.
 * <p>
 * Not safe to run concurrently for the same account; callers serialize per {@link AccountKey}.
 */
public class AccountReconciler {
    private static final Logger log = LoggerFactory.getLogger(AccountReconciler.class);

    private final AllocationLedger ledger;
    private final Set<String> reservedAccounts;
    private final Clock clock;
    private final Counter closedCounter;
    private final Counter orphansCounter;
    private final Counter limitsCounter;

    public AccountReconciler(AllocationLedger ledger, Set<String> reservedAccounts, Clock clock, Metrics metrics) {
        this.ledger = Objects.requireNonNull(ledger);
        this.reservedAccounts = Set.copyOf(reservedAccounts);
        this.clock = Objects.requireNonNull(clock);
        this.closedCounter = metrics.counter(Metrics.ALLOCATIONS_CLOSED);
        this.orphansCounter = metrics.counter(Metrics.ORPHANS_LOCKED);
        this.limitsCounter = metrics.counter(Metrics.LIMITS_SET);
    }

    public boolean isReserved(String account) { return reservedAccounts.contains(account); }

    public UnitResult reconcile(Cluster cluster, UsageSource source, String account) throws LedgerException, UsageSourceException {
        AccountKey key = new AccountKey(cluster.name(), account);
        if (isReserved(account)) {
            log.debug("Leaving reserved account {} untouched", key);
            return UnitResult.skippedReserved(key);
        }
        LocalDate today = LocalDate.now(clock);

        Optional<Apportionment> apportionment = ledger.inTransaction(tx -> {
            Optional<Team> team = tx.findTeam(account);
            if (team.isEmpty()) return Optional.empty();
            return Optional.of(closeOut(tx, team.get(), cluster, source, account, today));
        });

        if (apportionment.isEmpty()) {
            long usage = source.getUsage(account);
            log.warn("No team found for account {}, locking it at its current usage {}", key, usage);
            source.setLimit(account, usage);
            orphansCounter.inc();
            limitsCounter.inc();
            return UnitResult.lockedOrphan(key, usage);
        }

        Apportionment a = apportionment.get();
        source.setLimit(account, a.newLimit());
        limitsCounter.inc();
        log.info("Set limit of {} to {} (historical usage {}, active awards {}, closed {} allocations)",
                key, a.newLimit(), a.historicalUsage(), a.activeAwarded(), a.closed().size());
        return UnitResult.updated(key, a.newLimit(), a.closed());
    }

    private Apportionment closeOut(LedgerTransaction tx, Team team, Cluster cluster, UsageSource source,
                                   String account, LocalDate today) throws LedgerException, UsageSourceException {
        long teamId = team.id();
        long clusterId = cluster.id();

        long activeAwarded = tx.sumAwarded(teamId, clusterId, AllocationState.ACTIVE, today);
        List<Allocation> closing = tx.allocations(teamId, clusterId, AllocationState.CLOSING, today);
        long closingAwarded = tx.sumAwarded(teamId, clusterId, AllocationState.CLOSING, today);

        long currentLimit = source.getLimit(account);
        long currentUsage = source.getUsage(account);
        long delta = deltaToApportion(currentUsage, currentLimit, activeAwarded, closingAwarded);
        log.debug("Usage {} limit {} active {} closing {} -> {} units to apportion over {} closing allocations",
                currentUsage, currentLimit, activeAwarded, closingAwarded, delta, closing.size());

        List<Allocation> closed = new ArrayList<>();
        for (Allocation allocation : closing) {
            long finalUsage = Math.min(delta, allocation.awardedOrZero());
            try {
                tx.closeAllocation(allocation.id(), finalUsage);
                closed.add(allocation.withFinalUsage(finalUsage));
                closedCounter.inc();
                log.debug("Closed allocation {} (awarded {}, expired {}) with final usage {}",
                        allocation.id(), allocation.awardedOrZero(), allocation.expire(), finalUsage);
            } catch (AlreadyClosedException e) {
                // closed by a concurrent run; its recorded usage is what was apportioned to it
                log.warn("Allocation {} was closed concurrently with final usage {}", e.allocationId(), e.existingFinalUsage());
                finalUsage = e.existingFinalUsage();
            }
            delta = Math.max(0, delta - finalUsage);
        }

        long historicalUsage = tx.sumFinalUsage(teamId, clusterId, today);
        long activeNow = tx.sumAwarded(teamId, clusterId, AllocationState.ACTIVE, today);
        return new Apportionment(historicalUsage, activeNow, historicalUsage + activeNow, closed);
    }

    /**
     * Usage accrued beyond what the current limit already accounts for as history. Neither the history folded
     * into the limit nor the result ever goes below zero.
     */
    static long deltaToApportion(long currentUsage, long currentLimit, long activeAwarded, long closingAwarded) {
        long foldedHistory = Math.max(0, currentLimit - activeAwarded - closingAwarded);
        return Math.max(0, currentUsage - foldedHistory);
    }

    private record Apportionment(long historicalUsage, long activeAwarded, long newLimit, List<Allocation> closed) {
    }
}
